package com.mimecast.replyrouter.service;

import java.util.Objects;

/**
 * Container for the collaborators the receiver calls.
 *
 * <p>All collaborators are required. Instances are immutable and may be shared between receivers.
 */
public class ReceiverServices {
    private final MailParser mailParser;
    private final UserLookup userLookup;
    private final AuthorizationPolicy authorizationPolicy;
    private final ProjectResolver projectResolver;
    private final SentNotificationStore sentNotificationStore;
    private final ReplyParser replyParser;
    private final AttachmentUploader attachmentUploader;
    private final NoteCreator noteCreator;
    private final IssueCreator issueCreator;

    /**
     * Constructs a new ReceiverServices instance.
     *
     * @param builder Builder instance.
     */
    private ReceiverServices(Builder builder) {
        this.mailParser = Objects.requireNonNull(builder.mailParser, "mailParser");
        this.userLookup = Objects.requireNonNull(builder.userLookup, "userLookup");
        this.authorizationPolicy = Objects.requireNonNull(builder.authorizationPolicy, "authorizationPolicy");
        this.projectResolver = Objects.requireNonNull(builder.projectResolver, "projectResolver");
        this.sentNotificationStore = Objects.requireNonNull(builder.sentNotificationStore, "sentNotificationStore");
        this.replyParser = Objects.requireNonNull(builder.replyParser, "replyParser");
        this.attachmentUploader = Objects.requireNonNull(builder.attachmentUploader, "attachmentUploader");
        this.noteCreator = Objects.requireNonNull(builder.noteCreator, "noteCreator");
        this.issueCreator = Objects.requireNonNull(builder.issueCreator, "issueCreator");
    }

    public MailParser getMailParser() {
        return mailParser;
    }

    public UserLookup getUserLookup() {
        return userLookup;
    }

    public AuthorizationPolicy getAuthorizationPolicy() {
        return authorizationPolicy;
    }

    public ProjectResolver getProjectResolver() {
        return projectResolver;
    }

    public SentNotificationStore getSentNotificationStore() {
        return sentNotificationStore;
    }

    public ReplyParser getReplyParser() {
        return replyParser;
    }

    public AttachmentUploader getAttachmentUploader() {
        return attachmentUploader;
    }

    public NoteCreator getNoteCreator() {
        return noteCreator;
    }

    public IssueCreator getIssueCreator() {
        return issueCreator;
    }

    /**
     * Creates a new builder.
     *
     * @return Builder instance.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * ReceiverServices builder.
     */
    public static class Builder {
        private MailParser mailParser;
        private UserLookup userLookup;
        private AuthorizationPolicy authorizationPolicy;
        private ProjectResolver projectResolver;
        private SentNotificationStore sentNotificationStore;
        private ReplyParser replyParser;
        private AttachmentUploader attachmentUploader;
        private NoteCreator noteCreator;
        private IssueCreator issueCreator;

        public Builder mailParser(MailParser mailParser) {
            this.mailParser = mailParser;
            return this;
        }

        public Builder userLookup(UserLookup userLookup) {
            this.userLookup = userLookup;
            return this;
        }

        public Builder authorizationPolicy(AuthorizationPolicy authorizationPolicy) {
            this.authorizationPolicy = authorizationPolicy;
            return this;
        }

        public Builder projectResolver(ProjectResolver projectResolver) {
            this.projectResolver = projectResolver;
            return this;
        }

        public Builder sentNotificationStore(SentNotificationStore sentNotificationStore) {
            this.sentNotificationStore = sentNotificationStore;
            return this;
        }

        public Builder replyParser(ReplyParser replyParser) {
            this.replyParser = replyParser;
            return this;
        }

        public Builder attachmentUploader(AttachmentUploader attachmentUploader) {
            this.attachmentUploader = attachmentUploader;
            return this;
        }

        public Builder noteCreator(NoteCreator noteCreator) {
            this.noteCreator = noteCreator;
            return this;
        }

        public Builder issueCreator(IssueCreator issueCreator) {
            this.issueCreator = issueCreator;
            return this;
        }

        /**
         * Builds the container.
         *
         * @return ReceiverServices instance.
         * @throws NullPointerException If a collaborator is missing.
         */
        public ReceiverServices build() {
            return new ReceiverServices(this);
        }
    }
}
