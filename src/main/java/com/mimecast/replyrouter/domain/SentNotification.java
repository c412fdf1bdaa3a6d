package com.mimecast.replyrouter.domain;

import java.util.Optional;

/**
 * Record of a notification email sent to a user.
 *
 * <p>Replies to that email carry its reply key and are turned into notes on the discussed item.
 * <br>Instances are created when the notification is sent and only read afterwards.
 */
public class SentNotification {

    /**
     * Reply key the notification was sent with.
     */
    private final String replyKey;

    /**
     * User the notification was sent to.
     */
    private final User recipient;

    /**
     * Project of the discussed item.
     */
    private final Project project;

    /**
     * Discussed item, null when it no longer exists.
     */
    private final Noteable noteable;

    private final String noteableType;
    private final Long noteableId;
    private final String commitId;
    private final String lineCode;

    /**
     * Constructs a new SentNotification instance.
     *
     * @param builder Builder instance.
     */
    private SentNotification(Builder builder) {
        this.replyKey = builder.replyKey;
        this.recipient = builder.recipient;
        this.project = builder.project;
        this.noteable = builder.noteable;
        this.noteableType = builder.noteableType;
        this.noteableId = builder.noteableId;
        this.commitId = builder.commitId;
        this.lineCode = builder.lineCode;
    }

    public String getReplyKey() {
        return replyKey;
    }

    public User getRecipient() {
        return recipient;
    }

    public Project getProject() {
        return project;
    }

    /**
     * Gets the discussed item.
     *
     * @return Optional of Noteable, empty if the item is gone.
     */
    public Optional<Noteable> getNoteable() {
        return Optional.ofNullable(noteable);
    }

    public String getNoteableType() {
        return noteableType;
    }

    public Long getNoteableId() {
        return noteableId;
    }

    public String getCommitId() {
        return commitId;
    }

    public String getLineCode() {
        return lineCode;
    }

    /**
     * Creates a new builder.
     *
     * @param replyKey Reply key.
     * @return Builder instance.
     */
    public static Builder builder(String replyKey) {
        return new Builder(replyKey);
    }

    /**
     * SentNotification builder.
     */
    public static class Builder {
        private final String replyKey;
        private User recipient;
        private Project project;
        private Noteable noteable;
        private String noteableType;
        private Long noteableId;
        private String commitId;
        private String lineCode;

        private Builder(String replyKey) {
            this.replyKey = replyKey;
        }

        public Builder recipient(User recipient) {
            this.recipient = recipient;
            return this;
        }

        public Builder project(Project project) {
            this.project = project;
            return this;
        }

        /**
         * Sets the discussed item and copies its type and id into the threading fields.
         *
         * @param noteable Noteable.
         * @return Self.
         */
        public Builder noteable(Noteable noteable) {
            this.noteable = noteable;
            if (noteable != null) {
                this.noteableType = noteable.type();
                if (noteable.id() != null && noteable.id().matches("\\d+")) {
                    try {
                        this.noteableId = Long.parseLong(noteable.id());
                    } catch (NumberFormatException e) {
                        // All-digit commit ids overflow a long and carry no numeric id.
                        this.noteableId = null;
                    }
                }
            }
            return this;
        }

        public Builder noteableType(String noteableType) {
            this.noteableType = noteableType;
            return this;
        }

        public Builder noteableId(Long noteableId) {
            this.noteableId = noteableId;
            return this;
        }

        public Builder commitId(String commitId) {
            this.commitId = commitId;
            return this;
        }

        public Builder lineCode(String lineCode) {
            this.lineCode = lineCode;
            return this;
        }

        public SentNotification build() {
            return new SentNotification(this);
        }
    }
}
