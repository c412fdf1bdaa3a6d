package com.mimecast.replyrouter.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Structured view of an inbound email.
 *
 * <p>Address and id lists keep header order since routing key resolution depends on it.
 * <br>Message ids are stored without angle brackets.
 */
public class ParsedMessage {
    private final List<String> from;
    private final List<String> to;
    private final List<String> references;
    private final String subject;
    private final String headerBlob;
    private final String body;
    private final List<MessageAttachment> attachments;

    /**
     * Constructs a new ParsedMessage instance.
     *
     * @param builder Builder instance.
     */
    private ParsedMessage(Builder builder) {
        this.from = Collections.unmodifiableList(new ArrayList<>(builder.from));
        this.to = Collections.unmodifiableList(new ArrayList<>(builder.to));
        this.references = Collections.unmodifiableList(new ArrayList<>(builder.references));
        this.subject = builder.subject;
        this.headerBlob = builder.headerBlob;
        this.body = builder.body;
        this.attachments = Collections.unmodifiableList(new ArrayList<>(builder.attachments));
    }

    /**
     * Gets sender address candidates.
     *
     * @return List of addresses.
     */
    public List<String> getFrom() {
        return from;
    }

    /**
     * Gets recipient addresses.
     *
     * @return List of addresses.
     */
    public List<String> getTo() {
        return to;
    }

    /**
     * Gets referenced message ids.
     *
     * @return List of message ids, empty if the header is absent.
     */
    public List<String> getReferences() {
        return references;
    }

    public String getSubject() {
        return subject;
    }

    /**
     * Gets the raw header section.
     *
     * @return Header text.
     */
    public String getHeaderBlob() {
        return headerBlob;
    }

    public String getBody() {
        return body;
    }

    public List<MessageAttachment> getAttachments() {
        return attachments;
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
     * ParsedMessage builder.
     */
    public static class Builder {
        private final List<String> from = new ArrayList<>();
        private final List<String> to = new ArrayList<>();
        private final List<String> references = new ArrayList<>();
        private String subject = "";
        private String headerBlob = "";
        private String body = "";
        private final List<MessageAttachment> attachments = new ArrayList<>();

        public Builder addFrom(String address) {
            from.add(address);
            return this;
        }

        public Builder addTo(String address) {
            to.add(address);
            return this;
        }

        public Builder addReference(String messageId) {
            references.add(messageId);
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder headerBlob(String headerBlob) {
            this.headerBlob = headerBlob;
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder addAttachment(MessageAttachment attachment) {
            attachments.add(attachment);
            return this;
        }

        public ParsedMessage build() {
            return new ParsedMessage(this);
        }
    }
}
