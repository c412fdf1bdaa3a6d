package com.mimecast.replyrouter.worker;

import com.mimecast.replyrouter.exception.ProcessingException;

/**
 * Maps rejections to the reason shown to the sender.
 */
public final class RejectionReason {

    static final String ROUTING_NOT_FOUND = "We couldn't figure out what the email is in reply to. "
            + "Please create your comment through the web interface.";

    static final String EMPTY = "Your email was empty or we couldn't find any text in it. "
            + "Please make sure your reply is written above the quoted text.";

    static final String AUTO_GENERATED = "The email was marked as being auto-generated.";

    static final String UNPARSABLE = "The email could not be read. "
            + "Please check its character encoding and send it again.";

    /**
     * Private constructor for utility class.
     */
    private RejectionReason() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Gets the reason for a rejection.
     *
     * @param e Rejection.
     * @return Reason text.
     */
    public static String of(ProcessingException e) {
        switch (e.getKind()) {
            case ROUTING_NOT_FOUND:
                return ROUTING_NOT_FOUND;
            case EMPTY_INPUT:
            case EMPTY_REPLY:
                return EMPTY;
            case AUTO_GENERATED_EMAIL:
                return AUTO_GENERATED;
            case EMAIL_UNPARSABLE:
                return UNPARSABLE;
            default:
                // User and validation rejections carry their own wording.
                return e.getMessage();
        }
    }
}
