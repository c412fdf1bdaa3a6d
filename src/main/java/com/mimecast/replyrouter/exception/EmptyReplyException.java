package com.mimecast.replyrouter.exception;

/**
 * Nothing is left once quoted text and signatures are removed.
 */
public class EmptyReplyException extends ProcessingException {

    public EmptyReplyException() {
        this("The email did not contain any reply text.");
    }

    public EmptyReplyException(String message) {
        super(ErrorKind.EMPTY_REPLY, message);
    }
}
