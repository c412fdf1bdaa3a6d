package com.mimecast.replyrouter.exception;

/**
 * Raw message could not be decoded into a structured email.
 * <p>Usually a character encoding failure; the underlying parser error is kept as the cause.
 */
public class EmailUnparsableException extends ProcessingException {

    public EmailUnparsableException(Throwable cause) {
        super(ErrorKind.EMAIL_UNPARSABLE, "The email could not be parsed: " + cause.getMessage(), cause);
    }
}
