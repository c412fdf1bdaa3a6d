package com.mimecast.replyrouter.service;

/**
 * Raw message bytes could not be decoded.
 */
public class MailParseException extends Exception {

    public MailParseException(String message) {
        super(message);
    }

    public MailParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
