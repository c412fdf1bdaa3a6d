package com.mimecast.replyrouter.exception;

/**
 * Raw message is empty or whitespace only.
 */
public class EmptyInputException extends ProcessingException {

    public EmptyInputException() {
        this("The email was empty.");
    }

    public EmptyInputException(String message) {
        super(ErrorKind.EMPTY_INPUT, message);
    }
}
