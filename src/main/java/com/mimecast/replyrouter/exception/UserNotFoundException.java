package com.mimecast.replyrouter.exception;

/**
 * No user was found for the acting address.
 */
public class UserNotFoundException extends ProcessingException {

    public UserNotFoundException() {
        this("The sender of the email could not be matched to a user.");
    }

    public UserNotFoundException(String message) {
        super(ErrorKind.USER_NOT_FOUND, message);
    }
}
