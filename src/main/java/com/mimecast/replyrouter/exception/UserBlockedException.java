package com.mimecast.replyrouter.exception;

/**
 * Acting user is blocked.
 */
public class UserBlockedException extends ProcessingException {

    public UserBlockedException() {
        this("Your account has been blocked.");
    }

    public UserBlockedException(String message) {
        super(ErrorKind.USER_BLOCKED, message);
    }
}
