package com.mimecast.replyrouter.exception;

/**
 * Acting user lacks the capability on the project, or the project is gone.
 */
public class UserNotAuthorizedException extends ProcessingException {

    public UserNotAuthorizedException() {
        this("You are not allowed to perform this action.");
    }

    public UserNotAuthorizedException(String message) {
        super(ErrorKind.USER_NOT_AUTHORIZED, message);
    }
}
