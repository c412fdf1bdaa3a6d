package com.mimecast.replyrouter.exception;

/**
 * Header section carries an auto-generated or auto-replied marker.
 */
public class AutoGeneratedEmailException extends ProcessingException {

    public AutoGeneratedEmailException() {
        this("The email was marked as being auto-generated.");
    }

    public AutoGeneratedEmailException(String message) {
        super(ErrorKind.AUTO_GENERATED_EMAIL, message);
    }
}
