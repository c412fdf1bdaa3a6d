package com.mimecast.replyrouter.exception;

/**
 * Sent notification no longer points to an existing item.
 */
public class NoteableNotFoundException extends ProcessingException {

    public NoteableNotFoundException() {
        this("The thread you are replying to no longer exists.");
    }

    public NoteableNotFoundException(String message) {
        super(ErrorKind.NOTEABLE_NOT_FOUND, message);
    }
}
