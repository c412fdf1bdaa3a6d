package com.mimecast.replyrouter.exception;

import java.util.List;

/**
 * Note could not be created from the reply.
 */
public class InvalidNoteException extends InvalidRecordException {
    public static final String HEADER = "The comment could not be created for the following reasons:";

    public InvalidNoteException(List<String> errors) {
        super(ErrorKind.INVALID_NOTE, HEADER, errors);
    }
}
