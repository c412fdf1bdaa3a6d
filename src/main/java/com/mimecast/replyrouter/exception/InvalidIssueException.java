package com.mimecast.replyrouter.exception;

import java.util.List;

/**
 * Issue could not be created from the email.
 */
public class InvalidIssueException extends InvalidRecordException {
    public static final String HEADER = "The issue could not be created for the following reasons:";

    public InvalidIssueException(List<String> errors) {
        super(ErrorKind.INVALID_ISSUE, HEADER, errors);
    }
}
