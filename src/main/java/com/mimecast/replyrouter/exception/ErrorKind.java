package com.mimecast.replyrouter.exception;

/**
 * Kinds of inbound email rejection.
 * <p>All of them are permanent for a given message; retrying the same input yields the same kind.
 */
public enum ErrorKind {
    EMPTY_INPUT,
    EMAIL_UNPARSABLE,
    ROUTING_NOT_FOUND,
    USER_NOT_FOUND,
    USER_BLOCKED,
    USER_NOT_AUTHORIZED,
    AUTO_GENERATED_EMAIL,
    NOTEABLE_NOT_FOUND,
    INVALID_NOTE,
    INVALID_ISSUE,
    EMPTY_REPLY
}
