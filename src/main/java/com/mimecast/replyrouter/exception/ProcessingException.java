package com.mimecast.replyrouter.exception;

/**
 * Base exception for inbound emails that cannot be turned into content.
 *
 * <p>Each subclass maps to exactly one {@link ErrorKind}.
 * <br>Callers may switch on the kind to decide whether the sender gets a rejection notice.
 */
public abstract class ProcessingException extends Exception {

    /**
     * Error kind.
     */
    private final ErrorKind kind;

    /**
     * Constructs a new ProcessingException.
     *
     * @param kind    Error kind.
     * @param message Error message.
     */
    protected ProcessingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Constructs a new ProcessingException with cause.
     *
     * @param kind    Error kind.
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    protected ProcessingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Gets error kind.
     *
     * @return ErrorKind.
     */
    public ErrorKind getKind() {
        return kind;
    }
}
