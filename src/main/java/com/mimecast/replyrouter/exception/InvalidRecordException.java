package com.mimecast.replyrouter.exception;

import java.util.List;

/**
 * Creation service refused to persist a record.
 *
 * <p>Keeps the validation messages as a list.
 * <br>The exception message renders them under a header line, one bullet per message.
 */
public abstract class InvalidRecordException extends ProcessingException {

    /**
     * Validation messages as returned by the creation service.
     */
    private final List<String> errors;

    /**
     * Constructs a new InvalidRecordException.
     *
     * @param kind   Error kind.
     * @param header Header line.
     * @param errors Validation messages.
     */
    protected InvalidRecordException(ErrorKind kind, String header, List<String> errors) {
        super(kind, render(header, errors));
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Gets validation messages.
     *
     * @return Unmodifiable list of messages.
     */
    public List<String> getErrors() {
        return errors;
    }

    private static String render(String header, List<String> errors) {
        StringBuilder message = new StringBuilder(header);
        if (errors != null) {
            for (String error : errors) {
                message.append("\n\n- ").append(error);
            }
        }
        return message.toString();
    }
}
