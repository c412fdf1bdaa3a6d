package com.mimecast.replyrouter.domain;

import java.util.List;

/**
 * Outcome of a note or issue creation.
 *
 * @param persisted Whether the record was saved.
 * @param errors    Validation messages when not saved.
 */
public record CreationResult(boolean persisted, List<String> errors) {

    public CreationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Successful creation.
     *
     * @return CreationResult instance.
     */
    public static CreationResult success() {
        return new CreationResult(true, List.of());
    }

    /**
     * Failed creation.
     *
     * @param errors Validation messages.
     * @return CreationResult instance.
     */
    public static CreationResult failure(List<String> errors) {
        return new CreationResult(false, errors);
    }
}
