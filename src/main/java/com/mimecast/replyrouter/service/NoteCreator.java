package com.mimecast.replyrouter.service;

import com.mimecast.replyrouter.domain.CreationResult;
import com.mimecast.replyrouter.domain.NoteRequest;

/**
 * Note creation service.
 */
public interface NoteCreator {

    /**
     * Creates a note.
     *
     * @param request Note request.
     * @return CreationResult with validation messages when not persisted.
     */
    CreationResult create(NoteRequest request);
}
