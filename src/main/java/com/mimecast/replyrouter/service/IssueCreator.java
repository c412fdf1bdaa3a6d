package com.mimecast.replyrouter.service;

import com.mimecast.replyrouter.domain.CreationResult;
import com.mimecast.replyrouter.domain.IssueRequest;

/**
 * Issue creation service.
 */
public interface IssueCreator {

    /**
     * Creates an issue.
     *
     * @param request Issue request.
     * @return CreationResult with validation messages when not persisted.
     */
    CreationResult create(IssueRequest request);
}
