package com.mimecast.replyrouter.service;

import com.mimecast.replyrouter.domain.ParsedMessage;
import com.mimecast.replyrouter.domain.Project;
import com.mimecast.replyrouter.domain.UploadedAttachment;

import java.util.List;

/**
 * Attachment uploader interface.
 */
public interface AttachmentUploader {

    /**
     * Persists the message attachments for a project.
     * <p>Calling it twice for the same message stores the attachments twice.
     *
     * @param message Parsed message.
     * @param project Target project.
     * @return Uploaded attachments in message order.
     */
    List<UploadedAttachment> process(ParsedMessage message, Project project);
}
