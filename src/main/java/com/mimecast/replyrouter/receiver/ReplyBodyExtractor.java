package com.mimecast.replyrouter.receiver;

import com.mimecast.replyrouter.domain.ParsedMessage;
import com.mimecast.replyrouter.domain.Project;
import com.mimecast.replyrouter.domain.UploadedAttachment;
import com.mimecast.replyrouter.exception.EmptyReplyException;
import com.mimecast.replyrouter.service.AttachmentUploader;
import com.mimecast.replyrouter.service.ReplyParser;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Builds the body of the note or issue from an inbound message.
 *
 * <p>The reply text is stripped of quoted history, trimmed and must not be blank.
 * <br>Attachments are uploaded afterwards and their references appended, each after a blank line.
 * <p>Not idempotent: each call uploads the attachments again.
 */
public class ReplyBodyExtractor {
    private static final Logger log = LogManager.getLogger(ReplyBodyExtractor.class);

    /**
     * Separator between the reply and each attachment reference.
     */
    static final String SEPARATOR = "\n\n";

    private final ReplyParser replyParser;
    private final AttachmentUploader attachmentUploader;

    /**
     * Constructs a new ReplyBodyExtractor instance.
     *
     * @param replyParser        Quote stripper.
     * @param attachmentUploader Attachment uploader.
     */
    public ReplyBodyExtractor(ReplyParser replyParser, AttachmentUploader attachmentUploader) {
        this.replyParser = replyParser;
        this.attachmentUploader = attachmentUploader;
    }

    /**
     * Extracts the body.
     *
     * @param message Parsed message.
     * @param project Project the attachments are uploaded to.
     * @return Body with attachment references.
     * @throws EmptyReplyException Nothing left after quote stripping.
     */
    public String extract(ParsedMessage message, Project project) throws EmptyReplyException {
        String reply = StringUtils.trimToEmpty(replyParser.extractReply(message));
        if (reply.isEmpty()) {
            throw new EmptyReplyException();
        }

        StringBuilder body = new StringBuilder(reply);
        List<UploadedAttachment> attachments = attachmentUploader.process(message, project);
        for (UploadedAttachment attachment : attachments) {
            body.append(SEPARATOR).append(attachment.markdown());
        }

        log.debug("Extracted reply of {} chars with {} attachments", reply.length(), attachments.size());
        return body.toString();
    }
}
