package com.mimecast.replyrouter.attachment;

import com.mimecast.replyrouter.config.IncomingEmailConfig;
import com.mimecast.replyrouter.domain.MessageAttachment;
import com.mimecast.replyrouter.domain.ParsedMessage;
import com.mimecast.replyrouter.domain.Project;
import com.mimecast.replyrouter.domain.UploadedAttachment;
import com.mimecast.replyrouter.service.AttachmentUploader;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Local attachment uploader implementation.
 *
 * <p>Saves attachments on disk under {@code <storagePath>/<project path>/<sha256>/<file name>}
 * <br>and returns markdown links under {@code <urlPrefix>/<project path>/<sha256>/<file name>}.
 * <p>Images are linked as inline images.
 */
public class LocalAttachmentUploader implements AttachmentUploader {
    private static final Logger log = LogManager.getLogger(LocalAttachmentUploader.class);

    /**
     * Storage root.
     */
    private final Path storagePath;

    /**
     * URL prefix.
     */
    private final String urlPrefix;

    /**
     * Constructs a new LocalAttachmentUploader instance from configuration.
     *
     * @param config IncomingEmailConfig instance.
     */
    public LocalAttachmentUploader(IncomingEmailConfig config) {
        this(Paths.get(config.getAttachmentStoragePath()), config.getAttachmentUrlPrefix());
    }

    /**
     * Constructs a new LocalAttachmentUploader instance.
     *
     * @param storagePath Storage root.
     * @param urlPrefix   URL prefix.
     */
    public LocalAttachmentUploader(Path storagePath, String urlPrefix) {
        this.storagePath = storagePath;
        this.urlPrefix = StringUtils.removeEnd(urlPrefix, "/");
    }

    @Override
    public List<UploadedAttachment> process(ParsedMessage message, Project project) {
        List<UploadedAttachment> uploaded = new ArrayList<>();
        for (MessageAttachment attachment : message.getAttachments()) {
            uploaded.add(upload(attachment, project));
        }
        return uploaded;
    }

    /**
     * Saves one attachment.
     *
     * @param attachment Attachment.
     * @param project    Project.
     * @return UploadedAttachment.
     * @throws UncheckedIOException Unable to write file.
     */
    private UploadedAttachment upload(MessageAttachment attachment, Project project) {
        String fileName = sanitize(attachment.fileName());
        String hash = DigestUtils.sha256Hex(attachment.content());
        String relative = project.getFullPath() + "/" + hash + "/" + fileName;

        Path target = storagePath.resolve(project.getFullPath()).resolve(hash).resolve(fileName);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, attachment.content());
        } catch (IOException e) {
            log.error("Unable to store attachment {}: {}", target, e.getMessage());
            throw new UncheckedIOException("Unable to store attachment " + fileName, e);
        }

        String url = urlPrefix + "/" + relative;
        String markdown;
        String alt;
        if (attachment.isImage()) {
            alt = FilenameUtils.getBaseName(fileName);
            markdown = "![" + alt + "](" + url + ")";
        } else {
            alt = fileName;
            markdown = "[" + alt + "](" + url + ")";
        }

        log.debug("Stored attachment {} ({} bytes) at {}", fileName, attachment.content().length, target);
        return new UploadedAttachment(alt, url, markdown);
    }

    /**
     * Drops any path component and replaces characters unsafe in paths and URLs.
     *
     * @param fileName File name as sent.
     * @return Safe file name.
     */
    static String sanitize(String fileName) {
        String name = FilenameUtils.getName(StringUtils.defaultString(fileName)).replaceAll("[^A-Za-z0-9._-]", "_");
        if (name.isEmpty() || name.matches("\\.+")) {
            return "attachment";
        }
        return name;
    }
}
