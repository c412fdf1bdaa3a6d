package com.mimecast.replyrouter.domain;

/**
 * Attachment carried by an inbound message.
 *
 * @param fileName    File name as given by the sender.
 * @param contentType Base content type, e.g. {@code image/png}.
 * @param content     Decoded bytes.
 */
public record MessageAttachment(String fileName, String contentType, byte[] content) {

    /**
     * Is this attachment an image.
     *
     * @return Boolean.
     */
    public boolean isImage() {
        return contentType != null && contentType.toLowerCase().startsWith("image/");
    }
}
