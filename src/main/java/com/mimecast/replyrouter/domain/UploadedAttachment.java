package com.mimecast.replyrouter.domain;

/**
 * Attachment persisted for a project.
 *
 * @param alt      Alternative text, usually the file name.
 * @param url      Public URL.
 * @param markdown Display reference appended to the reply body.
 */
public record UploadedAttachment(String alt, String url, String markdown) {
}
