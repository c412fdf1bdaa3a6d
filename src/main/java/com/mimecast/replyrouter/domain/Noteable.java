package com.mimecast.replyrouter.domain;

/**
 * Reference to the item a discussion belongs to, e.g. an issue, merge request or commit.
 *
 * @param type Item type.
 * @param id   Item id, or commit id for commits.
 */
public record Noteable(String type, String id) {
}
