package com.mimecast.replyrouter.domain;

/**
 * Issue creation request.
 *
 * @param project     Target project.
 * @param author      Issue author.
 * @param title       Issue title.
 * @param description Issue description.
 */
public record IssueRequest(Project project, User author, String title, String description) {
}
