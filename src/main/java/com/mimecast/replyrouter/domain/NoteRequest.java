package com.mimecast.replyrouter.domain;

/**
 * Note creation request.
 * <p>Threading fields are copied from the sent notification unchanged.
 *
 * @param project      Target project.
 * @param author       Note author.
 * @param note         Note body.
 * @param noteableType Type of the discussed item.
 * @param noteableId   Id of the discussed item.
 * @param commitId     Commit id for commit discussions.
 * @param lineCode     Line code for diff discussions.
 */
public record NoteRequest(Project project,
                          User author,
                          String note,
                          String noteableType,
                          Long noteableId,
                          String commitId,
                          String lineCode) {
}
