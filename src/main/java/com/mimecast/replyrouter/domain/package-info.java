/**
 * Values exchanged between the receiver and its collaborators.
 *
 * <p>{@link com.mimecast.replyrouter.domain.ParsedMessage} is the parsed inbound email.
 * <br>{@link com.mimecast.replyrouter.domain.SentNotification} links a reply key to the discussion it was sent for.
 * <br>{@link com.mimecast.replyrouter.domain.NoteRequest} and {@link com.mimecast.replyrouter.domain.IssueRequest}
 * <br>are handed to the creation services which answer with a {@link com.mimecast.replyrouter.domain.CreationResult}.
 */
package com.mimecast.replyrouter.domain;
