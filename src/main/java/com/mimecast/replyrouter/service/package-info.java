/**
 * Collaborator seams of the receiver.
 *
 * <p>The receiver only knows these interfaces. Persistence, permissions and MIME decoding live behind them.
 * <ul>
 *     <li>{@link com.mimecast.replyrouter.service.MailParser} Raw bytes to parsed message.</li>
 *     <li>{@link com.mimecast.replyrouter.service.UserLookup} Email address to user.</li>
 *     <li>{@link com.mimecast.replyrouter.service.AuthorizationPolicy} Capability checks.</li>
 *     <li>{@link com.mimecast.replyrouter.service.ProjectResolver} Routing key to project.</li>
 *     <li>{@link com.mimecast.replyrouter.service.SentNotificationStore} Reply key to sent notification.</li>
 *     <li>{@link com.mimecast.replyrouter.service.ReplyParser} Quote stripping.</li>
 *     <li>{@link com.mimecast.replyrouter.service.AttachmentUploader} Attachment persistence.</li>
 *     <li>{@link com.mimecast.replyrouter.service.NoteCreator} and {@link com.mimecast.replyrouter.service.IssueCreator}
 *     Content creation.</li>
 * </ul>
 *
 * @see com.mimecast.replyrouter.service.ReceiverServices
 */
package com.mimecast.replyrouter.service;
