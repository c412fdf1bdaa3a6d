/**
 * Default MIME collaborators.
 *
 * <p>{@link com.mimecast.replyrouter.mime.JakartaMailParser} decodes raw messages with Jakarta Mail.
 * <br>{@link com.mimecast.replyrouter.mime.EmailReplyParser} cuts quoted history and signatures off reply bodies.
 *
 * <p>Both are optional; the receiver only depends on the
 * <br>{@link com.mimecast.replyrouter.service.MailParser} and {@link com.mimecast.replyrouter.service.ReplyParser} seams.
 */
package com.mimecast.replyrouter.mime;
