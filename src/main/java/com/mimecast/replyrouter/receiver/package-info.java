/**
 * Routing and authorization of inbound reply emails.
 *
 * <p>{@link com.mimecast.replyrouter.receiver.EmailReceiver} runs one email through a fixed decision tree:
 * <ol>
 *     <li>Blank input is rejected.</li>
 *     <li>{@link com.mimecast.replyrouter.receiver.ReplyKeyResolver} finds the reply key in To, then References.</li>
 *     <li>A sent notification for the key makes the email a reply, else a project for the key makes it a new issue.</li>
 *     <li>{@link com.mimecast.replyrouter.receiver.AuthorizationGate} checks the acting user.</li>
 *     <li>{@link com.mimecast.replyrouter.receiver.ReplyBodyExtractor} strips quotes and appends attachments.</li>
 *     <li>The note or issue is created.</li>
 * </ol>
 *
 * <h2>Reply addresses:</h2>
 * <p>{@link com.mimecast.replyrouter.receiver.ReplyAddress} implements the address scheme:
 * <ul>
 *     <li>{@code reply+abc123@example.com} - key {@code abc123} from the configured template</li>
 *     <li>{@code <reply-abc123@example.com>} - key {@code abc123} from a fallback Message-ID</li>
 * </ul>
 *
 * @see com.mimecast.replyrouter.exception.ProcessingException
 * @see com.mimecast.replyrouter.service.ReceiverServices
 */
package com.mimecast.replyrouter.receiver;
