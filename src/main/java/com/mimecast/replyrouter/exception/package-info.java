/**
 * Typed rejections of inbound emails.
 *
 * <p>Every way an inbound email can be refused has its own subclass of
 * <br>{@link com.mimecast.replyrouter.exception.ProcessingException} and its own
 * <br>{@link com.mimecast.replyrouter.exception.ErrorKind}.
 * <br>Processing stops at the first one thrown.
 */
package com.mimecast.replyrouter.exception;
