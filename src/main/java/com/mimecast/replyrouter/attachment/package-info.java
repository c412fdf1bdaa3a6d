/**
 * Attachment storage.
 *
 * <p>{@link com.mimecast.replyrouter.attachment.LocalAttachmentUploader} saves attachments on local disk
 * <br>and answers with markdown links appended to the reply body.
 */
package com.mimecast.replyrouter.attachment;
