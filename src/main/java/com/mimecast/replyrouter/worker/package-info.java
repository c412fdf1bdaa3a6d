/**
 * Delivery handling around the receiver.
 *
 * <p>{@link com.mimecast.replyrouter.worker.ReceiverWorker} is called by the mail transport for each email
 * <br>delivered to the reply address. Rejections are counted, logged and, where it makes sense,
 * <br>answered with a notice built by {@link com.mimecast.replyrouter.worker.RejectionMailer}.
 *
 * <h2>Rejection reasons:</h2>
 * <p>{@link com.mimecast.replyrouter.worker.RejectionReason} words the notice per
 * <br>{@link com.mimecast.replyrouter.exception.ErrorKind}; user and validation rejections reuse the exception message.
 */
package com.mimecast.replyrouter.worker;
