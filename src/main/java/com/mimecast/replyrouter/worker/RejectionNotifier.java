package com.mimecast.replyrouter.worker;

import java.io.IOException;

/**
 * Tells the sender why their email was not accepted.
 */
public interface RejectionNotifier {

    /**
     * Sends a rejection notice for a raw email.
     *
     * @param reason Human readable reason.
     * @param raw    Rejected raw email.
     * @throws IOException Unable to produce the notice.
     */
    void reject(String reason, byte[] raw) throws IOException;
}
