package com.mimecast.replyrouter.worker;

import com.mimecast.replyrouter.config.IncomingEmailConfig;
import com.mimecast.replyrouter.exception.ErrorKind;
import com.mimecast.replyrouter.exception.ProcessingException;
import com.mimecast.replyrouter.metrics.ReceiverMetrics;
import com.mimecast.replyrouter.receiver.EmailReceiver;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Mail delivery handler for the reply address.
 *
 * <p>Runs each delivered email through the {@link EmailReceiver}, counts the outcome
 * <br>and tells the sender when their email was rejected.
 * <p>No rejection notice is sent when:
 * <ul>
 *   <li>The email was blank</li>
 *   <li>The email could not be parsed, unless {@code rejection.bounceUnparsable} is set</li>
 *   <li>Rejection notices are disabled</li>
 * </ul>
 * <p>Unexpected runtime errors from collaborators are logged and rethrown so the transport may retry.
 */
public class ReceiverWorker {
    private static final Logger log = LogManager.getLogger(ReceiverWorker.class);

    private final IncomingEmailConfig config;
    private final EmailReceiver receiver;
    private final RejectionNotifier notifier;

    /**
     * Constructs a new ReceiverWorker instance.
     *
     * @param config   Incoming email configuration.
     * @param receiver Email receiver.
     * @param notifier Rejection notifier.
     */
    public ReceiverWorker(IncomingEmailConfig config, EmailReceiver receiver, RejectionNotifier notifier) {
        this.config = config;
        this.receiver = receiver;
        this.notifier = notifier;
    }

    /**
     * Handles one delivered email.
     *
     * @param raw Raw email.
     * @return True if a note or issue was created.
     */
    public boolean perform(byte[] raw) {
        if (!config.isEnabled()) {
            log.info("Incoming email is disabled, ignoring delivered email");
            return false;
        }

        ReceiverMetrics.incrementReceived();

        try {
            receiver.process(raw);
            ReceiverMetrics.incrementSuccess();
            return true;

        } catch (ProcessingException e) {
            ReceiverMetrics.incrementRejected(e.getKind());
            handleRejection(raw, e);
            return false;

        } catch (RuntimeException e) {
            log.error("Unexpected error processing email: {}", e.getMessage(), e);
            ReceiverMetrics.incrementFailure(e.getClass().getSimpleName());
            throw e;
        }
    }

    /**
     * Logs the rejection and notifies the sender where applicable.
     *
     * @param raw Raw email.
     * @param e   Rejection.
     */
    private void handleRejection(byte[] raw, ProcessingException e) {
        log.warn("Rejected email {}: {}", e.getKind(), e.getMessage());

        if (raw == null || StringUtils.isBlank(new String(raw, StandardCharsets.UTF_8))) {
            return;
        }

        if (!config.isRejectionEnabled()) {
            return;
        }

        if (e.getKind() == ErrorKind.EMAIL_UNPARSABLE && !config.isBounceUnparsable()) {
            log.debug("Not bouncing unparsable email");
            return;
        }

        try {
            notifier.reject(RejectionReason.of(e), raw);
        } catch (IOException ioe) {
            log.error("Unable to send rejection notice for {}: {}", e.getKind(), ioe.getMessage(), ioe);
            ReceiverMetrics.incrementFailure(ioe.getClass().getSimpleName());
        }
    }
}
