package com.mimecast.replyrouter.metrics;

import com.mimecast.replyrouter.exception.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Inbound email Micrometer metrics.
 *
 * <p>Provides counters for received, successfully processed and rejected emails.
 * <br>Counting never fails the caller; errors are logged.
 */
public final class ReceiverMetrics {
    private static final Logger log = LogManager.getLogger(ReceiverMetrics.class);

    public static final String RECEIVED = "email.receiver.received";
    public static final String SUCCESS = "email.receiver.success";
    public static final String REJECTED = "email.receiver.rejected";
    public static final String FAILURES = "email.receiver.failures";

    /**
     * Private constructor for utility class.
     */
    private ReceiverMetrics() {
    }

    /**
     * Initialize counters with zero values so they show before any email is processed.
     */
    public static void initialize() {
        MeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
        if (registry == null) {
            log.warn("Cannot initialize receiver metrics - Prometheus registry is null");
            return;
        }

        try {
            received(registry);
            success(registry);
            for (ErrorKind kind : ErrorKind.values()) {
                rejected(registry, kind);
            }
            log.info("Receiver metrics initialized");
        } catch (Exception e) {
            log.error("Failed to initialize receiver metrics: {}", e.getMessage(), e);
        }
    }

    /**
     * Increment the received counter.
     */
    public static void incrementReceived() {
        try {
            MeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
            if (registry != null) {
                received(registry).increment();
            }
        } catch (Exception e) {
            log.warn("Failed to increment received counter: {}", e.getMessage());
        }
    }

    /**
     * Increment the success counter.
     */
    public static void incrementSuccess() {
        try {
            MeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
            if (registry != null) {
                success(registry).increment();
            }
        } catch (Exception e) {
            log.warn("Failed to increment success counter: {}", e.getMessage());
        }
    }

    /**
     * Increment the rejected counter.
     *
     * @param kind Rejection kind.
     */
    public static void incrementRejected(ErrorKind kind) {
        try {
            MeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
            if (registry != null) {
                rejected(registry, kind).increment();
            }
        } catch (Exception e) {
            log.warn("Failed to increment rejected counter: {}", e.getMessage());
        }
    }

    /**
     * Increment the failure counter.
     * <p>Failures are unexpected collaborator errors, not rejections.
     *
     * @param exceptionType The simple name of the exception class.
     */
    public static void incrementFailure(String exceptionType) {
        try {
            MeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
            if (registry != null) {
                Counter.builder(FAILURES)
                        .description("Number of emails that failed with an unexpected exception")
                        .tag("exception_type", exceptionType)
                        .register(registry)
                        .increment();
            }
        } catch (Exception e) {
            log.warn("Failed to increment failure counter: {}", e.getMessage());
        }
    }

    private static Counter received(MeterRegistry registry) {
        return Counter.builder(RECEIVED)
                .description("Number of inbound emails received")
                .register(registry);
    }

    private static Counter success(MeterRegistry registry) {
        return Counter.builder(SUCCESS)
                .description("Number of inbound emails turned into notes or issues")
                .register(registry);
    }

    private static Counter rejected(MeterRegistry registry, ErrorKind kind) {
        return Counter.builder(REJECTED)
                .description("Number of inbound emails rejected")
                .tag("error_kind", kind.name())
                .register(registry);
    }
}
