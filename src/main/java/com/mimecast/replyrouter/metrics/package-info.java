/**
 * Micrometer metrics of the inbound email worker.
 *
 * <p>Counters are registered against the Prometheus registry held by
 * <br>{@link com.mimecast.replyrouter.metrics.MetricsRegistry}; nothing is counted while it is null.
 */
package com.mimecast.replyrouter.metrics;
