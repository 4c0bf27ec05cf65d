package io.fanout.spi;

/**
 * Observability hook for exporting per-channel dispatch counters and gauges.
 *
 * <p>The {@link #NOOP} instance discards everything. Implement this interface to bridge into
 * Micrometer or another monitoring system.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of recipients delivered successfully.
     *
     * @param channel channel name
     */
    void incrementDispatchSuccess(String channel);

    /**
     * Increments the count of recipients whose delivery failed, including recipients whose
     * identifier could not be decoded.
     *
     * @param channel channel name
     */
    void incrementDispatchFailure(String channel);

    /**
     * Records how many units are waiting in the channel's rate limiter.
     *
     * @param channel channel name
     * @param depth   queued unit count
     */
    void recordRateLimiterQueueDepth(String channel, int depth);

    /**
     * Records how many sends are currently in flight on a concurrency-bounded channel.
     *
     * @param channel channel name
     * @param count   in-flight sends
     */
    default void recordInFlightSends(String channel, int count) {
    }

    /**
     * Records the duration of a single transport call.
     *
     * @param channel    channel name
     * @param durationMs call duration in milliseconds
     */
    default void recordSendDurationMs(String channel, long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementDispatchSuccess(String channel) {
        }

        @Override
        public void incrementDispatchFailure(String channel) {
        }

        @Override
        public void recordRateLimiterQueueDepth(String channel, int depth) {
        }
    }
}
