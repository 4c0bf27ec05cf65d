package io.fanout.channel;

import io.fanout.spi.MetricsExporter;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts metric callbacks for assertions.
 */
final class RecordingMetricsExporter implements MetricsExporter {
    final AtomicInteger successes = new AtomicInteger();
    final AtomicInteger failures = new AtomicInteger();
    final AtomicInteger durations = new AtomicInteger();
    final AtomicInteger peakInFlight = new AtomicInteger();
    final AtomicInteger lastInFlight = new AtomicInteger(-1);
    final AtomicInteger peakQueueDepth = new AtomicInteger();
    final AtomicInteger lastQueueDepth = new AtomicInteger(-1);

    @Override
    public void incrementDispatchSuccess(String channel) {
        successes.incrementAndGet();
    }

    @Override
    public void incrementDispatchFailure(String channel) {
        failures.incrementAndGet();
    }

    @Override
    public void recordRateLimiterQueueDepth(String channel, int depth) {
        peakQueueDepth.accumulateAndGet(depth, Math::max);
        lastQueueDepth.set(depth);
    }

    @Override
    public void recordInFlightSends(String channel, int count) {
        peakInFlight.accumulateAndGet(count, Math::max);
        lastInFlight.set(count);
    }

    @Override
    public void recordSendDurationMs(String channel, long durationMs) {
        durations.incrementAndGet();
    }
}
