package io.fanout.micrometer;

import io.fanout.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Meters are registered lazily, the first time a channel reports, and every meter carries
 * a {@code channel} tag.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code fanout.dispatch.success}: recipients delivered successfully</li>
 *   <li>{@code fanout.dispatch.failure}: recipients that failed, including undecodable ones</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code fanout.ratelimiter.queue.depth}: units waiting for a rate limiter token</li>
 *   <li>{@code fanout.sends.in.flight}: sends currently holding a concurrency slot</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code fanout.send.duration.ms}: duration of a single transport call</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
    static final String CHANNEL_TAG = "channel";

    private final MeterRegistry registry;
    private final String namePrefix;
    private final Map<String, ChannelMeters> channels = new ConcurrentHashMap<>();
    private final Object lifecycleLock = new Object();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "fanout"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "fanout");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "billing.fanout"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }
        this.registry = registry;
        this.namePrefix = namePrefix;
    }

    @Override
    public void incrementDispatchSuccess(String channel) {
        ChannelMeters meters = meters(channel);
        if (meters == null) return;
        meters.dispatchSuccess.increment();
    }

    @Override
    public void incrementDispatchFailure(String channel) {
        ChannelMeters meters = meters(channel);
        if (meters == null) return;
        meters.dispatchFailure.increment();
    }

    @Override
    public void recordRateLimiterQueueDepth(String channel, int depth) {
        ChannelMeters meters = meters(channel);
        if (meters == null) return;
        meters.queueDepth.set(depth);
    }

    @Override
    public void recordInFlightSends(String channel, int count) {
        ChannelMeters meters = meters(channel);
        if (meters == null) return;
        meters.inFlight.set(count);
    }

    @Override
    public void recordSendDurationMs(String channel, long durationMs) {
        ChannelMeters meters = meters(channel);
        if (meters == null) return;
        meters.sendDuration.record(durationMs);
    }

    /**
     * Returns the meters for {@code channel}, registering them on first use, or {@code null}
     * once the exporter is closed.
     */
    private ChannelMeters meters(String channel) {
        Objects.requireNonNull(channel, "channel");
        if (closed) return null;
        ChannelMeters meters = channels.get(channel);
        if (meters != null) {
            return meters;
        }
        synchronized (lifecycleLock) {
            if (closed) return null;
            return channels.computeIfAbsent(channel, ChannelMeters::new);
        }
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this when the channels are closed to prevent stale gauges.
     */
    @Override
    public void close() {
        RuntimeException first = null;
        synchronized (lifecycleLock) {
            closed = true;
            for (ChannelMeters meters : channels.values()) {
                for (Meter meter : meters.all()) {
                    try {
                        registry.remove(meter);
                    } catch (RuntimeException e) {
                        if (first == null) first = e;
                        else first.addSuppressed(e);
                    }
                }
            }
            channels.clear();
        }
        if (first != null) throw first;
    }

    private final class ChannelMeters {
        private final Counter dispatchSuccess;
        private final Counter dispatchFailure;
        private final AtomicInteger queueDepth = new AtomicInteger();
        private final AtomicInteger inFlight = new AtomicInteger();
        private final Gauge queueDepthGauge;
        private final Gauge inFlightGauge;
        private final DistributionSummary sendDuration;

        private ChannelMeters(String channel) {
            this.dispatchSuccess = Counter.builder(namePrefix + ".dispatch.success")
                    .description("Recipients delivered successfully")
                    .tag(CHANNEL_TAG, channel)
                    .register(registry);
            this.dispatchFailure = Counter.builder(namePrefix + ".dispatch.failure")
                    .description("Recipients whose delivery failed")
                    .tag(CHANNEL_TAG, channel)
                    .register(registry);
            this.queueDepthGauge = Gauge.builder(namePrefix + ".ratelimiter.queue.depth", queueDepth, AtomicInteger::get)
                    .description("Units waiting for a rate limiter token")
                    .tag(CHANNEL_TAG, channel)
                    .register(registry);
            this.inFlightGauge = Gauge.builder(namePrefix + ".sends.in.flight", inFlight, AtomicInteger::get)
                    .description("Sends currently in flight")
                    .tag(CHANNEL_TAG, channel)
                    .register(registry);
            this.sendDuration = DistributionSummary.builder(namePrefix + ".send.duration.ms")
                    .description("Transport call duration in milliseconds")
                    .tag(CHANNEL_TAG, channel)
                    .register(registry);
        }

        private List<Meter> all() {
            List<Meter> meters = new ArrayList<>();
            meters.add(dispatchSuccess);
            meters.add(dispatchFailure);
            meters.add(queueDepthGauge);
            meters.add(inFlightGauge);
            meters.add(sendDuration);
            return meters;
        }
    }
}
