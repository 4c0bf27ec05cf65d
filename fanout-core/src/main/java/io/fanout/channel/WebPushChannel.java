package io.fanout.channel;

import io.fanout.Channel;
import io.fanout.DispatchException;
import io.fanout.DispatchResult;
import io.fanout.Notification;
import io.fanout.VapidDetails;
import io.fanout.ratelimit.RateLimiter;
import io.fanout.spi.MetricsExporter;
import io.fanout.spi.PushSubscription;
import io.fanout.spi.WebPushClient;
import io.fanout.spi.WebPushOptions;
import io.fanout.util.DaemonThreadFactory;
import io.fanout.util.JsonCodec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Concurrency-bounded channel for the Web Push protocol, which has no batch endpoint.
 *
 * <p>Each recipient is a JSON-serialized browser subscription and is one unit of the
 * channel's {@link RateLimiter}. Independently of the rate limit, at most
 * {@code maxConcurrentSends} sends are in flight at any instant across all callers of this
 * channel: a permit is taken before a recipient is scheduled and returned when its send
 * completes, so {@link #send} waits for a free slot before admitting the next recipient.
 * {@link #send} returns after every scheduled send has resolved.
 *
 * <p>A recipient that cannot be decoded into a {@link PushSubscription} is reported as a
 * failed result, whatever exception the codec throws; the rest of the request proceeds.
 *
 * <p>The payload is the JSON object {@code {"title", "body", "data"}} with defaults title
 * {@value #DEFAULT_TITLE}, an empty body and empty data. {@code ttlSeconds}, VAPID details
 * (per notification, else the channel default) and headers are passed as request options
 * when set.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see WebPushClient
 */
public final class WebPushChannel implements Channel, AutoCloseable {
    private static final Logger logger = Logger.getLogger(WebPushChannel.class.getName());

    public static final String DEFAULT_TITLE = "Notification";
    static final String INTERRUPTED = "Interrupted before dispatch";

    private final String name;
    private final WebPushClient client;
    private final int maxConcurrentSends;
    private final Semaphore inFlight;
    private final RateLimiter rateLimiter;
    private final VapidDetails defaultVapidDetails;
    private final JsonCodec codec;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final MetricsExporter metrics;
    private final AtomicBoolean closed = new AtomicBoolean();

    private WebPushChannel(Builder builder) {
        this.client = Objects.requireNonNull(builder.client, "client");
        this.name = Objects.requireNonNull(builder.name, "name");
        if (builder.maxConcurrentSends <= 0) {
            throw new IllegalArgumentException("maxConcurrentSends must be > 0");
        }
        if (builder.maxMessagesPerSecond <= 0) {
            throw new IllegalArgumentException("maxMessagesPerSecond must be > 0");
        }
        this.maxConcurrentSends = builder.maxConcurrentSends;
        this.inFlight = new Semaphore(builder.maxConcurrentSends, true);
        this.defaultVapidDetails = builder.vapidDetails;
        this.codec = builder.codec != null ? builder.codec : JsonCodec.getDefault();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.rateLimiter = new RateLimiter(builder.maxMessagesPerSecond, builder.intervalMs);
        if (builder.executor != null) {
            this.executor = builder.executor;
            this.ownsExecutor = false;
        } else {
            this.executor = Executors.newCachedThreadPool(new DaemonThreadFactory("fanout-" + name + "-"));
            this.ownsExecutor = true;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public String name() {
        return name;
    }

    public int maxConcurrentSends() {
        return maxConcurrentSends;
    }

    @Override
    public List<DispatchResult> send(List<String> recipients, List<Notification> notifications) {
        List<String> subscriptions = List.copyOf(Objects.requireNonNull(recipients, "recipients"));
        if (closed.get()) {
            throw new DispatchException("Channel " + name + " is closed");
        }

        ResultSlots slots = new ResultSlots(subscriptions);
        List<CompletableFuture<Void>> pending = new ArrayList<>();
        for (int i = 0; i < subscriptions.size(); i++) {
            String recipient = subscriptions.get(i);
            PushSubscription subscription;
            try {
                subscription = decode(recipient);
            } catch (RuntimeException e) {
                String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
                slots.record(i, DispatchResult.failed(recipient, "Invalid subscription: " + reason));
                metrics.incrementDispatchFailure(name);
                logger.log(Level.WARNING, "Invalid web push subscription at index " + i, e);
                continue;
            }

            try {
                inFlight.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.log(Level.WARNING, "Interrupted while waiting for a send slot on channel {0}; "
                        + "{1} recipients not dispatched", new Object[]{name, subscriptions.size() - i});
                slots.failRemaining(i, subscriptions.size(), INTERRUPTED);
                break;
            }
            metrics.recordInFlightSends(name, maxConcurrentSends - inFlight.availablePermits());

            int index = i;
            Notification notification = Notification.at(notifications, index);
            CompletableFuture<Void> send;
            try {
                send = rateLimiter.schedule(() -> CompletableFuture.runAsync(
                        () -> sendOne(index, subscription, notification, slots), executor));
            } catch (IllegalStateException e) {
                send = CompletableFuture.failedFuture(e);
            }
            pending.add(send.whenComplete((ignored, error) -> {
                inFlight.release();
                metrics.recordInFlightSends(name, maxConcurrentSends - inFlight.availablePermits());
                metrics.recordRateLimiterQueueDepth(name, rateLimiter.queuedCount());
                if (error != null) {
                    if (slots.record(index, DispatchResult.failed(recipient, error))) {
                        metrics.incrementDispatchFailure(name);
                    }
                    logger.log(Level.WARNING, "Web push to " + subscription.endpoint()
                            + " could not be dispatched", error);
                }
            }));
            metrics.recordRateLimiterQueueDepth(name, rateLimiter.queuedCount());
        }

        CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
                .exceptionally(error -> null)
                .join();
        metrics.recordInFlightSends(name, maxConcurrentSends - inFlight.availablePermits());
        metrics.recordRateLimiterQueueDepth(name, rateLimiter.queuedCount());
        return slots.toList();
    }

    private void sendOne(int index, PushSubscription subscription, Notification notification, ResultSlots slots) {
        String recipient = slots.recipient(index);
        long startNanos = System.nanoTime();
        try {
            Object response = client.sendNotification(subscription, payload(notification), options(notification));
            slots.record(index, DispatchResult.success(recipient, response));
            metrics.incrementDispatchSuccess(name);
            logger.log(Level.FINE, "Web push sent to {0}", subscription.endpoint());
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            slots.record(index, DispatchResult.failed(recipient, e));
            metrics.incrementDispatchFailure(name);
            logger.log(Level.WARNING, "Web push failed for " + subscription.endpoint(), e);
        } finally {
            metrics.recordSendDurationMs(name, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        }
    }

    private PushSubscription decode(String recipient) {
        Map<String, Object> record = codec.parseObject(recipient);
        if (record == null) {
            throw new IllegalArgumentException("codec returned no object");
        }
        String endpoint = requireText(record, "endpoint");
        if (!(record.get("keys") instanceof Map<?, ?> keys)) {
            throw new IllegalArgumentException("missing keys");
        }
        return new PushSubscription(endpoint, requireText(keys, "p256dh"), requireText(keys, "auth"));
    }

    private static String requireText(Map<?, ?> record, String field) {
        if (!(record.get(field) instanceof String value) || value.isEmpty()) {
            throw new IllegalArgumentException("missing " + field);
        }
        return value;
    }

    private String payload(Notification notification) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", notification.title() != null ? notification.title() : DEFAULT_TITLE);
        payload.put("body", notification.body() != null ? notification.body() : "");
        payload.put("data", notification.data());
        return codec.toJson(payload);
    }

    private WebPushOptions options(Notification notification) {
        VapidDetails vapid = notification.vapidDetails() != null
                ? notification.vapidDetails() : defaultVapidDetails;
        return new WebPushOptions(notification.ttlSeconds(), vapid, notification.headers());
    }

    /**
     * Stops the rate limiter and, if the channel created it, the send executor. Recipients
     * still waiting for admission are reported as failed.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        rateLimiter.close();
        if (ownsExecutor) {
            executor.shutdown();
        }
    }

    /** Builder for {@link WebPushChannel}. */
    public static final class Builder {
        private WebPushClient client;
        private String name = "web-push";
        private int maxMessagesPerSecond = 50;
        private long intervalMs = 1000;
        private int maxConcurrentSends = 5;
        private VapidDetails vapidDetails;
        private JsonCodec codec;
        private ExecutorService executor;
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * Sets the Web Push client.
         *
         * <p><b>Required.</b>
         *
         * @param client the web push client
         * @return this builder
         */
        public Builder client(WebPushClient client) {
            this.client = client;
            return this;
        }

        /**
         * Sets the channel name used in logs, metrics and thread names.
         *
         * <p>Optional. Defaults to {@code "web-push"}.
         *
         * @param name the channel name
         * @return this builder
         */
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * Sets how many recipients may be admitted per interval.
         *
         * <p>Optional. Defaults to {@code 50}. Must be &gt; 0.
         *
         * @param maxMessagesPerSecond sends admitted per interval
         * @return this builder
         */
        public Builder maxMessagesPerSecond(int maxMessagesPerSecond) {
            this.maxMessagesPerSecond = maxMessagesPerSecond;
            return this;
        }

        /**
         * Sets the rate limiter refill interval.
         *
         * <p>Optional. Defaults to {@code 1000} ms. Must be &gt; 0.
         *
         * @param intervalMs refill interval in milliseconds
         * @return this builder
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /**
         * Sets the ceiling on simultaneously pending sends.
         *
         * <p>Optional. Defaults to {@code 5}. Must be &gt; 0.
         *
         * @param maxConcurrentSends maximum in-flight sends
         * @return this builder
         */
        public Builder maxConcurrentSends(int maxConcurrentSends) {
            this.maxConcurrentSends = maxConcurrentSends;
            return this;
        }

        /**
         * Sets the VAPID details used when a notification carries none.
         *
         * <p>Optional. Without them the client's own configuration applies.
         *
         * @param vapidDetails default signing details
         * @return this builder
         */
        public Builder vapidDetails(VapidDetails vapidDetails) {
            this.vapidDetails = vapidDetails;
            return this;
        }

        /**
         * Sets the codec for decoding subscriptions and encoding payloads.
         *
         * <p>Optional. Defaults to {@link JsonCodec#getDefault()}.
         *
         * @param codec the JSON codec
         * @return this builder
         */
        public Builder codec(JsonCodec codec) {
            this.codec = codec;
            return this;
        }

        /**
         * Sets the executor that runs individual sends. The channel does not shut it down.
         *
         * <p>Optional. Defaults to a cached pool of daemon threads owned by the channel.
         *
         * @param executor the send executor
         * @return this builder
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Builds the channel and its rate limiter.
         *
         * @return a new {@link WebPushChannel}
         * @throws NullPointerException     if {@code client} or {@code name} is null
         * @throws IllegalArgumentException if {@code maxMessagesPerSecond}, {@code intervalMs}
         *     or {@code maxConcurrentSends} is &le; 0
         */
        public WebPushChannel build() {
            return new WebPushChannel(this);
        }
    }
}
