package io.fanout.channel;

import io.fanout.Channel;
import io.fanout.DispatchException;
import io.fanout.DispatchResult;
import io.fanout.Notification;
import io.fanout.ratelimit.RateLimiter;
import io.fanout.spi.MetricsExporter;
import io.fanout.spi.PushClient;
import io.fanout.spi.PushMessage;
import io.fanout.util.DaemonThreadFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Batch-oriented channel for push providers whose limits are expressed in requests per
 * second, such as Firebase Cloud Messaging.
 *
 * <p>Recipients (device tokens) are split into chunks of at most {@code chunkSize}. Each chunk
 * is one unit of the channel's {@link RateLimiter}, so throttling applies per chunk rather
 * than per message. Chunks are dispatched one after another: the next chunk is submitted
 * only after every send of the previous one has finished. Inside an admitted chunk every
 * token is sent concurrently on the send executor, so chunk size bounds the number of sends
 * in flight. Each send records its own outcome, so one rejected token never affects its
 * siblings.
 *
 * <p>Unset notification fields fall back to title {@value #DEFAULT_TITLE}, an empty body,
 * empty data and {@code dryRun=false}.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see PushClient
 */
public final class PushChannel implements Channel, AutoCloseable {
    private static final Logger logger = Logger.getLogger(PushChannel.class.getName());

    public static final String DEFAULT_TITLE = "Default Notification";

    private final String name;
    private final PushClient client;
    private final int chunkSize;
    private final RateLimiter rateLimiter;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final MetricsExporter metrics;
    private final AtomicBoolean closed = new AtomicBoolean();

    private PushChannel(Builder builder) {
        this.client = Objects.requireNonNull(builder.client, "client");
        this.name = Objects.requireNonNull(builder.name, "name");
        if (builder.chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        if (builder.maxMessagesPerSecond <= 0) {
            throw new IllegalArgumentException("maxMessagesPerSecond must be > 0");
        }
        this.chunkSize = builder.chunkSize;
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

    public int chunkSize() {
        return chunkSize;
    }

    @Override
    public List<DispatchResult> send(List<String> recipients, List<Notification> notifications) {
        List<String> tokens = List.copyOf(Objects.requireNonNull(recipients, "recipients"));
        if (closed.get()) {
            throw new DispatchException("Channel " + name + " is closed");
        }
        if (tokens.isEmpty()) {
            return List.of();
        }

        ResultSlots slots = new ResultSlots(tokens);
        for (int start = 0; start < tokens.size(); start += chunkSize) {
            int end = Math.min(start + chunkSize, tokens.size());
            int from = start;
            CompletableFuture<Void> chunk;
            try {
                chunk = rateLimiter.schedule(() -> dispatchChunk(from, end, notifications, slots));
            } catch (IllegalStateException e) {
                // Closed concurrently; this and later chunks fail below
                chunk = CompletableFuture.failedFuture(e);
            }
            metrics.recordRateLimiterQueueDepth(name, rateLimiter.queuedCount());
            try {
                chunk.join();
            } catch (CompletionException | CancellationException e) {
                logger.log(Level.SEVERE, "Push chunk [" + from + ", " + end + ") on channel "
                        + name + " could not be dispatched", e);
                slots.failRemaining(from, end, e);
            }
        }
        metrics.recordRateLimiterQueueDepth(name, rateLimiter.queuedCount());
        return slots.toList();
    }

    private CompletableFuture<Void> dispatchChunk(int start, int end, List<Notification> notifications,
                                                  ResultSlots slots) {
        CompletableFuture<?>[] sends = new CompletableFuture<?>[end - start];
        for (int i = start; i < end; i++) {
            int index = i;
            Notification notification = Notification.at(notifications, index);
            try {
                sends[i - start] = CompletableFuture.runAsync(
                        () -> sendOne(index, notification, slots), executor);
            } catch (RejectedExecutionException e) {
                if (slots.record(index, DispatchResult.failed(slots.recipient(index), e))) {
                    metrics.incrementDispatchFailure(name);
                }
                logger.log(Level.WARNING, "Push send rejected for token " + slots.recipient(index), e);
                sends[i - start] = CompletableFuture.completedFuture(null);
            }
        }
        return CompletableFuture.allOf(sends);
    }

    private void sendOne(int index, Notification notification, ResultSlots slots) {
        String token = slots.recipient(index);
        long startNanos = System.nanoTime();
        try {
            PushMessage message = new PushMessage(token,
                    notification.title() != null ? notification.title() : DEFAULT_TITLE,
                    notification.body() != null ? notification.body() : "",
                    notification.data());
            String messageId = client.send(message, notification.dryRun());
            slots.record(index, DispatchResult.success(token, messageId));
            metrics.incrementDispatchSuccess(name);
            logger.log(Level.FINE, "Push sent to {0}: {1}", new Object[]{token, messageId});
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            slots.record(index, DispatchResult.failed(token, e));
            metrics.incrementDispatchFailure(name);
            logger.log(Level.WARNING, "Push send failed for token " + token, e);
        } finally {
            metrics.recordSendDurationMs(name, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        }
    }

    /**
     * Stops the rate limiter and, if the channel created it, the send executor. Chunks still
     * waiting for admission are reported as failed; sends already running complete normally.
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

    /** Builder for {@link PushChannel}. */
    public static final class Builder {
        private PushClient client;
        private String name = "push";
        private int maxMessagesPerSecond = 500;
        private long intervalMs = 1000;
        private int chunkSize = 500;
        private ExecutorService executor;
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * Sets the provider client that delivers individual messages.
         *
         * <p><b>Required.</b>
         *
         * @param client the push client
         * @return this builder
         */
        public Builder client(PushClient client) {
            this.client = client;
            return this;
        }

        /**
         * Sets the channel name used in logs, metrics and thread names.
         *
         * <p>Optional. Defaults to {@code "push"}.
         *
         * @param name the channel name
         * @return this builder
         */
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * Sets how many chunks may be admitted per interval.
         *
         * <p>Optional. Defaults to {@code 500}. Must be &gt; 0.
         *
         * @param maxMessagesPerSecond provider requests admitted per interval
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
         * Sets the maximum number of tokens per chunk.
         *
         * <p>Optional. Defaults to {@code 500}, the FCM multicast limit. Must be &gt; 0.
         *
         * @param chunkSize maximum chunk size
         * @return this builder
         */
        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
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
         * @return a new {@link PushChannel}
         * @throws NullPointerException     if {@code client} or {@code name} is null
         * @throws IllegalArgumentException if {@code maxMessagesPerSecond}, {@code intervalMs}
         *     or {@code chunkSize} is &le; 0
         */
        public PushChannel build() {
            return new PushChannel(this);
        }
    }
}
