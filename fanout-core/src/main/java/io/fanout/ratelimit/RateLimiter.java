package io.fanout.ratelimit;

import io.fanout.util.DaemonThreadFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Token-bucket throttle admitting at most {@code maxPerInterval} units of work per
 * {@code intervalMs}.
 *
 * <p>{@link #schedule} starts a unit immediately when a token is available and otherwise
 * queues it. A refill timer resets the bucket to {@code maxPerInterval} tokens every
 * {@code intervalMs} and starts queued units in FIFO order until the tokens run out.
 * Admission is purely rate-based: the outcome of a unit never affects the limiter, and the
 * caller is responsible for handling the unit's own failures.
 *
 * <p>The refill timer only runs while the limiter is in use. It is started when a token is
 * consumed and stops itself once a tick finds the bucket untouched and nothing queued.
 *
 * <p>Units are started on the thread that admits them: the scheduling thread when a token is
 * free, otherwise the refill timer thread. They should therefore hand their real work to
 * another executor and return promptly.
 *
 * <p>This class is thread-safe. {@link #close()} stops the timer and cancels queued units.
 */
public final class RateLimiter implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(RateLimiter.class.getName());

    private final int maxPerInterval;
    private final long intervalMs;
    private final ScheduledExecutorService timer;
    private final boolean ownsTimer;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<PendingUnit<?>> queue = new ArrayDeque<>();
    private int tokens;
    private boolean consumedSinceRefill;
    private ScheduledFuture<?> refillTask;
    private boolean closed;

    /**
     * Creates a limiter with its own single daemon timer thread.
     *
     * @param maxPerInterval tokens available per interval, must be &gt; 0
     * @param intervalMs     refill interval in milliseconds, must be &gt; 0
     * @throws IllegalArgumentException if either argument is not positive
     */
    public RateLimiter(int maxPerInterval, long intervalMs) {
        this(maxPerInterval, intervalMs, null);
    }

    /**
     * Creates a limiter whose refill timer runs on the given scheduler. The scheduler is not
     * shut down by {@link #close()}.
     *
     * @param maxPerInterval tokens available per interval, must be &gt; 0
     * @param intervalMs     refill interval in milliseconds, must be &gt; 0
     * @param timer          scheduler for the refill timer, or {@code null} to create one
     * @throws IllegalArgumentException if either numeric argument is not positive
     */
    public RateLimiter(int maxPerInterval, long intervalMs, ScheduledExecutorService timer) {
        if (maxPerInterval <= 0) {
            throw new IllegalArgumentException("maxPerInterval must be > 0, was " + maxPerInterval);
        }
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be > 0, was " + intervalMs);
        }
        this.maxPerInterval = maxPerInterval;
        this.intervalMs = intervalMs;
        this.tokens = maxPerInterval;
        if (timer != null) {
            this.timer = timer;
            this.ownsTimer = false;
        } else {
            this.timer = Executors.newSingleThreadScheduledExecutor(
                    new DaemonThreadFactory("fanout-rate-limiter-"));
            this.ownsTimer = true;
        }
    }

    /**
     * Submits a unit of asynchronous work for rate-limited admission.
     *
     * <p>The returned future completes once the unit has been admitted and the stage it
     * returned has completed, with that stage's result or failure. If the unit throws instead
     * of returning a stage, the returned future completes exceptionally with that exception.
     * Units still queued when the limiter is closed complete with a
     * {@link CancellationException} and are never started.
     *
     * @param unit supplier that starts the work and returns its completion stage
     * @param <T>  result type of the unit
     * @return a future tracking admission and completion of the unit
     * @throws IllegalStateException if the limiter has been closed
     */
    public <T> CompletableFuture<T> schedule(Supplier<? extends CompletionStage<T>> unit) {
        Objects.requireNonNull(unit, "unit");
        PendingUnit<T> pending = new PendingUnit<>(unit);
        boolean admitted;
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("RateLimiter is closed");
            }
            if (tokens > 0 && queue.isEmpty()) {
                tokens--;
                consumedSinceRefill = true;
                admitted = true;
            } else {
                queue.addLast(pending);
                admitted = false;
            }
            ensureRefillScheduled();
        } finally {
            lock.unlock();
        }
        if (admitted) {
            pending.start();
        }
        return pending.handle;
    }

    private void ensureRefillScheduled() {
        if (refillTask == null) {
            refillTask = timer.scheduleAtFixedRate(this::refill, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        }
    }

    private void refill() {
        List<PendingUnit<?>> admitted = new ArrayList<>();
        lock.lock();
        try {
            if (closed) {
                return;
            }
            if (!consumedSinceRefill && queue.isEmpty()) {
                // Idle for a whole interval; the next schedule() restarts the timer
                cancelRefill();
                return;
            }
            tokens = maxPerInterval;
            consumedSinceRefill = false;
            while (tokens > 0 && !queue.isEmpty()) {
                admitted.add(queue.pollFirst());
                tokens--;
                consumedSinceRefill = true;
            }
        } finally {
            lock.unlock();
        }
        for (PendingUnit<?> unit : admitted) {
            unit.start();
        }
    }

    private void cancelRefill() {
        if (refillTask != null) {
            refillTask.cancel(false);
            refillTask = null;
        }
    }

    public int maxPerInterval() {
        return maxPerInterval;
    }

    public long intervalMs() {
        return intervalMs;
    }

    /**
     * Returns the number of tokens left in the current interval.
     *
     * @return available tokens
     */
    public int availableTokens() {
        lock.lock();
        try {
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of units waiting for a token.
     *
     * @return queued unit count
     */
    public int queuedCount() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns whether the refill timer is currently scheduled.
     *
     * @return {@code true} while the limiter has recent or queued work
     */
    public boolean isRefillScheduled() {
        lock.lock();
        try {
            return refillTask != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the refill timer and rejects further scheduling. Queued units are never started;
     * their futures complete with a {@link CancellationException}. Units already started are
     * unaffected. Calling this method more than once has no further effect.
     */
    @Override
    public void close() {
        List<PendingUnit<?>> abandoned;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            cancelRefill();
            abandoned = new ArrayList<>(queue);
            queue.clear();
        } finally {
            lock.unlock();
        }
        if (ownsTimer) {
            timer.shutdownNow();
        }
        if (!abandoned.isEmpty()) {
            logger.log(Level.WARNING, "Rate limiter closed with {0} queued units; cancelling them",
                    abandoned.size());
        }
        for (PendingUnit<?> unit : abandoned) {
            unit.handle.completeExceptionally(new CancellationException("RateLimiter closed"));
        }
    }

    private static final class PendingUnit<T> {
        private final Supplier<? extends CompletionStage<T>> unit;
        private final CompletableFuture<T> handle = new CompletableFuture<>();

        private PendingUnit(Supplier<? extends CompletionStage<T>> unit) {
            this.unit = unit;
        }

        private void start() {
            CompletionStage<T> stage;
            try {
                stage = unit.get();
            } catch (Throwable t) {
                handle.completeExceptionally(t);
                return;
            }
            if (stage == null) {
                handle.completeExceptionally(new NullPointerException("unit returned a null stage"));
                return;
            }
            stage.whenComplete((value, error) -> {
                if (error != null) {
                    handle.completeExceptionally(error);
                } else {
                    handle.complete(value);
                }
            });
        }
    }
}
