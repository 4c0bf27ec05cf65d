package io.fanout;

import com.github.f4b6a3.ulid.UlidCreator;
import io.fanout.registry.ChannelNotRegisteredException;
import io.fanout.registry.ChannelRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes notification requests to channels resolved from a {@link ChannelRegistry}.
 *
 * <p>Every dispatch is assigned a ULID {@code dispatchId} that appears in the log summary and
 * the returned {@link DispatchReport}.
 *
 * <pre>{@code
 * NotificationDispatcher dispatcher = new NotificationDispatcher(registry);
 * DispatchReport report = dispatcher.dispatch("push", tokens, notifications);
 * if (!report.allSucceeded()) { ... }
 * }</pre>
 */
public final class NotificationDispatcher {
    private static final Logger logger = Logger.getLogger(NotificationDispatcher.class.getName());

    private final ChannelRegistry registry;

    public NotificationDispatcher(ChannelRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Sends to {@code recipients} over the channel registered as {@code channelName}.
     *
     * @param channelName   registered channel name
     * @param recipients    transport-specific recipient identifiers
     * @param notifications index-aligned notification details, may be {@code null}
     * @return the dispatch report, with one result per recipient
     * @throws ChannelNotRegisteredException if no channel is registered under {@code channelName}
     * @throws DispatchException             if the channel could not start dispatching
     */
    public DispatchReport dispatch(String channelName, List<String> recipients, List<Notification> notifications) {
        Objects.requireNonNull(recipients, "recipients");
        Channel channel = registry.get(channelName);
        String dispatchId = UlidCreator.getMonotonicUlid().toString();
        long startNanos = System.nanoTime();

        List<DispatchResult> results = channel.send(recipients, notifications);

        DispatchReport report = new DispatchReport(dispatchId, channelName, results);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        if (report.results().size() != recipients.size()) {
            logger.log(Level.SEVERE, "Channel {0} returned {1} results for {2} recipients (dispatchId={3})",
                    new Object[]{channelName, report.results().size(), recipients.size(), dispatchId});
        }
        logger.log(Level.INFO, "Dispatch {0} on {1}: {2} sent, {3} failed in {4} ms",
                new Object[]{dispatchId, channelName, report.successCount(), report.failureCount(), elapsedMs});
        return report;
    }

    /**
     * Sends the channel's default notification to {@code recipients}.
     *
     * @param channelName registered channel name
     * @param recipients  transport-specific recipient identifiers
     * @return the dispatch report
     */
    public DispatchReport dispatch(String channelName, List<String> recipients) {
        return dispatch(channelName, recipients, null);
    }
}
