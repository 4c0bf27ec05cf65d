package io.fanout;

import java.util.List;
import java.util.Objects;

/**
 * Summary of one {@link NotificationDispatcher#dispatch} call.
 *
 * @param dispatchId ULID identifying this dispatch in logs
 * @param channel    the channel name the request was routed to
 * @param results    one result per recipient
 */
public record DispatchReport(String dispatchId, String channel, List<DispatchResult> results) {

    public DispatchReport {
        Objects.requireNonNull(dispatchId, "dispatchId");
        Objects.requireNonNull(channel, "channel");
        results = List.copyOf(results);
    }

    public int successCount() {
        return (int) results.stream().filter(DispatchResult::isSuccess).count();
    }

    public int failureCount() {
        return results.size() - successCount();
    }

    public boolean allSucceeded() {
        return failureCount() == 0;
    }
}
