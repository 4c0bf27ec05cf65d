package io.fanout;

import java.util.List;

/**
 * A named, pluggable delivery strategy that sends notifications to recipients over one transport.
 *
 * <p>Implementations must return exactly one {@link DispatchResult} per recipient. A failure
 * to deliver to one recipient is captured in that recipient's result and never affects the
 * others. Only request-level failures, which prevent any dispatch attempt, are thrown as
 * {@link DispatchException}.
 *
 * <p>Channels are resolved by name through a {@linkplain io.fanout.registry.ChannelRegistry registry}.
 *
 * @see io.fanout.channel.PushChannel
 * @see io.fanout.channel.WebPushChannel
 */
@FunctionalInterface
public interface Channel {

    /**
     * Sends to every recipient, using per-recipient notification details.
     *
     * <p>{@code notifications} is index-aligned with {@code recipients}. It may be {@code null},
     * shorter than {@code recipients}, or contain {@code null} entries; missing entries fall back
     * to the transport defaults.
     *
     * @param recipients    transport-specific recipient identifiers
     * @param notifications per-recipient notification details, may be {@code null}
     * @return one result per recipient, never {@code null}
     * @throws NullPointerException if {@code recipients} is null
     * @throws DispatchException    if dispatch could not be started at all
     */
    List<DispatchResult> send(List<String> recipients, List<Notification> notifications);

    /**
     * Sends the transport's default notification to every recipient.
     *
     * @param recipients transport-specific recipient identifiers
     * @return one result per recipient
     */
    default List<DispatchResult> send(List<String> recipients) {
        return send(recipients, null);
    }
}
