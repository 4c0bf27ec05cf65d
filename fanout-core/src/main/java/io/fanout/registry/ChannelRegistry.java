package io.fanout.registry;

import io.fanout.Channel;

import java.util.Optional;
import java.util.Set;

/**
 * Resolves delivery channels by name.
 *
 * <p>Each name maps to at most one channel. The
 * {@linkplain io.fanout.NotificationDispatcher dispatcher} uses this registry to route a
 * request to its channel.
 *
 * @see DefaultChannelRegistry
 */
public interface ChannelRegistry {

    /**
     * Returns the channel registered under {@code name}.
     *
     * @param name the channel name
     * @return the registered channel
     * @throws ChannelNotRegisteredException if no channel is registered under {@code name}
     */
    Channel get(String name);

    /**
     * Returns the channel registered under {@code name}, if any.
     *
     * @param name the channel name
     * @return the channel, or empty if unregistered
     */
    Optional<Channel> find(String name);

    /**
     * Returns a snapshot of the registered channel names.
     *
     * @return registered names
     */
    Set<String> names();
}
