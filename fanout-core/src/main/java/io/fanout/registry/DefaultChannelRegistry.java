package io.fanout.registry;

import io.fanout.Channel;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe channel registry.
 *
 * <p>Registering a name that is already taken replaces the previous channel; a concurrent
 * {@link #get} sees either the old or the new channel, never a partial state. Sends already
 * running on a replaced channel are unaffected.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DefaultChannelRegistry registry = new DefaultChannelRegistry()
 *     .register("push", pushChannel)
 *     .register("web-push", webPushChannel);
 *
 * List<DispatchResult> results = registry.get("push").send(tokens, notifications);
 * }</pre>
 *
 * <p>The registry is an ordinary instance: create one per application and pass it to the
 * components that dispatch.
 *
 * @see ChannelRegistry
 */
public final class DefaultChannelRegistry implements ChannelRegistry {
    private static final Logger logger = Logger.getLogger(DefaultChannelRegistry.class.getName());

    private final Map<String, Channel> channels = new ConcurrentHashMap<>();

    /**
     * Registers {@code channel} under {@code name}, replacing any previous registration.
     *
     * @param name    the channel name
     * @param channel the channel
     * @return this registry for chaining
     * @throws IllegalArgumentException if {@code name} is empty
     */
    public DefaultChannelRegistry register(String name, Channel channel) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(channel, "channel");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be empty");
        }
        Channel previous = channels.put(name, channel);
        if (previous != null && previous != channel) {
            logger.log(Level.INFO, "Replaced channel registered as {0}", name);
        }
        return this;
    }

    /**
     * Removes the registration for {@code name}.
     *
     * @param name the channel name
     * @return the removed channel, or empty if none was registered
     */
    public Optional<Channel> unregister(String name) {
        Objects.requireNonNull(name, "name");
        return Optional.ofNullable(channels.remove(name));
    }

    /**
     * Removes every registration. Useful to reset state between test runs or on
     * reconfiguration.
     */
    public void clear() {
        channels.clear();
    }

    @Override
    public Channel get(String name) {
        Objects.requireNonNull(name, "name");
        Channel channel = channels.get(name);
        if (channel == null) {
            throw new ChannelNotRegisteredException(name);
        }
        return channel;
    }

    @Override
    public Optional<Channel> find(String name) {
        Objects.requireNonNull(name, "name");
        return Optional.ofNullable(channels.get(name));
    }

    @Override
    public Set<String> names() {
        return Set.copyOf(channels.keySet());
    }
}
