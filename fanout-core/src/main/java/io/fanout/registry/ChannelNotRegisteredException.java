package io.fanout.registry;

/**
 * Thrown when a channel is requested by a name that has no registration.
 *
 * <p>Callers can recover, for example by falling back to another channel; the requested
 * name is available from {@link #channelName()}.
 */
public final class ChannelNotRegisteredException extends RuntimeException {
    private final String channelName;

    public ChannelNotRegisteredException(String channelName) {
        super("Channel for " + channelName + " not registered");
        this.channelName = channelName;
    }

    public String channelName() {
        return channelName;
    }
}
