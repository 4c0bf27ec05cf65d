package io.fanout.spi;

/**
 * Delivery capability of a batch-capable push provider, such as Firebase Cloud Messaging.
 *
 * <p>Implementations wrap the provider SDK and own authentication and credentials. They are
 * called concurrently from the channel's send pool and must be thread-safe. Transport
 * timeouts are the implementation's responsibility and should surface as exceptions.
 *
 * @see io.fanout.channel.PushChannel
 */
@FunctionalInterface
public interface PushClient {

    /**
     * Sends one message.
     *
     * @param message the message to deliver
     * @param dryRun  when {@code true}, validate without delivering
     * @return the provider's message identifier
     * @throws Exception if the provider rejected the message or could not be reached
     */
    String send(PushMessage message, boolean dryRun) throws Exception;
}
