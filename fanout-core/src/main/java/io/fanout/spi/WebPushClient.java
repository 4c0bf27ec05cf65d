package io.fanout.spi;

/**
 * Delivery capability for the Web Push protocol: encrypts a payload for one subscription and
 * posts it to the subscription's push service.
 *
 * <p>Implementations are called concurrently and must be thread-safe.
 *
 * @see io.fanout.channel.WebPushChannel
 */
@FunctionalInterface
public interface WebPushClient {

    /**
     * Sends a payload to one subscription.
     *
     * @param subscription the target subscription
     * @param payload      JSON payload delivered to the service worker
     * @param options      per-request options
     * @return the push service response
     * @throws Exception if the push service rejected the request or could not be reached
     */
    Object sendNotification(PushSubscription subscription, String payload, WebPushOptions options) throws Exception;
}
