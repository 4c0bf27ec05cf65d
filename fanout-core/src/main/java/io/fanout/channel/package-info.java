/**
 * Channel adapters combining a {@link io.fanout.ratelimit.RateLimiter} with a transport client.
 *
 * <p>{@link io.fanout.channel.PushChannel} rate-limits fixed-size chunks for batch-capable
 * providers. {@link io.fanout.channel.WebPushChannel} rate-limits single sends and caps how
 * many are in flight at once.
 */
package io.fanout.channel;
