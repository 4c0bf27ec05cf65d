/**
 * Token-bucket admission control for channel adapters.
 *
 * @see io.fanout.ratelimit.RateLimiter
 */
package io.fanout.ratelimit;
