/**
 * Root API for fanout: rate-limited, fault-isolated delivery of notifications to many
 * recipients through interchangeable channels.
 *
 * <h2>Core Design</h2>
 * <p>A {@link io.fanout.Channel} sends one request to many recipients and returns exactly one
 * {@link io.fanout.DispatchResult} per recipient. Per-recipient failures become failed
 * results; only failures that prevent dispatch altogether are thrown as
 * {@link io.fanout.DispatchException}. Each channel adapter owns a
 * {@linkplain io.fanout.ratelimit.RateLimiter token-bucket rate limiter} matching its
 * provider's limits. Channels are looked up by name through a
 * {@linkplain io.fanout.registry.ChannelRegistry registry}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>fanout-core</b> - API, rate limiter, registry, channel adapters (ULID ids only)</li>
 *   <li><b>fanout-micrometer</b> - optional Micrometer metrics bridge</li>
 *   <li><b>fanout-spring-boot-starter</b> - Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * PushChannel push = PushChannel.builder()
 *     .client(fcmClient)
 *     .maxMessagesPerSecond(500)
 *     .build();
 * WebPushChannel webPush = WebPushChannel.builder()
 *     .client(webPushClient)
 *     .vapidDetails(VapidDetails.forContact("ops@example.com", publicKey, privateKey))
 *     .maxConcurrentSends(5)
 *     .build();
 *
 * DefaultChannelRegistry registry = new DefaultChannelRegistry()
 *     .register("push", push)
 *     .register("web-push", webPush);
 *
 * DispatchReport report = new NotificationDispatcher(registry)
 *     .dispatch("push", tokens, List.of(Notification.of("Hello", "World")));
 * }</pre>
 *
 * @see io.fanout.Channel
 * @see io.fanout.NotificationDispatcher
 * @see io.fanout.Notification
 */
package io.fanout;
