/**
 * Spring Boot auto-configuration for fan-out channels.
 *
 * <p>{@link io.fanout.spring.boot.FanoutAutoConfiguration} builds push and web push channels
 * from {@code fanout.*} application properties when the matching transport client bean is
 * present, registers them in a {@link io.fanout.registry.DefaultChannelRegistry} and exposes
 * a {@link io.fanout.NotificationDispatcher}.
 *
 * <p>Use {@link io.fanout.spring.boot.NotificationChannel @NotificationChannel} on
 * {@link io.fanout.Channel} beans to register custom channels declaratively.
 *
 * @see io.fanout.spring.boot.FanoutAutoConfiguration
 * @see io.fanout.spring.boot.FanoutProperties
 * @see io.fanout.spring.boot.NotificationChannel
 * @see io.fanout.spring.boot.NotificationChannelRegistrar
 */
package io.fanout.spring.boot;
