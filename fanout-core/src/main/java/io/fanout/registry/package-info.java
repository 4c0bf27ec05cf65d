/**
 * Channel lookup by name.
 *
 * <p>The registry maps each name to a single {@link io.fanout.Channel}. Looking up an
 * unknown name fails with {@link io.fanout.registry.ChannelNotRegisteredException}.
 *
 * @see io.fanout.registry.ChannelRegistry
 * @see io.fanout.registry.DefaultChannelRegistry
 */
package io.fanout.registry;
