/**
 * Service Provider Interfaces (SPI) connecting channels to their collaborators.
 *
 * <p>Transport SDKs plug in through {@link io.fanout.spi.PushClient} and
 * {@link io.fanout.spi.WebPushClient}; monitoring plugs in through
 * {@link io.fanout.spi.MetricsExporter}.
 *
 * @see io.fanout.spi.PushClient
 * @see io.fanout.spi.WebPushClient
 * @see io.fanout.spi.MetricsExporter
 */
package io.fanout.spi;
