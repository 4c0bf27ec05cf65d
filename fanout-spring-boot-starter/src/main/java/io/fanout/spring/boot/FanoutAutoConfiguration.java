package io.fanout.spring.boot;

import io.fanout.NotificationDispatcher;
import io.fanout.VapidDetails;
import io.fanout.channel.PushChannel;
import io.fanout.channel.WebPushChannel;
import io.fanout.registry.DefaultChannelRegistry;
import io.fanout.spi.MetricsExporter;
import io.fanout.spi.PushClient;
import io.fanout.spi.WebPushClient;
import io.fanout.util.JsonCodec;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for fan-out channels.
 *
 * <p>Always provides a {@link DefaultChannelRegistry} and a {@link NotificationDispatcher}.
 * A {@link PushChannel} is created when a {@link PushClient} bean exists and a
 * {@link WebPushChannel} when a {@link WebPushClient} bean exists; each is registered under
 * its configured name. Beans annotated with {@link NotificationChannel} are registered by
 * {@link NotificationChannelRegistrar}.
 *
 * @see FanoutProperties
 * @see FanoutMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(NotificationDispatcher.class)
@EnableConfigurationProperties(FanoutProperties.class)
public class FanoutAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public DefaultChannelRegistry channelRegistry() {
        return new DefaultChannelRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationChannelRegistrar notificationChannelRegistrar(
            ListableBeanFactory beanFactory, DefaultChannelRegistry channelRegistry) {
        return new NotificationChannelRegistrar(beanFactory, channelRegistry);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnBean(PushClient.class)
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "fanout.push", name = "enabled", matchIfMissing = true)
    public PushChannel pushChannel(FanoutProperties props,
                                   PushClient pushClient,
                                   DefaultChannelRegistry channelRegistry,
                                   ObjectProvider<MetricsExporter> metricsProvider) {
        FanoutProperties.Push push = props.getPush();
        PushChannel channel = PushChannel.builder()
                .client(pushClient)
                .name(push.getName())
                .maxMessagesPerSecond(push.getMaxMessagesPerSecond())
                .intervalMs(push.getIntervalMs())
                .chunkSize(push.getChunkSize())
                .metrics(metricsProvider.getIfAvailable())
                .build();
        channelRegistry.register(push.getName(), channel);
        return channel;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnBean(WebPushClient.class)
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "fanout.web-push", name = "enabled", matchIfMissing = true)
    public WebPushChannel webPushChannel(FanoutProperties props,
                                         WebPushClient webPushClient,
                                         DefaultChannelRegistry channelRegistry,
                                         ObjectProvider<MetricsExporter> metricsProvider,
                                         ObjectProvider<JsonCodec> codecProvider) {
        FanoutProperties.WebPush webPush = props.getWebPush();
        WebPushChannel.Builder builder = WebPushChannel.builder()
                .client(webPushClient)
                .name(webPush.getName())
                .maxMessagesPerSecond(webPush.getMaxMessagesPerSecond())
                .intervalMs(webPush.getIntervalMs())
                .maxConcurrentSends(webPush.getMaxConcurrentSends())
                .codec(codecProvider.getIfAvailable())
                .metrics(metricsProvider.getIfAvailable());
        FanoutProperties.Vapid vapid = webPush.getVapid();
        if (vapid.hasAllValues()) {
            builder.vapidDetails(new VapidDetails(vapid.getSubject(), vapid.getPublicKey(), vapid.getPrivateKey()));
        }
        WebPushChannel channel = builder.build();
        channelRegistry.register(webPush.getName(), channel);
        return channel;
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationDispatcher notificationDispatcher(DefaultChannelRegistry channelRegistry) {
        return new NotificationDispatcher(channelRegistry);
    }
}
