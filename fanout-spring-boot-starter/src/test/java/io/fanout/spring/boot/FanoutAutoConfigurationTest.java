package io.fanout.spring.boot;

import io.fanout.DispatchReport;
import io.fanout.NotificationDispatcher;
import io.fanout.VapidDetails;
import io.fanout.channel.PushChannel;
import io.fanout.channel.WebPushChannel;
import io.fanout.registry.DefaultChannelRegistry;
import io.fanout.spi.PushClient;
import io.fanout.spi.WebPushClient;
import io.fanout.spi.WebPushOptions;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FanoutAutoConfigurationTest {

    private static final String SUBSCRIPTION = "{\"endpoint\":\"https://push.example.com/1\","
            + "\"keys\":{\"p256dh\":\"key\",\"auth\":\"auth\"}}";

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(FanoutAutoConfiguration.class));

    @Test
    void createsRegistryAndDispatcherWithoutClients() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("channelRegistry"));
            assertTrue(ctx.containsBean("notificationDispatcher"));
            assertTrue(ctx.containsBean("notificationChannelRegistrar"));
            assertFalse(ctx.containsBean("pushChannel"));
            assertFalse(ctx.containsBean("webPushChannel"));
            assertTrue(ctx.getBean(DefaultChannelRegistry.class).names().isEmpty());
        });
    }

    @Test
    void createsAndRegistersChannelsForClients() {
        runner.withUserConfiguration(ClientConfig.class).run(ctx -> {
            PushChannel push = ctx.getBean(PushChannel.class);
            WebPushChannel webPush = ctx.getBean(WebPushChannel.class);
            DefaultChannelRegistry registry = ctx.getBean(DefaultChannelRegistry.class);

            assertEquals(Set.of("push", "web-push"), registry.names());
            assertSame(push, registry.get("push"));
            assertSame(webPush, registry.get("web-push"));
            assertEquals(500, push.chunkSize());
            assertEquals(5, webPush.maxConcurrentSends());
        });
    }

    @Test
    void appliesConfiguredNamesAndLimits() {
        runner.withUserConfiguration(ClientConfig.class)
                .withPropertyValues(
                        "fanout.push.name=fcm",
                        "fanout.push.chunk-size=100",
                        "fanout.web-push.name=browser",
                        "fanout.web-push.max-concurrent-sends=2")
                .run(ctx -> {
                    DefaultChannelRegistry registry = ctx.getBean(DefaultChannelRegistry.class);
                    assertEquals(Set.of("fcm", "browser"), registry.names());
                    assertEquals("fcm", ctx.getBean(PushChannel.class).name());
                    assertEquals(100, ctx.getBean(PushChannel.class).chunkSize());
                    assertEquals(2, ctx.getBean(WebPushChannel.class).maxConcurrentSends());
                });
    }

    @Test
    void disabledChannelIsNotCreated() {
        runner.withUserConfiguration(ClientConfig.class)
                .withPropertyValues("fanout.push.enabled=false")
                .run(ctx -> {
                    assertFalse(ctx.containsBean("pushChannel"));
                    assertEquals(Set.of("web-push"), ctx.getBean(DefaultChannelRegistry.class).names());
                });
    }

    @Test
    void dispatcherRoutesThroughConfiguredPushChannel() {
        runner.withUserConfiguration(ClientConfig.class).run(ctx -> {
            NotificationDispatcher dispatcher = ctx.getBean(NotificationDispatcher.class);

            DispatchReport report = dispatcher.dispatch("push", List.of("t1", "t2"));

            assertTrue(report.allSucceeded());
            assertEquals("msg-t1", report.results().get(0).response());
        });
    }

    @Test
    void webPushChannelUsesConfiguredVapidDetails() {
        runner.withUserConfiguration(ClientConfig.class)
                .withPropertyValues(
                        "fanout.web-push.vapid.subject=mailto:ops@example.com",
                        "fanout.web-push.vapid.public-key=BPub",
                        "fanout.web-push.vapid.private-key=priv")
                .run(ctx -> {
                    ctx.getBean(NotificationDispatcher.class).dispatch("web-push", List.of(SUBSCRIPTION));

                    WebPushOptions options = ctx.getBean(ClientConfig.class).lastOptions.get();
                    assertEquals(new VapidDetails("mailto:ops@example.com", "BPub", "priv"), options.vapidDetails());
                });
    }

    @Test
    void partialVapidConfigurationIsIgnored() {
        runner.withUserConfiguration(ClientConfig.class)
                .withPropertyValues("fanout.web-push.vapid.subject=mailto:ops@example.com")
                .run(ctx -> {
                    ctx.getBean(NotificationDispatcher.class).dispatch("web-push", List.of(SUBSCRIPTION));

                    assertNull(ctx.getBean(ClientConfig.class).lastOptions.get().vapidDetails());
                });
    }

    @Test
    void backsOffWhenCustomRegistryPresent() {
        runner.withUserConfiguration(CustomRegistryConfig.class).run(ctx -> {
            assertSame(CustomRegistryConfig.REGISTRY, ctx.getBean(DefaultChannelRegistry.class));
            assertInstanceOf(NotificationDispatcher.class, ctx.getBean(NotificationDispatcher.class));
        });
    }

    @Configuration
    static class ClientConfig {
        final AtomicReference<WebPushOptions> lastOptions = new AtomicReference<>();

        @Bean
        PushClient pushClient() {
            return (message, dryRun) -> "msg-" + message.token();
        }

        @Bean
        WebPushClient webPushClient() {
            return (subscription, payload, options) -> {
                lastOptions.set(options);
                return 201;
            };
        }
    }

    @Configuration
    static class CustomRegistryConfig {
        static final DefaultChannelRegistry REGISTRY = new DefaultChannelRegistry();

        @Bean
        DefaultChannelRegistry customRegistry() {
            return REGISTRY;
        }
    }
}
