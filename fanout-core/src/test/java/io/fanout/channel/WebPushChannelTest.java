package io.fanout.channel;

import io.fanout.DispatchException;
import io.fanout.DispatchResult;
import io.fanout.Notification;
import io.fanout.VapidDetails;
import io.fanout.spi.PushSubscription;
import io.fanout.spi.WebPushClient;
import io.fanout.spi.WebPushOptions;
import io.fanout.util.JsonCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebPushChannelTest {

    private static final VapidDetails CHANNEL_VAPID =
            VapidDetails.forContact("ops@example.com", "channel-public", "channel-private");

    private final List<WebPushChannel> channels = new ArrayList<>();

    @AfterEach
    void tearDown() {
        channels.forEach(WebPushChannel::close);
    }

    private WebPushChannel track(WebPushChannel channel) {
        channels.add(channel);
        return channel;
    }

    @Test
    void sendsStrictlyOneAtATimeWithSingleSlot() {
        InstrumentedClient client = new InstrumentedClient(10);
        WebPushChannel channel = track(WebPushChannel.builder()
                .client(client)
                .maxConcurrentSends(1)
                .maxMessagesPerSecond(1000)
                .build());

        List<DispatchResult> results = channel.send(subscriptions("s0", "s1", "s2", "s3"));

        assertTrue(results.stream().allMatch(DispatchResult::isSuccess));
        assertEquals(1, client.peak.get());
        List<String> events = client.events;
        assertEquals(8, events.size());
        for (int i = 0; i < events.size(); i += 2) {
            assertTrue(events.get(i).startsWith("start:"), "unexpected order " + events);
            assertTrue(events.get(i + 1).startsWith("end:"), "unexpected order " + events);
            assertEquals(events.get(i).substring(6), events.get(i + 1).substring(4));
        }
    }

    @Test
    void neverExceedsConcurrencyCeiling() {
        InstrumentedClient client = new InstrumentedClient(20);
        RecordingMetricsExporter metrics = new RecordingMetricsExporter();
        WebPushChannel channel = track(WebPushChannel.builder()
                .client(client)
                .maxConcurrentSends(3)
                .maxMessagesPerSecond(1000)
                .metrics(metrics)
                .build());
        String[] ids = new String[12];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = "s" + i;
        }

        List<DispatchResult> results = channel.send(subscriptions(ids));

        assertEquals(12, results.size());
        assertTrue(results.stream().allMatch(DispatchResult::isSuccess));
        assertTrue(client.peak.get() <= 3, "peak concurrency " + client.peak.get());
        assertTrue(metrics.peakInFlight.get() <= 3);
        assertEquals(12, metrics.successes.get());
        assertEquals(0, metrics.lastInFlight.get());
        assertEquals(0, metrics.lastQueueDepth.get());
    }

    @Test
    void isolatesGoneSubscriptionAndKeepsRawRecipient() {
        InstrumentedClient client = new InstrumentedClient(0);
        WebPushChannel channel = track(WebPushChannel.builder().client(client).build());
        List<String> recipients = subscriptions("a", "gone-b", "c");

        List<DispatchResult> results = channel.send(recipients);

        assertEquals(3, results.size());
        for (int i = 0; i < recipients.size(); i++) {
            assertEquals(recipients.get(i), results.get(i).recipient());
        }
        assertTrue(results.get(0).isSuccess());
        assertEquals("201 https://push.example.com/a", results.get(0).response());
        assertFalse(results.get(1).isSuccess());
        assertEquals("410 Gone", results.get(1).error());
        assertTrue(results.get(2).isSuccess());
    }

    @Test
    void reportsUndecodableSubscriptionsWithoutSending() {
        InstrumentedClient client = new InstrumentedClient(0);
        RecordingMetricsExporter metrics = new RecordingMetricsExporter();
        WebPushChannel channel = track(WebPushChannel.builder().client(client).metrics(metrics).build());
        List<String> recipients = List.of(
                "not json",
                "{\"endpoint\":\"https://push.example.com/x\"}",
                subscription("ok"));

        List<DispatchResult> results = channel.send(recipients);

        assertFalse(results.get(0).isSuccess());
        assertTrue(results.get(0).error().startsWith("Invalid subscription: "));
        assertEquals("Invalid subscription: missing keys", results.get(1).error());
        assertTrue(results.get(2).isSuccess());
        assertEquals(1, client.calls.get());
        assertEquals(2, metrics.failures.get());
    }

    @Test
    void codecFailuresOfAnyKindAreReportedPerRecipient() {
        JsonCodec strict = new JsonCodec() {
            @Override
            public String toJson(Map<String, ?> object) {
                return JsonCodec.getDefault().toJson(object);
            }

            @Override
            public Map<String, Object> parseObject(String json) {
                if (json.equals("bad-record")) {
                    throw new UncheckedIOException(new IOException("Unexpected token"));
                }
                if (json.equals("empty-record")) {
                    return null;
                }
                return JsonCodec.getDefault().parseObject(json);
            }
        };
        InstrumentedClient client = new InstrumentedClient(0);
        RecordingMetricsExporter metrics = new RecordingMetricsExporter();
        WebPushChannel channel = track(WebPushChannel.builder()
                .client(client)
                .codec(strict)
                .metrics(metrics)
                .build());

        List<DispatchResult> results = channel.send(
                List.of(subscription("first"), "bad-record", "empty-record", subscription("last")));

        assertEquals(4, results.size());
        assertTrue(results.get(0).isSuccess());
        assertTrue(results.get(1).error().startsWith("Invalid subscription: "));
        assertTrue(results.get(1).error().contains("Unexpected token"));
        assertEquals("Invalid subscription: codec returned no object", results.get(2).error());
        assertTrue(results.get(3).isSuccess());
        assertEquals(2, client.calls.get());
        assertEquals(2, metrics.failures.get());
    }

    @Test
    void payloadUsesDefaultsForMissingFields() {
        InstrumentedClient client = new InstrumentedClient(0);
        WebPushChannel channel = track(WebPushChannel.builder().client(client).build());
        Notification first = Notification.builder()
                .title("Sale")
                .body("50% off")
                .data("sku", "A-1")
                .build();

        channel.send(subscriptions("p0", "p1"), List.of(first));

        Map<String, Object> firstPayload = JsonCodec.getDefault().parseObject(client.payloads.get("p0"));
        assertEquals("Sale", firstPayload.get("title"));
        assertEquals("50% off", firstPayload.get("body"));
        assertEquals(Map.of("sku", "A-1"), firstPayload.get("data"));
        Map<String, Object> secondPayload = JsonCodec.getDefault().parseObject(client.payloads.get("p1"));
        assertEquals(WebPushChannel.DEFAULT_TITLE, secondPayload.get("title"));
        assertEquals("", secondPayload.get("body"));
        assertEquals(Map.of(), secondPayload.get("data"));
    }

    @Test
    void passesRequestOptionsAndFallsBackToChannelVapid() {
        InstrumentedClient client = new InstrumentedClient(0);
        WebPushChannel channel = track(WebPushChannel.builder()
                .client(client)
                .vapidDetails(CHANNEL_VAPID)
                .build());
        VapidDetails own = new VapidDetails("https://example.com", "own-public", "own-private");
        Notification custom = Notification.builder()
                .ttlSeconds(3600)
                .vapidDetails(own)
                .header("Urgency", "high")
                .build();

        channel.send(subscriptions("o0", "o1"), List.of(custom));

        WebPushOptions customOptions = client.options.get("o0");
        assertEquals(Integer.valueOf(3600), customOptions.ttlSeconds());
        assertEquals(own, customOptions.vapidDetails());
        assertEquals(Map.of("Urgency", "high"), customOptions.headers());
        WebPushOptions defaultOptions = client.options.get("o1");
        assertNull(defaultOptions.ttlSeconds());
        assertEquals(CHANNEL_VAPID, defaultOptions.vapidDetails());
        assertTrue(defaultOptions.headers().isEmpty());
    }

    @Test
    void interruptedCallerFailsUndispatchedRecipients() {
        InstrumentedClient client = new InstrumentedClient(0);
        WebPushChannel channel = track(WebPushChannel.builder().client(client).build());

        Thread.currentThread().interrupt();
        List<DispatchResult> results;
        try {
            results = channel.send(subscriptions("i0", "i1"));
        } finally {
            assertTrue(Thread.interrupted());
        }

        assertEquals(2, results.size());
        assertTrue(results.stream().allMatch(r -> WebPushChannel.INTERRUPTED.equals(r.error())));
        assertEquals(0, client.calls.get());
    }

    @Test
    void emptyRecipientListSendsNothing() {
        InstrumentedClient client = new InstrumentedClient(0);
        WebPushChannel channel = track(WebPushChannel.builder().client(client).build());

        assertTrue(channel.send(List.of()).isEmpty());
        assertEquals(0, client.calls.get());
    }

    @Test
    void closedChannelRejectsRequests() {
        WebPushChannel channel = WebPushChannel.builder().client(new InstrumentedClient(0)).build();
        channel.close();

        assertThrows(DispatchException.class, () -> channel.send(subscriptions("late")));
    }

    @Test
    void builderValidatesConfiguration() {
        assertThrows(NullPointerException.class, () -> WebPushChannel.builder().build());
        assertThrows(IllegalArgumentException.class,
                () -> WebPushChannel.builder().client(new InstrumentedClient(0)).maxConcurrentSends(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> WebPushChannel.builder().client(new InstrumentedClient(0)).maxMessagesPerSecond(-1).build());
    }

    private static List<String> subscriptions(String... ids) {
        List<String> result = new ArrayList<>();
        for (String id : ids) {
            result.add(subscription(id));
        }
        return result;
    }

    private static String subscription(String id) {
        return "{\"endpoint\":\"https://push.example.com/" + id + "\","
                + "\"keys\":{\"p256dh\":\"key-" + id + "\",\"auth\":\"auth-" + id + "\"}}";
    }

    /**
     * Records call order and concurrency. Endpoints whose id starts with {@code gone} fail.
     */
    private static final class InstrumentedClient implements WebPushClient {
        final List<String> events = Collections.synchronizedList(new ArrayList<>());
        final Map<String, String> payloads = new ConcurrentHashMap<>();
        final Map<String, WebPushOptions> options = new ConcurrentHashMap<>();
        final AtomicInteger calls = new AtomicInteger();
        final AtomicInteger current = new AtomicInteger();
        final AtomicInteger peak = new AtomicInteger();
        private final long sleepMs;

        InstrumentedClient(long sleepMs) {
            this.sleepMs = sleepMs;
        }

        @Override
        public Object sendNotification(PushSubscription subscription, String payload, WebPushOptions options)
                throws Exception {
            String id = subscription.endpoint().substring("https://push.example.com/".length());
            calls.incrementAndGet();
            payloads.put(id, payload);
            this.options.put(id, options);
            events.add("start:" + id);
            peak.accumulateAndGet(current.incrementAndGet(), Math::max);
            try {
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
                if (id.startsWith("gone")) {
                    throw new Exception("410 Gone");
                }
                return "201 " + subscription.endpoint();
            } finally {
                current.decrementAndGet();
                events.add("end:" + id);
            }
        }
    }
}
