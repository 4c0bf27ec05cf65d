package io.fanout.spi;

import io.fanout.VapidDetails;

import java.util.Map;

/**
 * Per-request web push options. {@code null} fields are left to the client's defaults.
 *
 * @param ttlSeconds   how long the push service keeps an undelivered message, or {@code null}
 * @param vapidDetails signing details, or {@code null}
 * @param headers      extra request headers, never {@code null}
 */
public record WebPushOptions(Integer ttlSeconds, VapidDetails vapidDetails, Map<String, String> headers) {

    public WebPushOptions {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
