package io.fanout.spi;

import java.util.Map;
import java.util.Objects;

/**
 * A fully resolved push message addressed to one device token. Defaults have already been
 * applied, so no field is {@code null}.
 *
 * @param token device registration token
 * @param title notification title
 * @param body  notification body
 * @param data  structured data payload
 */
public record PushMessage(String token, String title, String body, Map<String, String> data) {

    public PushMessage {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(body, "body");
        data = Map.copyOf(data);
    }
}
