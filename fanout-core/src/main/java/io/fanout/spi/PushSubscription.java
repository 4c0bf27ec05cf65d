package io.fanout.spi;

import java.util.Objects;

/**
 * A browser push subscription, decoded from the JSON record the browser produced:
 * {@code {"endpoint": "...", "keys": {"p256dh": "...", "auth": "..."}}}.
 *
 * @param endpoint push service URL for this subscription
 * @param p256dh   client public key used to encrypt the payload
 * @param auth     client authentication secret
 */
public record PushSubscription(String endpoint, String p256dh, String auth) {

    public PushSubscription {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(p256dh, "p256dh");
        Objects.requireNonNull(auth, "auth");
    }
}
