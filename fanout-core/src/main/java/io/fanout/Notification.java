package io.fanout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable per-recipient notification details.
 *
 * <p>Every field is optional. Channels read the fields their transport supports and fall
 * back to their own defaults for anything unset: a push channel uses {@link #title()},
 * {@link #body()}, {@link #data()} and {@link #dryRun()}; a web push channel additionally
 * uses {@link #ttlSeconds()}, {@link #vapidDetails()} and {@link #headers()}.
 *
 * <pre>{@code
 * Notification welcome = Notification.builder()
 *     .title("Welcome")
 *     .body("Thanks for signing up")
 *     .data("screen", "home")
 *     .build();
 * }</pre>
 */
public final class Notification {
    private static final Notification EMPTY = builder().build();

    private final String title;
    private final String body;
    private final Map<String, String> data;
    private final boolean dryRun;
    private final Integer ttlSeconds;
    private final VapidDetails vapidDetails;
    private final Map<String, String> headers;

    private Notification(Builder builder) {
        this.title = builder.title;
        this.body = builder.body;
        this.data = copyOf(builder.data, "data");
        this.dryRun = builder.dryRun;
        if (builder.ttlSeconds != null && builder.ttlSeconds < 0) {
            throw new IllegalArgumentException("ttlSeconds must be >= 0");
        }
        this.ttlSeconds = builder.ttlSeconds;
        this.vapidDetails = builder.vapidDetails;
        this.headers = copyOf(builder.headers, "headers");
    }

    private static Map<String, String> copyOf(Map<String, String> source, String field) {
        if (source.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, String> copy = new LinkedHashMap<>(source);
        if (copy.containsKey(null)) {
            throw new IllegalArgumentException(field + " cannot contain null keys");
        }
        if (copy.containsValue(null)) {
            throw new IllegalArgumentException(field + " cannot contain null values");
        }
        return Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a notification with every field unset.
     *
     * @return the empty notification
     */
    public static Notification empty() {
        return EMPTY;
    }

    /**
     * Returns the notification aligned with recipient {@code index}, or {@link #empty()} when
     * {@code notifications} is null, too short, or holds {@code null} at that index.
     *
     * @param notifications index-aligned notifications, may be {@code null}
     * @param index         recipient index
     * @return the notification for that recipient, never {@code null}
     */
    public static Notification at(List<Notification> notifications, int index) {
        if (notifications == null || index >= notifications.size()) {
            return EMPTY;
        }
        Notification notification = notifications.get(index);
        return notification != null ? notification : EMPTY;
    }

    /**
     * Creates a notification with only a title and body.
     *
     * @param title the title
     * @param body  the body
     * @return a new notification
     */
    public static Notification of(String title, String body) {
        return builder().title(title).body(body).build();
    }

    /**
     * Returns the title, or {@code null} when the channel default should be used.
     *
     * @return the title or {@code null}
     */
    public String title() {
        return title;
    }

    /**
     * Returns the body, or {@code null} when the channel default should be used.
     *
     * @return the body or {@code null}
     */
    public String body() {
        return body;
    }

    public Map<String, String> data() {
        return data;
    }

    public boolean dryRun() {
        return dryRun;
    }

    public Integer ttlSeconds() {
        return ttlSeconds;
    }

    public VapidDetails vapidDetails() {
        return vapidDetails;
    }

    public Map<String, String> headers() {
        return headers;
    }

    @Override
    public String toString() {
        return "Notification{title=" + title
                + ", body=" + body
                + ", data=" + data
                + ", dryRun=" + dryRun
                + ", ttlSeconds=" + ttlSeconds
                + ", headers=" + headers.keySet()
                + '}';
    }

    /** Builder for {@link Notification}. */
    public static final class Builder {
        private String title;
        private String body;
        private final Map<String, String> data = new LinkedHashMap<>();
        private boolean dryRun;
        private Integer ttlSeconds;
        private VapidDetails vapidDetails;
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        /**
         * Replaces the structured data payload.
         *
         * @param data string key/value pairs delivered alongside the notification
         * @return this builder
         */
        public Builder data(Map<String, String> data) {
            this.data.clear();
            if (data != null) {
                this.data.putAll(data);
            }
            return this;
        }

        public Builder data(String key, String value) {
            this.data.put(key, value);
            return this;
        }

        /**
         * Asks the transport to validate the message without delivering it.
         *
         * @param dryRun whether to validate only
         * @return this builder
         */
        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        /**
         * Sets how long the push service should retain an undelivered message.
         *
         * @param ttlSeconds time-to-live in seconds, must be &ge; 0
         * @return this builder
         */
        public Builder ttlSeconds(Integer ttlSeconds) {
            this.ttlSeconds = ttlSeconds;
            return this;
        }

        /**
         * Overrides the channel's VAPID signing details for this notification.
         *
         * @param vapidDetails the signing details
         * @return this builder
         */
        public Builder vapidDetails(VapidDetails vapidDetails) {
            this.vapidDetails = vapidDetails;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers.clear();
            if (headers != null) {
                this.headers.putAll(headers);
            }
            return this;
        }

        public Builder header(String name, String value) {
            this.headers.put(name, value);
            return this;
        }

        /**
         * Builds the notification.
         *
         * @return a new {@link Notification}
         * @throws IllegalArgumentException if {@code ttlSeconds} is negative, or {@code data}
         *     or {@code headers} contain null keys or values
         */
        public Notification build() {
            return new Notification(this);
        }
    }
}
