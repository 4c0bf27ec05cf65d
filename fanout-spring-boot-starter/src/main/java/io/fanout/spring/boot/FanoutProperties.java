package io.fanout.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for fan-out channels.
 *
 * @see FanoutAutoConfiguration
 */
@ConfigurationProperties(prefix = "fanout")
public class FanoutProperties {

    private final Push push = new Push();
    private final WebPush webPush = new WebPush();
    private final Metrics metrics = new Metrics();

    public Push getPush() {
        return push;
    }

    public WebPush getWebPush() {
        return webPush;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Batch-oriented push channel, created when a {@code PushClient} bean exists.
     */
    public static class Push {
        private boolean enabled = true;
        private String name = "push";
        private int maxMessagesPerSecond = 500;
        private long intervalMs = 1000;
        private int chunkSize = 500;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public int getMaxMessagesPerSecond() {
            return maxMessagesPerSecond;
        }

        public void setMaxMessagesPerSecond(int maxMessagesPerSecond) {
            this.maxMessagesPerSecond = maxMessagesPerSecond;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }
    }

    /**
     * Concurrency-bounded web push channel, created when a {@code WebPushClient} bean exists.
     */
    public static class WebPush {
        private boolean enabled = true;
        private String name = "web-push";
        private int maxMessagesPerSecond = 50;
        private long intervalMs = 1000;
        private int maxConcurrentSends = 5;
        private final Vapid vapid = new Vapid();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public int getMaxMessagesPerSecond() {
            return maxMessagesPerSecond;
        }

        public void setMaxMessagesPerSecond(int maxMessagesPerSecond) {
            this.maxMessagesPerSecond = maxMessagesPerSecond;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getMaxConcurrentSends() {
            return maxConcurrentSends;
        }

        public void setMaxConcurrentSends(int maxConcurrentSends) {
            this.maxConcurrentSends = maxConcurrentSends;
        }

        public Vapid getVapid() {
            return vapid;
        }
    }

    /**
     * Default VAPID details. Applied only when all three values are set.
     */
    public static class Vapid {
        private String subject;
        private String publicKey;
        private String privateKey;

        public String getSubject() {
            return subject;
        }

        public void setSubject(String subject) {
            this.subject = subject;
        }

        public String getPublicKey() {
            return publicKey;
        }

        public void setPublicKey(String publicKey) {
            this.publicKey = publicKey;
        }

        public String getPrivateKey() {
            return privateKey;
        }

        public void setPrivateKey(String privateKey) {
            this.privateKey = privateKey;
        }

        boolean hasAllValues() {
            return hasText(subject) && hasText(publicKey) && hasText(privateKey);
        }

        private static boolean hasText(String value) {
            return value != null && !value.isBlank();
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "fanout";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
