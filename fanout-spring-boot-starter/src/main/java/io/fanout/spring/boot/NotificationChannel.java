package io.fanout.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a notification channel to register under {@link #value()}.
 *
 * <p>The annotated bean must implement {@link io.fanout.Channel}.
 *
 * <pre>{@code
 * @Component
 * @NotificationChannel("sms")
 * public class SmsChannel implements Channel {
 *     public List<DispatchResult> send(List<String> recipients, List<Notification> notifications) { ... }
 * }
 * }</pre>
 *
 * @see NotificationChannelRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface NotificationChannel {

    /**
     * Registry name of the channel. Must not be empty.
     */
    String value();
}
