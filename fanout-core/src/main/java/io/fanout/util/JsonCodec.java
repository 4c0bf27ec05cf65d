package io.fanout.util;

import java.util.Map;

/**
 * Codec for JSON objects exchanged with web push transports: subscription records passed
 * as recipient identifiers and the notification payload sent to the browser.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no external dependencies and
 * supports objects whose values are strings, numbers, booleans, {@code null} or nested
 * objects. Arrays are not supported. Applications that already use Jackson or Gson can
 * implement this interface to delegate to their library.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a map as a JSON object. Values may be {@code String}, {@code Number},
     * {@code Boolean}, {@code null} or a nested {@code Map} with string keys.
     *
     * @param object the object to encode
     * @return JSON text, {@code "{}"} for a null or empty map
     * @throws IllegalArgumentException if a key is null or a value has an unsupported type
     */
    String toJson(Map<String, ?> object);

    /**
     * Parses a JSON object. Strings map to {@code String}, integral numbers to {@code Long},
     * other numbers to {@code Double}, {@code true}/{@code false} to {@code Boolean},
     * {@code null} to {@code null} and nested objects to {@code Map}.
     *
     * @param json the JSON text
     * @return the parsed object, never {@code null}
     * @throws IllegalArgumentException if the input is null, blank or not a valid JSON object
     */
    Map<String, Object> parseObject(String json);
}
