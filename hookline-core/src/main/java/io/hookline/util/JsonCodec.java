package io.hookline.util;

import java.util.List;
import java.util.Map;

/**
 * JSON encoding used for event payloads, subscription metadata and handshake bodies.
 *
 * <p>The default implementation ({@link JacksonJsonCodec}) delegates to Jackson.
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
        return JacksonJsonCodec.INSTANCE;
    }

    /**
     * Re-serializes arbitrary JSON text in compact form. {@code null} or blank input
     * becomes {@code "{}"}.
     *
     * @param json raw JSON text
     * @return compact JSON
     * @throws IllegalArgumentException if the input is not valid JSON
     */
    String normalize(String json);

    /**
     * Serializes a value (maps, lists, strings, numbers, booleans) as compact JSON.
     *
     * @param value the value to encode
     * @return JSON text
     */
    String toJson(Object value);

    /**
     * Parses a JSON object into an insertion-ordered map. Returns an empty map for
     * {@code null}, empty or {@code "null"} input.
     *
     * @param json the JSON text
     * @return parsed map (never {@code null})
     * @throws IllegalArgumentException if the input is not a JSON object
     */
    Map<String, Object> parseObject(String json);

    /**
     * Parses a JSON array of strings. Returns an empty list for {@code null} or empty input.
     *
     * @param json the JSON text
     * @return parsed list (never {@code null})
     * @throws IllegalArgumentException if the input is not an array of strings
     */
    List<String> parseStringList(String json);
}
