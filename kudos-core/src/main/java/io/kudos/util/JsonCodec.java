package io.kudos.util;

import java.util.Map;

/**
 * Encoder for flat string-valued JSON objects, used for webhook bodies.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies. Applications
 * that already ship Jackson or Gson can implement this interface to delegate to it.
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
     * Encodes a map as a JSON object string, in the map's iteration order. Entries with a
     * {@code null} value are omitted.
     *
     * @param fields the fields to encode
     * @return JSON object string, {@code "{}"} for a null or empty map
     */
    String toJson(Map<String, String> fields);
}
