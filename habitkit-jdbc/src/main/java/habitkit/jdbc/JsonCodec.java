package habitkit.jdbc;

import java.util.Map;

/**
 * Encodes namespace documents to and from the JSON text stored in the {@code data} column.
 *
 * @see JacksonJsonCodec
 */
public interface JsonCodec {

    /**
     * Returns the shared Jackson-backed codec.
     */
    static JsonCodec getDefault() {
        return JacksonJsonCodec.INSTANCE;
    }

    /**
     * Encodes a namespace document as a JSON object string.
     *
     * @param document the document; {@code null} encodes as {@code {}}
     * @return JSON text
     * @throws IllegalArgumentException if the document cannot be encoded
     */
    String toJson(Map<String, ?> document);

    /**
     * Parses a JSON object string. Returns an empty mutable map for {@code null} or blank input.
     *
     * @param json the JSON text
     * @return the parsed document, mutable
     * @throws IllegalArgumentException if the input is not a JSON object
     */
    Map<String, Object> parseObject(String json);
}
