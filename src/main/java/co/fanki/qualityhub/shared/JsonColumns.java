package co.fanki.qualityhub.shared;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.List;
import java.util.Map;

/**
 * Converts JSONB column values to and from their Java representation.
 *
 * <p>Repositories bind the produced strings with
 * {@code CAST(:x AS JSONB)} and read them back with
 * {@code rs.getString(column)}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class JsonColumns {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule());

    /** Type for free-form JSON objects. */
    public static final TypeReference<Map<String, Object>> OBJECT =
            new TypeReference<>() { };

    /** Type for arrays of free-form JSON objects. */
    public static final TypeReference<List<Map<String, Object>>> OBJECT_LIST =
            new TypeReference<>() { };

    /** Type for arrays of strings. */
    public static final TypeReference<List<String>> STRING_LIST =
            new TypeReference<>() { };

    private JsonColumns() {
    }

    /**
     * Serializes a value for a JSONB column.
     *
     * @param value the value, may be null
     * @return the JSON text, or null when value is null
     */
    public static String toJson(final Object value) {
        if (value == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Value cannot be stored as JSON", e);
        }
    }

    /**
     * Parses a JSONB column value.
     *
     * @param json the JSON text, may be null
     * @param type the target type
     * @param <T> the target type
     * @return the parsed value, or null when json is null
     */
    public static <T> T fromJson(final String json,
            final TypeReference<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(json, type);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Corrupted JSON column: "
                    + e.getOriginalMessage(), e);
        }
    }

}
