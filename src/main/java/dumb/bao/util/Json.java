package dumb.bao.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;

/**
 * The project's one {@link ObjectMapper}. Writing is for records the project owns, so a failure
 * there is a programming error and surfaces unchecked; reading is of outside input and stays checked.
 */
public final class Json {

    /** Pretty-printed output; unknown input properties are skipped so older files keep loading. */
    public static final ObjectMapper the = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private Json() {
    }

    public static String str(Object value) {
        try {
            return the.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not writable as JSON: " + value.getClass().getSimpleName(), e);
        }
    }

    /** @throws IllegalArgumentException when {@code value} has no JSON tree form */
    public static JsonNode node(Object value) {
        return the.valueToTree(value);
    }

    public static <T> T obj(String json, Class<T> type) throws JsonProcessingException {
        return the.readValue(json, type);
    }

    public static <T> T obj(String json, TypeReference<T> type) throws JsonProcessingException {
        return the.readValue(json, type);
    }

    public static <T> T obj(InputStream json, Class<T> type) throws IOException {
        return the.readValue(json, type);
    }

    public static <T> T obj(InputStream json, TypeReference<T> type) throws IOException {
        return the.readValue(json, type);
    }

    public static <T> T obj(JsonNode tree, Class<T> type) throws JsonProcessingException {
        return the.treeToValue(tree, type);
    }
}
