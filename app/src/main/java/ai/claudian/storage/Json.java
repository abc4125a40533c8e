package ai.claudian.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Shared Jackson configuration for every JSON file the storage layer reads or writes. */
public final class Json {
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private static final ObjectWriter COMPACT = MAPPER.writer().without(SerializationFeature.INDENT_OUTPUT);

    private Json() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toPrettyJson(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsString(value) + "\n";
    }

    /** Single-line form, used for JSON Lines records. */
    public static String toCompactJson(Object value) throws JsonProcessingException {
        return COMPACT.writeValueAsString(value);
    }

    public static JsonNode readTree(String json) throws JsonProcessingException {
        return MAPPER.readTree(json);
    }

    /**
     * Parses {@code json} and requires a top-level object.
     *
     * @throws JsonProcessingException if the text is malformed or its root is not an object
     */
    public static ObjectNode readObject(String json, String source) throws JsonProcessingException {
        JsonNode node = MAPPER.readTree(json);
        if (node instanceof ObjectNode obj) {
            return obj;
        }
        throw new NotAnObjectException(source, node == null ? "empty document" : node.getNodeType().toString());
    }

    public static <T> T treeToValue(JsonNode node, Class<T> type) throws JsonProcessingException {
        return MAPPER.treeToValue(node, type);
    }

    public static ObjectNode valueToObject(Object value) {
        return MAPPER.valueToTree(value);
    }

    public static ObjectNode newObject() {
        return MAPPER.createObjectNode();
    }

    /** Thrown when a file that must hold a JSON object holds something else. */
    public static final class NotAnObjectException extends JsonProcessingException {
        public NotAnObjectException(String source, String actual) {
            super("Expected a JSON object in " + source + " but found " + actual);
        }
    }
}
