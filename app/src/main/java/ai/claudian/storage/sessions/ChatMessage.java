package ai.claudian.storage.sessions;

import ai.claudian.storage.Json;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * One persisted chat message.
 *
 * @param displayContent what the UI shows when it differs from {@code content}, e.g. {@code /tests} for an expanded
 *     command prompt
 * @param timestamp epoch millis
 * @param extra fields this layer does not interpret (tool calls, content blocks, images, usage...), written back as
 *     read
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatMessage(
        String id,
        Role role,
        String content,
        @Nullable String displayContent,
        long timestamp,
        @Nullable List<String> contextFiles,
        @Nullable Boolean hidden,
        @JsonIgnore ObjectNode extra) {

    static final Set<String> FIELDS =
            Set.of("id", "role", "content", "displayContent", "timestamp", "contextFiles", "hidden");

    public enum Role {
        @JsonProperty("user")
        USER,
        @JsonProperty("assistant")
        ASSISTANT,
        /** Only found in very old transcripts. */
        @JsonProperty("system")
        SYSTEM
    }

    public ChatMessage {
        content = content == null ? "" : content;
        extra = extra == null ? Json.newObject() : extra.deepCopy();
    }

    @JsonCreator
    public ChatMessage(
            @JsonProperty("id") String id,
            @JsonProperty("role") Role role,
            @JsonProperty("content") String content,
            @JsonProperty("displayContent") @Nullable String displayContent,
            @JsonProperty("timestamp") long timestamp,
            @JsonProperty("contextFiles") @Nullable List<String> contextFiles,
            @JsonProperty("hidden") @Nullable Boolean hidden) {
        this(id, role, content, displayContent, timestamp, contextFiles, hidden, null);
    }

    public static ChatMessage user(String id, String content, long timestamp) {
        return new ChatMessage(id, Role.USER, content, null, timestamp, null, null);
    }

    public static ChatMessage assistant(String id, String content, long timestamp) {
        return new ChatMessage(id, Role.ASSISTANT, content, null, timestamp, null, null);
    }

    @Override
    @JsonIgnore
    public ObjectNode extra() {
        return extra.deepCopy();
    }

    /** Binds the known fields and keeps everything else in {@link #extra()}. */
    public static ChatMessage fromNode(ObjectNode node) throws JsonProcessingException {
        var known = Json.treeToValue(node, ChatMessage.class);
        ObjectNode rest = node.deepCopy();
        rest.remove(FIELDS);
        return new ChatMessage(
                known.id(),
                known.role(),
                known.content(),
                known.displayContent(),
                known.timestamp(),
                known.contextFiles(),
                known.hidden(),
                rest);
    }

    public ObjectNode toNode() {
        ObjectNode node = Json.valueToObject(this);
        extra.fields().forEachRemaining(e -> {
            if (!node.has(e.getKey())) {
                node.set(e.getKey(), e.getValue().deepCopy());
            }
        });
        return node;
    }
}
