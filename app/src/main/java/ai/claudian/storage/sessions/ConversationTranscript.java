package ai.claudian.storage.sessions;

import ai.claudian.storage.Json;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * A saved conversation.
 *
 * @param sessionId agent-side session to resume, null before the first response
 * @param lastResponseAt epoch millis of the last completed agent response
 * @param extra conversation-level fields this layer does not interpret (plan state, usage, attached files...)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversationTranscript(
        String id,
        String title,
        long createdAt,
        long updatedAt,
        @Nullable Long lastResponseAt,
        @Nullable String sessionId,
        List<ChatMessage> messages,
        @JsonIgnore ObjectNode extra) {

    static final String MESSAGES = "messages";
    static final Set<String> FIELDS =
            Set.of("id", "title", "createdAt", "updatedAt", "lastResponseAt", "sessionId", MESSAGES);

    public ConversationTranscript {
        title = title == null ? "" : title;
        messages = messages == null ? List.of() : List.copyOf(messages);
        extra = extra == null ? Json.newObject() : extra.deepCopy();
    }

    @JsonCreator
    public ConversationTranscript(
            @JsonProperty("id") String id,
            @JsonProperty("title") String title,
            @JsonProperty("createdAt") long createdAt,
            @JsonProperty("updatedAt") long updatedAt,
            @JsonProperty("lastResponseAt") @Nullable Long lastResponseAt,
            @JsonProperty("sessionId") @Nullable String sessionId,
            @JsonProperty(MESSAGES) List<ChatMessage> messages) {
        this(id, title, createdAt, updatedAt, lastResponseAt, sessionId, messages, null);
    }

    @Override
    @JsonIgnore
    public ObjectNode extra() {
        return extra.deepCopy();
    }

    public ConversationTranscript withMessages(List<ChatMessage> newMessages) {
        return new ConversationTranscript(
                id, title, createdAt, updatedAt, lastResponseAt, sessionId, newMessages, extra);
    }

    /**
     * Binds a conversation object, keeping unknown fields on the conversation and on every message.
     *
     * @throws JsonProcessingException if a known field has the wrong type or a message is not an object
     */
    public static ConversationTranscript fromNode(ObjectNode node) throws JsonProcessingException {
        ObjectNode meta = node.deepCopy();
        JsonNode rawMessages = meta.remove(MESSAGES);
        var known = Json.treeToValue(meta, ConversationTranscript.class);

        var messages = new ArrayList<ChatMessage>();
        if (rawMessages != null && rawMessages.isArray()) {
            for (JsonNode message : rawMessages) {
                if (!(message instanceof ObjectNode obj)) {
                    throw new Json.NotAnObjectException(
                            "message of " + known.id(), message.getNodeType().toString());
                }
                messages.add(ChatMessage.fromNode(obj));
            }
        }
        meta.remove(FIELDS);
        return new ConversationTranscript(
                known.id(),
                known.title(),
                known.createdAt(),
                known.updatedAt(),
                known.lastResponseAt(),
                known.sessionId(),
                messages,
                meta);
    }

    /** Conversation-level fields without the message list. */
    public ObjectNode metaNode() {
        ObjectNode node = Json.valueToObject(this);
        node.remove(MESSAGES);
        extra.fields().forEachRemaining(e -> {
            if (!node.has(e.getKey())) {
                node.set(e.getKey(), e.getValue().deepCopy());
            }
        });
        return node;
    }
}
