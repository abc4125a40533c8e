package ai.claudian.storage.sessions;

import ai.claudian.storage.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Splitter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * JSON Lines format of a transcript file: a {@code meta} record first, then one {@code message} record per line.
 *
 * <pre>
 * {"type":"meta","id":"conv-1","title":"Plan","createdAt":1,"updatedAt":2,"sessionId":"s-9"}
 * {"type":"message","message":{"id":"m1","role":"user","content":"hi","timestamp":1}}
 * </pre>
 */
public final class SessionFiles {
    private static final Logger logger = LogManager.getLogger(SessionFiles.class);

    public static final String EXTENSION = ".jsonl";

    static final String TYPE = "type";
    static final String META = "meta";
    static final String MESSAGE = "message";

    private static final Splitter LINES = Splitter.onPattern("\r?\n").omitEmptyStrings();

    private SessionFiles() {}

    public static String serialize(ConversationTranscript transcript) throws JsonProcessingException {
        ObjectNode meta = Json.newObject().put(TYPE, META);
        meta.setAll(transcript.metaNode());
        meta.put(TYPE, META);

        var sb = new StringBuilder(Json.toCompactJson(meta)).append('\n');
        for (ChatMessage message : transcript.messages()) {
            ObjectNode line = Json.newObject().put(TYPE, MESSAGE);
            line.set(MESSAGE, message.toNode());
            sb.append(Json.toCompactJson(line)).append('\n');
        }
        return sb.toString();
    }

    /**
     * Parses a transcript file. A malformed message line is skipped; a missing or malformed meta line fails the
     * whole file.
     *
     * @throws IOException if the meta line is absent, unparseable or has no id
     */
    public static ConversationTranscript parse(String source, String text) throws IOException {
        List<String> lines = LINES.splitToList(text);
        if (lines.isEmpty()) {
            throw new IOException("Empty transcript " + source);
        }
        ObjectNode meta = Json.readObject(lines.get(0), source);
        JsonNode id = meta.get("id");
        if (!META.equals(meta.path(TYPE).asText()) || id == null || !id.isTextual() || id.asText().isBlank()) {
            throw new IOException("Transcript " + source + " has no valid meta line");
        }
        meta.remove(TYPE);
        meta.putArray(ConversationTranscript.MESSAGES);
        var transcript = ConversationTranscript.fromNode(meta);

        var messages = new ArrayList<ChatMessage>(lines.size() - 1);
        for (int i = 1; i < lines.size(); i++) {
            try {
                JsonNode line = Json.readTree(lines.get(i));
                JsonNode message = line.get(MESSAGE);
                if (MESSAGE.equals(line.path(TYPE).asText()) && message instanceof ObjectNode obj) {
                    messages.add(ChatMessage.fromNode(obj));
                } else {
                    logger.debug("Ignoring non-message line {} of {}", i + 1, source);
                }
            } catch (JsonProcessingException e) {
                logger.warn("Skipping malformed line {} of {}: {}", i + 1, source, e.getOriginalMessage());
            }
        }
        return transcript.withMessages(messages);
    }
}
