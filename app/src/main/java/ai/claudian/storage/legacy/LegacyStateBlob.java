package ai.claudian.storage.legacy;

import ai.claudian.storage.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of the host state object as left by earlier releases, which kept bookkeeping and whole command and
 * conversation lists there. Keys not listed in {@link #CONSUMED_KEYS} belong to the host and are never removed.
 */
public final class LegacyStateBlob {
    public static final String LAST_ENV_HASH = "lastEnvHash";
    public static final String LAST_CLAUDE_MODEL = "lastClaudeModel";
    public static final String LAST_CUSTOM_MODEL = "lastCustomModel";
    public static final String SLASH_COMMANDS = "slashCommands";
    public static final String CONVERSATIONS = "conversations";
    public static final String MIGRATION_VERSION = "migrationVersion";
    public static final String ACTIVE_CONVERSATION_ID = "activeConversationId";

    /** Keys removed once their contents have been moved to the current layout. */
    public static final Set<String> CONSUMED_KEYS = Set.of(
            LAST_ENV_HASH, LAST_CLAUDE_MODEL, LAST_CUSTOM_MODEL, CONVERSATIONS, SLASH_COMMANDS, MIGRATION_VERSION);

    private static final LegacyStateBlob EMPTY = new LegacyStateBlob(Json.newObject());

    private final ObjectNode raw;

    private LegacyStateBlob(ObjectNode raw) {
        this.raw = raw;
    }

    public static LegacyStateBlob of(ObjectNode raw) {
        return new LegacyStateBlob(raw.deepCopy());
    }

    public static LegacyStateBlob empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return raw.isEmpty();
    }

    /** True if any bookkeeping field is still present, whatever its value. */
    public boolean hasStateToMigrate() {
        return raw.has(LAST_ENV_HASH) || raw.has(LAST_CLAUDE_MODEL) || raw.has(LAST_CUSTOM_MODEL);
    }

    public boolean hasLegacyContent() {
        return !legacyCommands().isEmpty() || !legacyConversations().isEmpty();
    }

    public Optional<String> lastEnvHash() {
        return text(LAST_ENV_HASH);
    }

    public Optional<String> lastClaudeModel() {
        return text(LAST_CLAUDE_MODEL);
    }

    public Optional<String> lastCustomModel() {
        return text(LAST_CUSTOM_MODEL);
    }

    public Optional<String> activeConversationId() {
        return text(ACTIVE_CONVERSATION_ID).filter(id -> !id.isBlank());
    }

    /** Raw command records; shape checks are left to the importer so failures can be counted. */
    public List<JsonNode> legacyCommands() {
        return items(SLASH_COMMANDS);
    }

    public List<JsonNode> legacyConversations() {
        return items(CONVERSATIONS);
    }

    public TabManagerState tabManagerState() {
        return TabManagerState.sanitize(raw.get(TabManagerState.KEY));
    }

    /** A copy of the stored object with the consumed keys removed and everything else untouched. */
    public ObjectNode withoutConsumedKeys() {
        ObjectNode cleaned = raw.deepCopy();
        cleaned.remove(CONSUMED_KEYS);
        return cleaned;
    }

    public ObjectNode raw() {
        return raw.deepCopy();
    }

    private Optional<String> text(String key) {
        JsonNode value = raw.get(key);
        return value != null && value.isTextual() ? Optional.of(value.asText()) : Optional.empty();
    }

    private List<JsonNode> items(String key) {
        var items = new ArrayList<JsonNode>();
        JsonNode value = raw.get(key);
        if (value != null && value.isArray()) {
            value.forEach(items::add);
        }
        return items;
    }
}
