package ai.claudian.storage.settings;

import ai.claudian.storage.FileAdapter;
import ai.claudian.storage.Json;
import ai.claudian.storage.StorageLayout;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;

/**
 * Reads and writes {@code claudian-settings.json}.
 *
 * <p>There is no internal locking: {@link #update} is a plain load-modify-save and relies on the host serializing
 * calls into the storage layer.
 */
public class PluginSettingsStore {
    private static final Logger logger = LogManager.getLogger(PluginSettingsStore.class);

    private final FileAdapter adapter;
    private final Path file;

    public PluginSettingsStore(FileAdapter adapter, StorageLayout layout) {
        this.adapter = adapter;
        this.file = layout.pluginSettingsFile();
    }

    public Path file() {
        return file;
    }

    public boolean exists() {
        return adapter.exists(file);
    }

    /** The raw top-level object as stored, or empty if the file is absent. */
    @Blocking
    public Optional<ObjectNode> readRaw() throws IOException {
        if (!exists()) {
            return Optional.empty();
        }
        return Optional.of(Json.readObject(adapter.read(file), file.toString()));
    }

    /**
     * Loads the settings. An absent file yields {@link PluginSettings#defaults()}; a present one is normalized and
     * merged over the defaults, with stored values winning. The obsolete active-conversation marker is dropped.
     */
    @Blocking
    public PluginSettings load() throws IOException {
        var raw = readRaw();
        if (raw.isEmpty()) {
            return PluginSettings.defaults();
        }
        ObjectNode stored = raw.get();
        stored.remove(ToolPrivateFields.LEGACY_ACTIVE_CONVERSATION_ID);
        return PluginSettings.fromStored(stored);
    }

    @Blocking
    public void save(PluginSettings settings) throws IOException {
        adapter.write(file, Json.toPrettyJson(settings));
    }

    /** Load, apply {@code change}, save. Returns the saved settings. */
    @Blocking
    public PluginSettings update(UnaryOperator<PluginSettings> change) throws IOException {
        var updated = change.apply(load());
        save(updated);
        return updated;
    }

    /** Records the last model picked, in the built-in or the custom slot. */
    @Blocking
    public void setLastModel(String model, boolean isCustom) throws IOException {
        update(s -> isCustom
                ? s.withLastModels(s.lastClaudeModel(), model)
                : s.withLastModels(model, s.lastCustomModel()));
    }

    @Blocking
    public void setLastEnvHash(String hash) throws IOException {
        update(s -> s.withLastEnvHash(hash));
    }

    /** The superseded {@code activeConversationId} still sitting in the raw file, if any. */
    @Blocking
    public Optional<String> getLegacyActiveConversationId() throws IOException {
        return readRaw().map(root -> root.get(ToolPrivateFields.LEGACY_ACTIVE_CONVERSATION_ID))
                .filter(JsonNode::isTextual)
                .map(JsonNode::asText)
                .filter(id -> !id.isBlank());
    }

    /** Removes the superseded marker from the raw file. No-op if it is not there. */
    @Blocking
    public void clearLegacyActiveConversationId() throws IOException {
        var raw = readRaw();
        if (raw.isEmpty() || !raw.get().has(ToolPrivateFields.LEGACY_ACTIVE_CONVERSATION_ID)) {
            return;
        }
        ObjectNode root = raw.get();
        root.remove(ToolPrivateFields.LEGACY_ACTIVE_CONVERSATION_ID);
        adapter.write(file, Json.toPrettyJson(root));
        logger.debug("Cleared legacy {} from {}", ToolPrivateFields.LEGACY_ACTIVE_CONVERSATION_ID, file);
    }

    /** True when {@code field} reads back as a string from the file as stored. */
    @Blocking
    public boolean hasTextField(String field) throws IOException {
        @Nullable JsonNode value = readRaw().map(root -> root.get(field)).orElse(null);
        return value != null && value.isTextual();
    }
}
