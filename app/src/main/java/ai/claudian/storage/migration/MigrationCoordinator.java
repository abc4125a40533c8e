package ai.claudian.storage.migration;

import ai.claudian.cli.CliPathResolver;
import ai.claudian.storage.FileAdapter;
import ai.claudian.storage.Json;
import ai.claudian.storage.StorageLayout;
import ai.claudian.storage.commands.CommandDefinition;
import ai.claudian.storage.commands.CommandStore;
import ai.claudian.storage.legacy.HostStateStore;
import ai.claudian.storage.legacy.LegacyStateBlob;
import ai.claudian.storage.legacy.TabStateStore;
import ai.claudian.storage.mcp.McpRegistryStore;
import ai.claudian.storage.migration.ItemOutcome.Kind;
import ai.claudian.storage.sessions.ConversationTranscript;
import ai.claudian.storage.sessions.SessionStore;
import ai.claudian.storage.settings.AgentSettingsStore;
import ai.claudian.storage.settings.PermissionsShape;
import ai.claudian.storage.settings.PluginSettings;
import ai.claudian.storage.settings.PluginSettingsStore;
import ai.claudian.storage.settings.ToolPrivateFields;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;

/**
 * Owns every store and brings the on-disk layout to the current generation at startup.
 *
 * <p>Three older generations are recognized:
 * <ul>
 *   <li>a combined {@code settings.json} holding Claudian's fields next to the CLI's, split by {@link #migrateSplit()};
 *   <li>bookkeeping fields in host state, merged into the plugin settings by {@link #migrateLegacyState};
 *   <li>whole command and conversation lists in host state, copied to per-entity files by
 *       {@link #migrateLegacyContent}.
 * </ul>
 * Host state is only cleared ({@link #clearConsumedLegacyState()}) after every copied item is on disk. All steps are
 * idempotent; a second {@link #initialize()} with nothing changed performs reads only.
 *
 * <p>Construct once at startup and share; there is no internal locking.
 */
public class MigrationCoordinator {
    private static final Logger logger = LogManager.getLogger(MigrationCoordinator.class);

    private final FileAdapter adapter;
    private final StorageLayout layout;
    private final HostStateStore hostState;
    private final CliPathResolver cliPaths;

    private final AgentSettingsStore agentSettings;
    private final PluginSettingsStore pluginSettings;
    private final CommandStore commands;
    private final SessionStore sessions;
    private final McpRegistryStore mcp;
    private final TabStateStore tabs;

    public MigrationCoordinator(
            FileAdapter adapter, StorageLayout layout, HostStateStore hostState, CliPathResolver cliPaths) {
        this.adapter = adapter;
        this.layout = layout;
        this.hostState = hostState;
        this.cliPaths = cliPaths;
        this.agentSettings = new AgentSettingsStore(adapter, layout);
        this.pluginSettings = new PluginSettingsStore(adapter, layout);
        this.commands = new CommandStore(adapter, layout);
        this.sessions = new SessionStore(adapter, layout);
        this.mcp = new McpRegistryStore(adapter, layout);
        this.tabs = new TabStateStore(hostState);
    }

    public AgentSettingsStore agentSettings() {
        return agentSettings;
    }

    public PluginSettingsStore pluginSettings() {
        return pluginSettings;
    }

    public CommandStore commands() {
        return commands;
    }

    public SessionStore sessions() {
        return sessions;
    }

    public McpRegistryStore mcp() {
        return mcp;
    }

    public TabStateStore tabs() {
        return tabs;
    }

    public CliPathResolver cliPaths() {
        return cliPaths;
    }

    /**
     * Startup entry point: create folders, run every applicable migration, then load both settings files.
     *
     * @throws SettingsVerificationException if the split migration could not confirm the plugin settings were
     *     written; {@code settings.json} is untouched in that case
     */
    @Blocking
    public CombinedSettings initialize() throws IOException {
        ensureDirectories();
        runMigrations();
        var agent = agentSettings.load();
        var plugin = migrateCliPathToHost(pluginSettings.load());
        return new CombinedSettings(agent, plugin);
    }

    @Blocking
    public void ensureDirectories() throws IOException {
        adapter.ensureFolder(layout.baseDir());
        adapter.ensureFolder(layout.commandsDir());
        adapter.ensureFolder(layout.sessionsDir());
    }

    @Blocking
    public void runMigrations() throws IOException {
        if (agentSettings.exists() && !pluginSettings.exists()) {
            migrateSplit();
        }

        LegacyStateBlob blob = loadLegacyState();
        boolean stateMigrated = false;
        if (blob.hasStateToMigrate()) {
            migrateLegacyState(blob);
            stateMigrated = true;
        }

        var content = ContentMigrationResult.empty();
        boolean contentMigrated = false;
        if (blob.hasLegacyContent()) {
            content = migrateLegacyContent(blob);
            contentMigrated = true;
        }

        if (content.hadErrors()) {
            logger.warn(
                    "Keeping legacy host state: {} item(s) failed to migrate and will be retried next start",
                    content.failures().size());
        } else if (stateMigrated || contentMigrated) {
            clearConsumedLegacyState();
        }
    }

    /**
     * Splits a combined legacy {@code settings.json}. Claudian's fields are written to {@code claudian-settings.json}
     * and read back; only then is {@code settings.json} rewritten to {@code $schema} and {@code permissions}.
     *
     * @return true if a split was performed, false if the file carried no Claudian fields
     * @throws SettingsVerificationException if the written plugin settings do not read back
     */
    @Blocking
    public boolean migrateSplit() throws IOException {
        Optional<ObjectNode> stored = agentSettings.readRaw();
        if (stored.isEmpty()) {
            return false;
        }
        ObjectNode legacy = stored.get();
        if (!ToolPrivateFields.containsAny(legacy)) {
            logger.debug("{} has no Claudian fields; nothing to split", agentSettings.file());
            return false;
        }

        PluginSettings plugin = LegacySettingsSplit.pluginSettingsFrom(legacy, cliPaths.platformKey());
        pluginSettings.save(plugin);
        verifyPluginSettingsWritten();

        ObjectNode permissions = PermissionsShape.of(legacy.get("permissions")).toNode();
        agentSettings.replace(permissions);
        logger.info("Split Claudian settings out of {} into {}", agentSettings.file(), pluginSettings.file());
        return true;
    }

    private void verifyPluginSettingsWritten() throws SettingsVerificationException {
        boolean verified;
        try {
            verified = pluginSettings.hasTextField(PluginSettings.SENTINEL_FIELD);
        } catch (IOException e) {
            logger.error("Could not read back {}: {}", pluginSettings.file(), e.getMessage());
            throw new SettingsVerificationException("Failed to verify " + pluginSettings.file() + " was saved", e);
        }
        if (!verified) {
            logger.error("{} did not read back after save; leaving {} untouched", pluginSettings.file(),
                    agentSettings.file());
            throw new SettingsVerificationException("Failed to verify " + pluginSettings.file() + " was saved");
        }
    }

    /**
     * Adopts bookkeeping values from host state. Values already in the plugin settings win; the file is only written
     * if something was adopted.
     *
     * @return true if the plugin settings changed
     */
    @Blocking
    public boolean migrateLegacyState(LegacyStateBlob blob) throws IOException {
        PluginSettings current = pluginSettings.load();
        PluginSettings updated = current;
        if (current.lastEnvHash().isEmpty() && blob.lastEnvHash().isPresent()) {
            updated = updated.withLastEnvHash(blob.lastEnvHash().get());
        }
        if (current.lastClaudeModel().isEmpty() && blob.lastClaudeModel().isPresent()) {
            updated = updated.withLastModels(blob.lastClaudeModel().get(), updated.lastCustomModel());
        }
        if (current.lastCustomModel().isEmpty() && blob.lastCustomModel().isPresent()) {
            updated = updated.withLastModels(updated.lastClaudeModel(), blob.lastCustomModel().get());
        }
        if (updated.equals(current)) {
            logger.debug("No legacy bookkeeping to adopt");
            return false;
        }
        pluginSettings.save(updated);
        logger.info("Moved legacy bookkeeping from host state into {}", pluginSettings.file());
        return true;
    }

    /**
     * Phase one of content migration: write each legacy command and conversation to its own file. Items whose target
     * already exists are left alone. Nothing is removed from host state here.
     */
    @Blocking
    public ContentMigrationResult migrateLegacyContent(LegacyStateBlob blob) {
        var outcomes = new ArrayList<ItemOutcome>();
        for (JsonNode item : blob.legacyCommands()) {
            outcomes.add(migrateCommand(item));
        }
        for (JsonNode item : blob.legacyConversations()) {
            outcomes.add(migrateConversation(item));
        }
        var result = new ContentMigrationResult(outcomes);
        for (var failure : result.failures()) {
            logger.warn("Could not migrate legacy {} {}: {}", failure.kind(), failure.item(), failure.reason());
        }
        if (result.writtenCount() > 0) {
            logger.info("Migrated {} legacy item(s) out of host state", result.writtenCount());
        }
        return result;
    }

    private ItemOutcome migrateCommand(JsonNode item) {
        String label = item.path("name").asText(item.path("id").asText("<unnamed>"));
        try {
            var parsed = Json.treeToValue(item, CommandDefinition.class);
            var command = withoutLeadingSlash(parsed);
            Path target = commands.getFilePath(command);
            if (adapter.exists(target)) {
                return new ItemOutcome.AlreadyPresent(Kind.COMMAND, label);
            }
            commands.save(command);
            return new ItemOutcome.Written(Kind.COMMAND, label);
        } catch (IOException | RuntimeException e) {
            return new ItemOutcome.Failed(Kind.COMMAND, label, String.valueOf(e.getMessage()));
        }
    }

    private ItemOutcome migrateConversation(JsonNode item) {
        String label = item.path("id").asText("<no id>");
        try {
            if (!(item instanceof ObjectNode obj)) {
                return new ItemOutcome.Failed(Kind.CONVERSATION, label, "not an object");
            }
            var conversation = ConversationTranscript.fromNode(obj);
            Path target = sessions.getFilePath(conversation.id());
            if (adapter.exists(target)) {
                return new ItemOutcome.AlreadyPresent(Kind.CONVERSATION, label);
            }
            sessions.saveConversation(conversation);
            return new ItemOutcome.Written(Kind.CONVERSATION, label);
        } catch (IOException | RuntimeException e) {
            return new ItemOutcome.Failed(Kind.CONVERSATION, label, String.valueOf(e.getMessage()));
        }
    }

    // Old builds stored the name as typed, slash included.
    private static CommandDefinition withoutLeadingSlash(CommandDefinition command) {
        String name = command.name() == null ? "" : command.name().strip();
        while (name.startsWith("/")) {
            name = name.substring(1);
        }
        return CommandDefinition.of(
                name,
                command.description(),
                command.argumentHint(),
                command.model(),
                command.allowedTools(),
                command.content());
    }

    /**
     * Phase two: remove the consumed keys from host state, keeping every other key. Reloads host state first so
     * anything the host wrote in between survives.
     */
    @Blocking
    public void clearConsumedLegacyState() throws IOException {
        Optional<ObjectNode> stored = hostState.load();
        if (stored.isEmpty()) {
            return;
        }
        var blob = LegacyStateBlob.of(stored.get());
        ObjectNode cleaned = blob.withoutConsumedKeys();
        if (cleaned.equals(stored.get())) {
            return;
        }
        hostState.save(cleaned);
        logger.info("Cleared migrated fields from host state");
    }

    /**
     * Records this device's CLI path under its hostname the first time settings are loaded on it, taking the legacy
     * per-platform or single path. The single path is blanked once adopted.
     */
    @Blocking
    PluginSettings migrateCliPathToHost(PluginSettings plugin) throws IOException {
        String host = cliPaths.hostname();
        if (plugin.claudeCliPathsByHost().containsKey(host)) {
            return plugin;
        }
        String adopted = pluginSettings.readRaw()
                .map(raw -> raw.path(LegacySettingsSplit.LEGACY_CLI_PATHS).path(cliPaths.platformKey()))
                .filter(JsonNode::isTextual)
                .map(JsonNode::asText)
                .filter(path -> !path.isBlank())
                .orElse(plugin.claudeCliPath());
        if (adopted.isBlank()) {
            return plugin;
        }
        var byHost = new LinkedHashMap<>(plugin.claudeCliPathsByHost());
        byHost.put(host, adopted.trim());
        PluginSettings updated = plugin.withCliPaths("", byHost);
        pluginSettings.save(updated);
        cliPaths.reset();
        logger.info("Recorded CLI path for host {}", host);
        return updated;
    }

    /** Legacy active conversation marker: plugin settings first, then host state. */
    @Blocking
    public Optional<String> getLegacyActiveConversationId() throws IOException {
        Optional<String> fromSettings = pluginSettings.getLegacyActiveConversationId();
        if (fromSettings.isPresent()) {
            return fromSettings;
        }
        return tabs.getLegacyActiveConversationId();
    }

    @Blocking
    public void clearLegacyActiveConversationId() throws IOException {
        pluginSettings.clearLegacyActiveConversationId();
        tabs.clearLegacyActiveConversationId();
    }

    private LegacyStateBlob loadLegacyState() {
        try {
            return hostState.load().map(LegacyStateBlob::of).orElseGet(LegacyStateBlob::empty);
        } catch (IOException e) {
            logger.warn("Treating unreadable host state as absent: {}", e.getMessage());
            return LegacyStateBlob.empty();
        }
    }
}
