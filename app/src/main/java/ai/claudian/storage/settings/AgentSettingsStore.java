package ai.claudian.storage.settings;

import ai.claudian.storage.FileAdapter;
import ai.claudian.storage.Json;
import ai.claudian.storage.StorageLayout;
import ai.claudian.storage.settings.AgentPermissions.RuleList;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;

/**
 * Reads and writes the CLI-compatible {@code settings.json}.
 *
 * <p>The file is shared with the external command-line tool, so ordinary saves only touch {@code $schema} and
 * {@code permissions} and leave every other top-level key as the CLI wrote it. The destructive {@link #replace}
 * exists for the split migration only.
 */
public class AgentSettingsStore {
    private static final Logger logger = LogManager.getLogger(AgentSettingsStore.class);

    private static final String SCHEMA_KEY = "$schema";
    private static final String PERMISSIONS_KEY = "permissions";

    private final FileAdapter adapter;
    private final Path file;

    public AgentSettingsStore(FileAdapter adapter, StorageLayout layout) {
        this.adapter = adapter;
        this.file = layout.agentSettingsFile();
    }

    public Path file() {
        return file;
    }

    public boolean exists() {
        return adapter.exists(file);
    }

    /** The raw top-level object, or empty if the file is absent. */
    @Blocking
    public Optional<ObjectNode> readRaw() throws IOException {
        if (!exists()) {
            return Optional.empty();
        }
        return Optional.of(Json.readObject(adapter.read(file), file.toString()));
    }

    /**
     * Loads the settings, falling back to defaults when the file is absent. A legacy permissions array still present
     * in the file is converted in memory; the file itself is only rewritten by migration.
     */
    @Blocking
    public AgentSettings load() throws IOException {
        var raw = readRaw();
        if (raw.isEmpty()) {
            return AgentSettings.defaults();
        }
        ObjectNode root = raw.get();
        JsonNode schema = root.get(SCHEMA_KEY);
        String schemaRef = schema != null && schema.isTextual() ? schema.asText() : AgentSettings.SCHEMA_REF;
        var permissions = PermissionsShape.of(root.get(PERMISSIONS_KEY)).toPermissions();
        return new AgentSettings(schemaRef, permissions);
    }

    /**
     * Merges {@code settings} into the existing file. Unrelated top-level keys and unmodelled permission keys are
     * preserved.
     */
    @Blocking
    public void save(AgentSettings settings) throws IOException {
        ObjectNode root = readRaw().orElseGet(Json::newObject);
        root.put(SCHEMA_KEY, settings.schemaRef());

        ObjectNode permissions = root.get(PERMISSIONS_KEY) instanceof ObjectNode existing ? existing : Json.newObject();
        permissions.setAll(Json.valueToObject(settings.permissions()));
        if (settings.permissions().defaultMode() == null) {
            permissions.remove("defaultMode");
        }
        if (settings.permissions().additionalDirectories() == null) {
            permissions.remove("additionalDirectories");
        }
        root.set(PERMISSIONS_KEY, permissions);

        adapter.write(file, Json.toPrettyJson(root));
    }

    /** Overwrites the file with exactly {@code {$schema, permissions}}, discarding every other key. */
    @Blocking
    public void replace(ObjectNode permissions) throws IOException {
        ObjectNode root = Json.newObject();
        root.put(SCHEMA_KEY, AgentSettings.SCHEMA_REF);
        root.set(PERMISSIONS_KEY, permissions);
        adapter.write(file, Json.toPrettyJson(root));
        logger.info("Rewrote {} with CLI-compatible fields only", file);
    }

    @Blocking
    public AgentPermissions getPermissions() throws IOException {
        return load().permissions();
    }

    @Blocking
    public void updatePermissions(AgentPermissions permissions) throws IOException {
        save(load().withPermissions(permissions));
    }

    @Blocking
    public void addAllowRule(PermissionRule rule) throws IOException {
        addRule(RuleList.ALLOW, rule);
    }

    @Blocking
    public void addDenyRule(PermissionRule rule) throws IOException {
        addRule(RuleList.DENY, rule);
    }

    @Blocking
    public void addAskRule(PermissionRule rule) throws IOException {
        addRule(RuleList.ASK, rule);
    }

    /** Removes {@code rule} from all three lists. */
    @Blocking
    public void removeRule(PermissionRule rule) throws IOException {
        var current = load();
        save(current.withPermissions(current.permissions().withoutRule(rule)));
    }

    private void addRule(RuleList list, PermissionRule rule) throws IOException {
        var current = load();
        if (current.permissions().rules(list).contains(rule.toString())) {
            logger.debug("Rule {} already in {} list", rule, list);
            return;
        }
        save(current.withPermissions(current.permissions().withRule(list, rule)));
    }
}
