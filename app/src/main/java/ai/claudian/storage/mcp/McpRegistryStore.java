package ai.claudian.storage.mcp;

import ai.claudian.storage.FileAdapter;
import ai.claudian.storage.Json;
import ai.claudian.storage.StorageLayout;
import ai.claudian.util.ParseOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;

/**
 * The MCP server registry in {@code mcp.json}.
 *
 * <p>The file keeps the CLI's layout so it can be shared: server configs under {@code mcpServers}, Claudian's
 * switches under {@code _claudian.servers}. Top-level keys Claudian does not know are carried through saves.
 */
public class McpRegistryStore {
    private static final Logger logger = LogManager.getLogger(McpRegistryStore.class);

    static final String SERVERS_KEY = "mcpServers";
    static final String CLAUDIAN_KEY = "_claudian";
    static final String CLAUDIAN_SERVERS_KEY = "servers";

    private final FileAdapter adapter;
    private final Path file;

    public McpRegistryStore(FileAdapter adapter, StorageLayout layout) {
        this.adapter = adapter;
        this.file = layout.mcpFile();
    }

    public boolean exists() {
        return adapter.exists(file);
    }

    /**
     * All valid entries in file order. An absent or unparseable file yields an empty list; individual entries with an
     * invalid name or config are skipped.
     */
    @Blocking
    public List<McpServerEntry> load() throws IOException {
        if (!exists()) {
            return List.of();
        }
        ObjectNode root;
        try {
            root = Json.readObject(adapter.read(file), file.toString());
        } catch (JsonProcessingException e) {
            logger.warn("Ignoring unreadable MCP registry {}: {}", file, e.getOriginalMessage());
            return List.of();
        }

        JsonNode servers = root.path(SERVERS_KEY);
        JsonNode switches = root.path(CLAUDIAN_KEY).path(CLAUDIAN_SERVERS_KEY);
        var outcomes = new ArrayList<ParseOutcome<McpServerEntry>>();
        servers.fields().forEachRemaining(e -> outcomes.add(parseEntry(e.getKey(), e.getValue(), switches)));
        return ParseOutcome.collect(outcomes, logger);
    }

    /** Replaces the registry with {@code servers}, keeping unknown top-level keys of the existing file. */
    @Blocking
    public void save(List<McpServerEntry> servers) throws IOException {
        ObjectNode root = existingRoot();
        ObjectNode configs = Json.newObject();
        ObjectNode switches = Json.newObject();
        for (McpServerEntry server : servers) {
            configs.set(server.name(), server.config().toNode());
            ObjectNode flags = switches.putObject(server.name());
            flags.put("enabled", server.enabled());
            flags.put("contextSaving", server.contextSaving());
            if (server.description() != null) {
                flags.put("description", server.description());
            }
        }
        root.set(SERVERS_KEY, configs);

        ObjectNode claudian = root.get(CLAUDIAN_KEY) instanceof ObjectNode existing ? existing : Json.newObject();
        claudian.set(CLAUDIAN_SERVERS_KEY, switches);
        root.set(CLAUDIAN_KEY, claudian);

        adapter.write(file, Json.toPrettyJson(root));
        logger.debug("Saved {} MCP servers to {}", servers.size(), file);
    }

    private ObjectNode existingRoot() throws IOException {
        if (!exists()) {
            return Json.newObject();
        }
        try {
            return Json.readObject(adapter.read(file), file.toString());
        } catch (JsonProcessingException e) {
            logger.warn("Overwriting unreadable MCP registry {}: {}", file, e.getOriginalMessage());
            return Json.newObject();
        }
    }

    private static ParseOutcome<McpServerEntry> parseEntry(String name, JsonNode configNode, JsonNode switches) {
        if (!McpServerEntry.isValidName(name)) {
            return ParseOutcome.skip(name, "invalid server name");
        }
        var config = McpServerConfig.parse(configNode);
        if (config.isEmpty()) {
            return ParseOutcome.skip(name, "invalid server config");
        }
        JsonNode flags = switches.path(name);
        boolean enabled = flags.path("enabled").asBoolean(McpServerEntry.DEFAULT_ENABLED);
        boolean contextSaving = flags.path("contextSaving").asBoolean(McpServerEntry.DEFAULT_CONTEXT_SAVING);
        JsonNode description = flags.get("description");
        return ParseOutcome.ok(new McpServerEntry(
                name,
                config.get(),
                enabled,
                contextSaving,
                description != null && description.isTextual() ? description.asText() : null));
    }
}
