package ai.claudian.storage;

import java.nio.file.Path;

/**
 * Names every file and folder the storage subsystem owns, relative to the vault root.
 *
 * @param baseDir folder holding all Claudian storage, {@code .claude} by default
 */
public record StorageLayout(Path baseDir) {
    public static final String DEFAULT_BASE_DIR = ".claude";

    public static final String AGENT_SETTINGS_FILE = "settings.json";
    public static final String PLUGIN_SETTINGS_FILE = "claudian-settings.json";
    public static final String COMMANDS_DIR = "commands";
    public static final String SESSIONS_DIR = "sessions";
    public static final String MCP_FILE = "mcp.json";

    public StorageLayout {
        if (baseDir.isAbsolute()) {
            throw new IllegalArgumentException("Storage base dir must be vault-relative: " + baseDir);
        }
    }

    public static StorageLayout defaults() {
        return new StorageLayout(Path.of(DEFAULT_BASE_DIR));
    }

    public Path agentSettingsFile() {
        return baseDir.resolve(AGENT_SETTINGS_FILE);
    }

    public Path pluginSettingsFile() {
        return baseDir.resolve(PLUGIN_SETTINGS_FILE);
    }

    public Path commandsDir() {
        return baseDir.resolve(COMMANDS_DIR);
    }

    public Path sessionsDir() {
        return baseDir.resolve(SESSIONS_DIR);
    }

    public Path mcpFile() {
        return baseDir.resolve(MCP_FILE);
    }
}
