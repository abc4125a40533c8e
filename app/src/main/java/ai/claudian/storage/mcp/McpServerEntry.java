package ai.claudian.storage.mcp;

import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * A registered MCP server and Claudian's per-server switches.
 *
 * @param contextSaving when true the server is only attached to a query that mentions it as {@code @name}
 */
public record McpServerEntry(
        String name, McpServerConfig config, boolean enabled, boolean contextSaving, @Nullable String description) {

    static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9._-]+");

    public static final boolean DEFAULT_ENABLED = true;
    public static final boolean DEFAULT_CONTEXT_SAVING = true;

    public McpServerEntry {
        if (name == null || !VALID_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid MCP server name: " + name);
        }
    }

    public static McpServerEntry of(String name, McpServerConfig config) {
        return new McpServerEntry(name, config, DEFAULT_ENABLED, DEFAULT_CONTEXT_SAVING, null);
    }

    public static boolean isValidName(@Nullable String name) {
        return name != null && VALID_NAME.matcher(name).matches();
    }

    public McpServerEntry withEnabled(boolean value) {
        return new McpServerEntry(name, config, value, contextSaving, description);
    }

    public McpServerEntry withContextSaving(boolean value) {
        return new McpServerEntry(name, config, enabled, value, description);
    }
}
