package ai.claudian.storage.settings;

import com.fasterxml.jackson.annotation.JsonProperty;

/** The CLI-compatible part of the settings: only fields the external command-line tool understands. */
public record AgentSettings(@JsonProperty("$schema") String schemaRef, AgentPermissions permissions) {
    public static final String SCHEMA_REF = "https://json.schemastore.org/claude-code-settings.json";

    public static AgentSettings defaults() {
        return new AgentSettings(SCHEMA_REF, AgentPermissions.defaults());
    }

    public AgentSettings withPermissions(AgentPermissions updated) {
        return new AgentSettings(schemaRef, updated);
    }
}
