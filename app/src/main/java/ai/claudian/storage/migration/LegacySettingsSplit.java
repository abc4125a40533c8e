package ai.claudian.storage.migration;

import ai.claudian.storage.Json;
import ai.claudian.storage.settings.EnvironmentVariables;
import ai.claudian.storage.settings.PluginSettings;
import ai.claudian.storage.settings.ToolPrivateFields;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Derives Claudian's settings from a combined pre-split {@code settings.json}. */
final class LegacySettingsSplit {
    static final String LEGACY_CLI_PATHS = "claudeCliPaths";
    static final String ENV = "env";

    private LegacySettingsSplit() {}

    /**
     * Every Claudian field comes from {@code legacy} when present and well-typed, otherwise from the defaults.
     * Deprecated fields are dropped. The CLI's {@code env} map is merged into the free-text variables and wins on
     * collision. A per-platform CLI path is carried into the single legacy path so the per-host step can pick it up.
     */
    static PluginSettings pluginSettingsFrom(ObjectNode legacy, String platformKey) throws JsonProcessingException {
        ObjectNode source = Json.newObject();
        for (String field : ToolPrivateFields.ALL) {
            if (ToolPrivateFields.DEPRECATED.contains(field) || field.equals(LEGACY_CLI_PATHS)) {
                continue;
            }
            JsonNode value = legacy.get(field);
            if (value != null) {
                source.set(field, value.deepCopy());
            }
        }

        String fromEnv = EnvironmentVariables.fromStructured(legacy.get(ENV));
        if (!fromEnv.isEmpty()) {
            JsonNode text = legacy.get("environmentVariables");
            source.put("environmentVariables",
                    EnvironmentVariables.merge(text != null && text.isTextual() ? text.asText() : "", fromEnv));
        }

        JsonNode platformPath = legacy.path(LEGACY_CLI_PATHS).path(platformKey);
        JsonNode singlePath = source.get("claudeCliPath");
        boolean singleBlank = singlePath == null || !singlePath.isTextual() || singlePath.asText().isBlank();
        if (singleBlank && platformPath.isTextual() && !platformPath.asText().isBlank()) {
            source.put("claudeCliPath", platformPath.asText().trim());
        }
        return PluginSettings.fromStored(source);
    }
}
