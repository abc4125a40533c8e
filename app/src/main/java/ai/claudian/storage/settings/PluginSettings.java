package ai.claudian.storage.settings;

import ai.claudian.storage.Json;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Claudian's private preferences, stored in {@code claudian-settings.json}. Every field has a default, so a partial
 * or absent file always yields a complete record.
 *
 * @param environmentVariables free-text {@code KEY=VALUE} lines, see {@link EnvironmentVariables}
 * @param claudeCliPath legacy single CLI path, superseded by {@code claudeCliPathsByHost}
 * @param claudeCliPathsByHost CLI path per device, keyed by hostname
 * @param lastEnvHash fingerprint of the environment the last session ran with; empty until first recorded
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PluginSettings(
        String userName,
        boolean enableBlocklist,
        BlockedCommands blockedCommands,
        String permissionMode,
        String lastNonPlanPermissionMode,
        String model,
        String thinkingBudget,
        boolean enableAutoTitleGeneration,
        String titleGenerationModel,
        List<String> excludedTags,
        String mediaFolder,
        String systemPrompt,
        List<String> allowedExportPaths,
        List<String> persistentExternalContextPaths,
        String environmentVariables,
        List<EnvSnippet> envSnippets,
        KeyboardNavigation keyboardNavigation,
        String claudeCliPath,
        Map<String, String> claudeCliPathsByHost,
        boolean loadUserClaudeSettings,
        String lastClaudeModel,
        String lastCustomModel,
        String lastEnvHash) {
    private static final Logger logger = LogManager.getLogger(PluginSettings.class);

    /** Field checked after a write to confirm the file really landed. */
    public static final String SENTINEL_FIELD = "userName";

    private static final Set<String> STRING_LIST_FIELDS =
            Set.of("excludedTags", "allowedExportPaths", "persistentExternalContextPaths");

    private static final PluginSettings DEFAULTS = new PluginSettings(
            "",
            true,
            BlockedCommands.defaults(),
            "yolo",
            "yolo",
            "haiku",
            "off",
            true,
            "",
            List.of(),
            "",
            "",
            List.of(),
            List.of(),
            "",
            List.of(),
            KeyboardNavigation.defaults(),
            "",
            Map.of(),
            true,
            "",
            "",
            "");

    public PluginSettings {
        excludedTags = List.copyOf(excludedTags);
        allowedExportPaths = List.copyOf(allowedExportPaths);
        persistentExternalContextPaths = List.copyOf(persistentExternalContextPaths);
        envSnippets = List.copyOf(envSnippets);
        claudeCliPathsByHost = Map.copyOf(claudeCliPathsByHost);
    }

    public static PluginSettings defaults() {
        return DEFAULTS;
    }

    /**
     * Builds a complete record from a stored or legacy object. Each known field is taken from {@code stored} when
     * present and of the expected JSON type, otherwise from the defaults. Blocked commands and per-host CLI paths are
     * normalized; nested objects are merged over their defaults.
     */
    public static PluginSettings fromStored(ObjectNode stored) throws JsonProcessingException {
        ObjectNode merged = Json.valueToObject(DEFAULTS);
        for (String field : fieldNames(merged)) {
            JsonNode candidate = stored.get(field);
            if (candidate == null || candidate.isNull()) {
                continue;
            }
            switch (field) {
                case "blockedCommands" -> merged.set(field, Json.valueToObject(BlockedCommands.normalize(candidate)));
                case "claudeCliPathsByHost" -> merged.set(field, Json.mapper().valueToTree(hostPaths(candidate)));
                default -> mergeField(merged, field, candidate);
            }
        }
        return Json.treeToValue(merged, PluginSettings.class);
    }

    private static void mergeField(ObjectNode merged, String field, JsonNode candidate) {
        JsonNode fallback = merged.get(field);
        if (!sameShape(fallback, candidate)) {
            logger.debug("Ignoring {} of type {}; keeping default", field, candidate.getNodeType());
            return;
        }
        if (fallback instanceof ObjectNode fallbackObj) {
            merged.set(field, mergeObject(field, fallbackObj, (ObjectNode) candidate));
        } else if (STRING_LIST_FIELDS.contains(field)) {
            merged.set(field, filterArray((ArrayNode) candidate, JsonNode::isTextual));
        } else if (field.equals("envSnippets")) {
            merged.set(field, filterArray((ArrayNode) candidate, PluginSettings::isEnvSnippet));
        } else {
            merged.set(field, candidate.deepCopy());
        }
    }

    private static boolean sameShape(JsonNode fallback, JsonNode candidate) {
        if (fallback.getNodeType() != candidate.getNodeType()) {
            return false;
        }
        return !fallback.isIntegralNumber() || candidate.canConvertToInt();
    }

    /** Known keys of {@code candidate} whose type matches the default replace it; the rest keep the default. */
    private static ObjectNode mergeObject(String field, ObjectNode fallback, ObjectNode candidate) {
        ObjectNode combined = fallback.deepCopy();
        fallback.fieldNames().forEachRemaining(key -> {
            JsonNode value = candidate.get(key);
            if (value == null || value.isNull()) {
                return;
            }
            if (sameShape(fallback.get(key), value)) {
                combined.set(key, value.deepCopy());
            } else {
                logger.debug("Ignoring {}.{} of type {}; keeping default", field, key, value.getNodeType());
            }
        });
        return combined;
    }

    private static boolean isEnvSnippet(JsonNode node) {
        if (!node.isObject()) {
            return false;
        }
        JsonNode description = node.get("description");
        return node.path("id").isTextual()
                && node.path("name").isTextual()
                && node.path("envVars").isTextual()
                && (description == null || description.isNull() || description.isTextual());
    }

    /** Host entries whose value is a non-blank string, trimmed; everything else is dropped. */
    private static Map<String, String> hostPaths(JsonNode value) {
        var result = new LinkedHashMap<String, String>();
        if (!value.isObject()) {
            return result;
        }
        value.fields().forEachRemaining(e -> {
            if (e.getValue().isTextual() && !e.getValue().asText().isBlank()) {
                result.put(e.getKey(), e.getValue().asText().trim());
            }
        });
        return result;
    }

    private static ArrayNode filterArray(ArrayNode array, Predicate<JsonNode> keep) {
        ArrayNode filtered = Json.mapper().createArrayNode();
        array.forEach(item -> {
            if (keep.test(item)) {
                filtered.add(item);
            }
        });
        return filtered;
    }

    private static List<String> fieldNames(ObjectNode node) {
        var names = new ArrayList<String>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    public PluginSettings withUserName(String value) {
        return new PluginSettings(value, enableBlocklist, blockedCommands, permissionMode, lastNonPlanPermissionMode,
                model, thinkingBudget, enableAutoTitleGeneration, titleGenerationModel, excludedTags, mediaFolder,
                systemPrompt, allowedExportPaths, persistentExternalContextPaths, environmentVariables, envSnippets,
                keyboardNavigation, claudeCliPath, claudeCliPathsByHost, loadUserClaudeSettings, lastClaudeModel,
                lastCustomModel, lastEnvHash);
    }

    public PluginSettings withEnvironmentVariables(String value) {
        return new PluginSettings(userName, enableBlocklist, blockedCommands, permissionMode,
                lastNonPlanPermissionMode, model, thinkingBudget, enableAutoTitleGeneration, titleGenerationModel,
                excludedTags, mediaFolder, systemPrompt, allowedExportPaths, persistentExternalContextPaths, value,
                envSnippets, keyboardNavigation, claudeCliPath, claudeCliPathsByHost, loadUserClaudeSettings,
                lastClaudeModel, lastCustomModel, lastEnvHash);
    }

    public PluginSettings withBlockedCommands(BlockedCommands value) {
        return new PluginSettings(userName, enableBlocklist, value, permissionMode, lastNonPlanPermissionMode, model,
                thinkingBudget, enableAutoTitleGeneration, titleGenerationModel, excludedTags, mediaFolder,
                systemPrompt, allowedExportPaths, persistentExternalContextPaths, environmentVariables, envSnippets,
                keyboardNavigation, claudeCliPath, claudeCliPathsByHost, loadUserClaudeSettings, lastClaudeModel,
                lastCustomModel, lastEnvHash);
    }

    public PluginSettings withCliPaths(String legacyPath, Map<String, String> byHost) {
        return new PluginSettings(userName, enableBlocklist, blockedCommands, permissionMode,
                lastNonPlanPermissionMode, model, thinkingBudget, enableAutoTitleGeneration, titleGenerationModel,
                excludedTags, mediaFolder, systemPrompt, allowedExportPaths, persistentExternalContextPaths,
                environmentVariables, envSnippets, keyboardNavigation, legacyPath, byHost, loadUserClaudeSettings,
                lastClaudeModel, lastCustomModel, lastEnvHash);
    }

    public PluginSettings withLastModels(String claudeModel, String customModel) {
        return new PluginSettings(userName, enableBlocklist, blockedCommands, permissionMode,
                lastNonPlanPermissionMode, model, thinkingBudget, enableAutoTitleGeneration, titleGenerationModel,
                excludedTags, mediaFolder, systemPrompt, allowedExportPaths, persistentExternalContextPaths,
                environmentVariables, envSnippets, keyboardNavigation, claudeCliPath, claudeCliPathsByHost,
                loadUserClaudeSettings, claudeModel, customModel, lastEnvHash);
    }

    public PluginSettings withLastEnvHash(String value) {
        return new PluginSettings(userName, enableBlocklist, blockedCommands, permissionMode,
                lastNonPlanPermissionMode, model, thinkingBudget, enableAutoTitleGeneration, titleGenerationModel,
                excludedTags, mediaFolder, systemPrompt, allowedExportPaths, persistentExternalContextPaths,
                environmentVariables, envSnippets, keyboardNavigation, claudeCliPath, claudeCliPathsByHost,
                loadUserClaudeSettings, lastClaudeModel, lastCustomModel, value);
    }
}
