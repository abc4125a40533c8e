package ai.claudian.storage.settings;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Set;

/**
 * Top-level keys that belong to Claudian and must never live in the CLI-compatible {@code settings.json}.
 *
 * <p>Keep this table updated whenever a field is added to {@link PluginSettings}.
 */
public final class ToolPrivateFields {

    /** Every Claudian-only key, including deprecated ones that are dropped rather than migrated. */
    public static final Set<String> ALL = Set.of(
            "userName",
            "enableBlocklist",
            "blockedCommands",
            "permissionMode",
            "lastNonPlanPermissionMode",
            "model",
            "thinkingBudget",
            "enableAutoTitleGeneration",
            "titleGenerationModel",
            "excludedTags",
            "mediaFolder",
            "systemPrompt",
            "allowedExportPaths",
            "persistentExternalContextPaths",
            "environmentVariables",
            "envSnippets",
            "keyboardNavigation",
            "claudeCliPath",
            "claudeCliPaths",
            "loadUserClaudeSettings",
            "allowedContextPaths",
            "showToolUse",
            "toolCallExpandedByDefault");

    /** Removed outright during the split; their values are not carried forward. */
    public static final Set<String> DEPRECATED = Set.of("allowedContextPaths", "showToolUse", "toolCallExpandedByDefault");

    /** Superseded single active-conversation marker, now tracked by the host's tab layout. */
    public static final String LEGACY_ACTIVE_CONVERSATION_ID = "activeConversationId";

    private ToolPrivateFields() {}

    public static boolean containsAny(JsonNode settings) {
        for (String field : ALL) {
            JsonNode value = settings.get(field);
            if (value != null && !value.isNull()) {
                return true;
            }
        }
        return false;
    }
}
