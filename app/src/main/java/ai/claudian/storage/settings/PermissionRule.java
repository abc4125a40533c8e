package ai.claudian.storage.settings;

import org.jetbrains.annotations.Nullable;

/**
 * A permission entry in the CLI's compact rule grammar: {@code ToolName} or {@code ToolName(pattern)}.
 *
 * @param pattern null for a bare tool rule; never empty and never the wildcard {@code *}
 */
public record PermissionRule(String toolName, @Nullable String pattern) {

    public PermissionRule {
        if (toolName.isBlank()) {
            throw new IllegalArgumentException("Permission rule needs a tool name");
        }
        toolName = toolName.trim();
        if (pattern != null && (pattern.isEmpty() || pattern.equals("*"))) {
            pattern = null;
        }
    }

    /** Builds a rule; an empty or {@code *} pattern collapses to the bare tool name. */
    public static PermissionRule of(String toolName, @Nullable String pattern) {
        return new PermissionRule(toolName, pattern);
    }

    /** Parses {@code Bash} or {@code Bash(git status)}. Text without a well-formed suffix is a bare tool name. */
    public static PermissionRule parse(String rule) {
        String trimmed = rule.trim();
        int open = trimmed.indexOf('(');
        if (open > 0 && trimmed.endsWith(")")) {
            return new PermissionRule(trimmed.substring(0, open), trimmed.substring(open + 1, trimmed.length() - 1));
        }
        return new PermissionRule(trimmed, null);
    }

    @Override
    public String toString() {
        return pattern == null ? toolName : toolName + "(" + pattern + ")";
    }
}
