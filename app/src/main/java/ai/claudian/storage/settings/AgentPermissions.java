package ai.claudian.storage.settings;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** The CLI's permission object in {@code settings.json}. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentPermissions(
        List<String> allow,
        List<String> deny,
        List<String> ask,
        @Nullable String defaultMode,
        @Nullable List<String> additionalDirectories) {

    public enum RuleList {
        ALLOW,
        DENY,
        ASK
    }

    public AgentPermissions {
        allow = allow == null ? List.of() : List.copyOf(allow);
        deny = deny == null ? List.of() : List.copyOf(deny);
        ask = ask == null ? List.of() : List.copyOf(ask);
        additionalDirectories = additionalDirectories == null ? null : List.copyOf(additionalDirectories);
    }

    public static AgentPermissions defaults() {
        return new AgentPermissions(List.of(), List.of(), List.of(), null, null);
    }

    /**
     * Converts the old flat array. Only {@code "always"} records survive; each becomes a rule string, duplicates
     * are collapsed and everything lands in the allow list.
     */
    public static AgentPermissions fromLegacy(List<LegacyPermission> legacy) {
        var allow = new LinkedHashSet<String>();
        for (var permission : legacy) {
            if (!permission.isPermanent() || permission.toolName() == null || permission.toolName().isBlank()) {
                continue;
            }
            allow.add(PermissionRule.of(permission.toolName(), permission.pattern()).toString());
        }
        return new AgentPermissions(List.copyOf(allow), List.of(), List.of(), null, null);
    }

    public List<String> rules(RuleList list) {
        return switch (list) {
            case ALLOW -> allow;
            case DENY -> deny;
            case ASK -> ask;
        };
    }

    /** Adds {@code rule} to {@code target} and removes it from the other two lists. */
    public AgentPermissions withRule(RuleList target, PermissionRule rule) {
        String text = rule.toString();
        var without = withoutRule(rule);
        var updated = new ArrayList<>(without.rules(target));
        updated.add(text);
        return switch (target) {
            case ALLOW -> new AgentPermissions(updated, without.deny, without.ask, defaultMode, additionalDirectories);
            case DENY -> new AgentPermissions(without.allow, updated, without.ask, defaultMode, additionalDirectories);
            case ASK -> new AgentPermissions(without.allow, without.deny, updated, defaultMode, additionalDirectories);
        };
    }

    public AgentPermissions withoutRule(PermissionRule rule) {
        String text = rule.toString();
        return new AgentPermissions(
                allow.stream().filter(r -> !r.equals(text)).toList(),
                deny.stream().filter(r -> !r.equals(text)).toList(),
                ask.stream().filter(r -> !r.equals(text)).toList(),
                defaultMode,
                additionalDirectories);
    }
}
