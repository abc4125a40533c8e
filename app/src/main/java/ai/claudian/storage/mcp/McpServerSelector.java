package ai.claudian.storage.mcp;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Picks the servers to attach to a query. Enabled servers that are not context-saving are always attached;
 * context-saving ones only when the prompt mentions them as {@code @name}.
 */
public final class McpServerSelector {
    private static final Pattern MENTION = Pattern.compile("(?<![\\w@])@([A-Za-z0-9._-]+)");

    private McpServerSelector() {}

    public static List<McpServerEntry> select(List<McpServerEntry> servers, String prompt) {
        Set<String> mentioned = mentions(prompt);
        return servers.stream()
                .filter(McpServerEntry::enabled)
                .filter(s -> !s.contextSaving() || mentioned.contains(s.name()))
                .toList();
    }

    /** Names mentioned as {@code @name}; trailing dots are treated as sentence punctuation. */
    public static Set<String> mentions(String prompt) {
        var names = new LinkedHashSet<String>();
        var matcher = MENTION.matcher(prompt);
        while (matcher.find()) {
            String name = matcher.group(1);
            while (name.endsWith(".")) {
                name = name.substring(0, name.length() - 1);
            }
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }
}
