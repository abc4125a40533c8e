package ai.claudian.storage.settings;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Splitter;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.jetbrains.annotations.Nullable;

/**
 * Codec for the free-text {@code KEY=VALUE} environment block stored in {@link PluginSettings}, and conversion from
 * the CLI's structured {@code env} map.
 */
public final class EnvironmentVariables {
    private static final Splitter LINES = Splitter.onPattern("\r?\n");

    private EnvironmentVariables() {}

    /**
     * Parses {@code KEY=VALUE} lines. Blank lines and {@code #} comments are ignored, keys and values are trimmed and
     * a single pair of surrounding quotes is stripped from values. Later duplicates win.
     */
    public static Map<String, String> parse(@Nullable String text) {
        var result = new LinkedHashMap<String, String>();
        if (text == null || text.isEmpty()) {
            return result;
        }
        for (String line : LINES.split(text)) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = trimmed.substring(0, eq).trim();
            String value = unquote(trimmed.substring(eq + 1).trim());
            if (!key.isEmpty()) {
                result.put(key, value);
            }
        }
        return result;
    }

    /** Converts the CLI's {@code env} object to text form. Non-string values are dropped. */
    public static String fromStructured(@Nullable JsonNode env) {
        if (env == null || !env.isObject()) {
            return "";
        }
        var map = new LinkedHashMap<String, String>();
        env.fields().forEachRemaining(e -> {
            if (e.getValue().isTextual()) {
                map.put(e.getKey(), e.getValue().asText());
            }
        });
        return format(map);
    }

    /** Merges two blocks; on key collision the entry from {@code additional} wins. Comments are not kept. */
    public static String merge(@Nullable String existing, @Nullable String additional) {
        var merged = new LinkedHashMap<String, String>();
        mergeRaw(existing, merged);
        mergeRaw(additional, merged);
        return format(merged);
    }

    public static String format(Map<String, String> env) {
        return env.entrySet().stream().map(e -> e.getKey() + "=" + e.getValue()).collect(Collectors.joining("\n"));
    }

    /** Stable fingerprint of the effective variables, independent of ordering, comments and whitespace. */
    public static String hash(@Nullable String text) {
        var sorted = new TreeMap<>(parse(text));
        return Hashing.sha256().hashString(format(sorted), StandardCharsets.UTF_8).toString();
    }

    // merge keeps values verbatim (no unquoting) so a round trip does not alter user text
    private static void mergeRaw(@Nullable String text, Map<String, String> into) {
        if (text == null || text.isEmpty()) {
            return;
        }
        for (String line : LINES.split(text)) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq > 0) {
                into.put(trimmed.substring(0, eq), trimmed.substring(eq + 1));
            }
        }
    }

    private static String unquote(String value) {
        if (value.length() >= 2
                && ((value.startsWith("\"") && value.endsWith("\"")) || (value.startsWith("'") && value.endsWith("'")))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
