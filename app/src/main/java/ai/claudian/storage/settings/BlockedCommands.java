package ai.claudian.storage.settings;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Commands the blocklist refuses to run, bucketed per platform family. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BlockedCommands(List<String> unix, List<String> windows) {

    private static final List<String> DEFAULT_UNIX =
            List.of("rm -rf", "rm -r /", "chmod 777", "chmod -R 777", "mkfs", "dd if=", "> /dev/sd");

    private static final List<String> DEFAULT_WINDOWS = List.of(
            "Remove-Item -Recurse -Force",
            "Format-Volume",
            "diskpart",
            "del /s /q",
            "rd /s /q",
            "rmdir /s /q",
            "format c:");

    public BlockedCommands {
        unix = unix == null ? DEFAULT_UNIX : List.copyOf(unix);
        windows = windows == null ? DEFAULT_WINDOWS : List.copyOf(windows);
    }

    public static BlockedCommands defaults() {
        return new BlockedCommands(DEFAULT_UNIX, DEFAULT_WINDOWS);
    }

    /** The raw stored value, discriminated once at the deserialization boundary. */
    sealed interface StoredShape {
        /** Pre-platform format: one list, which was always the unix list. */
        record FlatList(JsonNode items) implements StoredShape {}

        record PlatformKeyed(@Nullable JsonNode unix, @Nullable JsonNode windows) implements StoredShape {}

        record Absent() implements StoredShape {}
    }

    static StoredShape classify(@Nullable JsonNode value) {
        if (value == null) {
            return new StoredShape.Absent();
        }
        if (value.isArray()) {
            return new StoredShape.FlatList(value);
        }
        if (value.isObject()) {
            return new StoredShape.PlatformKeyed(value.get("unix"), value.get("windows"));
        }
        return new StoredShape.Absent();
    }

    /**
     * Normalizes whatever was stored. A flat list becomes the unix bucket with windows defaulted; a platform-keyed
     * object has each bucket validated independently; anything else yields defaults.
     */
    public static BlockedCommands normalize(@Nullable JsonNode value) {
        var shape = classify(value);
        if (shape instanceof StoredShape.FlatList flat) {
            return new BlockedCommands(commandList(flat.items(), DEFAULT_UNIX), DEFAULT_WINDOWS);
        }
        if (shape instanceof StoredShape.PlatformKeyed keyed) {
            return new BlockedCommands(
                    commandList(keyed.unix(), DEFAULT_UNIX), commandList(keyed.windows(), DEFAULT_WINDOWS));
        }
        return defaults();
    }

    /** Trimmed, non-blank strings of an array; a non-array falls back. */
    private static List<String> commandList(@Nullable JsonNode value, List<String> fallback) {
        if (value == null || !value.isArray()) {
            return fallback;
        }
        var commands = new ArrayList<String>();
        for (JsonNode item : value) {
            if (item.isTextual() && !item.asText().isBlank()) {
                commands.add(item.asText().trim());
            }
        }
        return commands;
    }
}
