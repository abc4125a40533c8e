package ai.claudian.storage.commands;

import ai.claudian.storage.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * File naming and the markdown-with-frontmatter format of command files.
 *
 * <pre>
 * ---
 * description: Review the staged diff
 * argument-hint: "[focus]"
 * model: sonnet
 * allowed-tools:
 *   - Read
 * ---
 * Review the staged changes with focus on $ARGUMENTS
 * </pre>
 */
public final class CommandFiles {
    public static final String EXTENSION = ".md";
    public static final String ID_PREFIX = "cmd-";

    private static final String DELIMITER = "---";
    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_-]");
    private static final Splitter SEGMENTS = Splitter.on('/');
    private static final Splitter TOOL_LIST = Splitter.on(',').trimResults().omitEmptyStrings();

    private static final YAMLMapper YAML = YAMLMapper.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .build();

    private CommandFiles() {}

    /**
     * Canonical form of a command name: each {@code /}-separated segment has characters outside
     * {@code [A-Za-z0-9_-]} replaced by {@code -}. The file path and the id both derive from this form.
     *
     * @throws IllegalArgumentException if the name is blank or has an empty segment
     */
    public static String normalizeName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Command name must not be blank");
        }
        var segments = new ArrayList<String>();
        for (String segment : SEGMENTS.split(name.trim())) {
            if (segment.isEmpty()) {
                throw new IllegalArgumentException("Command name has an empty path segment: " + name);
            }
            segments.add(UNSAFE.matcher(segment).replaceAll("-"));
        }
        return String.join("/", segments);
    }

    /** Relative file path for a command name. {@code git/commit} maps to {@code git/commit.md}. */
    public static String slugPath(String name) {
        return normalizeName(name) + EXTENSION;
    }

    public static String idFor(String name) {
        return ID_PREFIX + normalizeName(name).replace("/", "--");
    }

    /** Command name recovered from a path relative to the commands folder. */
    public static String nameFromRelativePath(String relativePath) {
        String normalized = relativePath.replace('\\', '/');
        return normalized.endsWith(EXTENSION)
                ? normalized.substring(0, normalized.length() - EXTENSION.length())
                : normalized;
    }

    public static String serialize(CommandDefinition command) throws JsonProcessingException {
        ObjectNode front = YAML.createObjectNode();
        putIfPresent(front, "description", command.description());
        putIfPresent(front, "argument-hint", command.argumentHint());
        putIfPresent(front, "model", command.model());
        if (command.allowedTools() != null && !command.allowedTools().isEmpty()) {
            var tools = front.putArray("allowed-tools");
            command.allowedTools().forEach(tools::add);
        }
        if (front.isEmpty() && !command.content().replace("\r\n", "\n").startsWith(DELIMITER + "\n")) {
            return command.content();
        }
        if (front.isEmpty()) {
            // body would otherwise read back as frontmatter
            return DELIMITER + "\n" + DELIMITER + "\n" + command.content();
        }
        return DELIMITER + "\n" + YAML.writeValueAsString(front) + DELIMITER + "\n" + command.content();
    }

    /**
     * Parses a command file. Text without a leading frontmatter block is all body.
     *
     * @throws JsonProcessingException if the frontmatter is not a YAML mapping
     */
    public static CommandDefinition parse(String name, String text) throws JsonProcessingException {
        String normalized = text.replace("\r\n", "\n");
        if (!normalized.startsWith(DELIMITER + "\n")) {
            return CommandDefinition.of(name, null, null, null, null, normalized);
        }
        int start = DELIMITER.length() + 1;
        int close = normalized.indexOf("\n" + DELIMITER, start - 1);
        if (close < 0) {
            return CommandDefinition.of(name, null, null, null, null, normalized);
        }
        String yaml = normalized.substring(start, close + 1);
        int bodyStart = normalized.indexOf('\n', close + 1 + DELIMITER.length());
        String body = bodyStart < 0 ? "" : normalized.substring(bodyStart + 1);

        JsonNode front = yaml.isBlank() ? YAML.createObjectNode() : YAML.readTree(yaml);
        if (front == null || front.isMissingNode() || front.isNull()) {
            front = YAML.createObjectNode();
        }
        if (!front.isObject()) {
            throw new Json.NotAnObjectException("frontmatter of command " + name, front.getNodeType().toString());
        }
        return CommandDefinition.of(
                name,
                text(front, "description"),
                text(front, "argument-hint"),
                text(front, "model"),
                tools(front.get("allowed-tools")),
                body);
    }

    private static void putIfPresent(ObjectNode node, String key, @Nullable String value) {
        if (value != null && !value.isBlank()) {
            node.put(key, value);
        }
    }

    private static @Nullable String text(JsonNode front, String key) {
        JsonNode value = front.get(key);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }

    private static @Nullable List<String> tools(@Nullable JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            return TOOL_LIST.splitToList(value.asText());
        }
        var tools = new ArrayList<String>();
        value.forEach(item -> {
            if (item.isValueNode() && !item.asText().isBlank()) {
                tools.add(item.asText().trim());
            }
        });
        return tools;
    }
}
