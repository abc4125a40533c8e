package ai.claudian.storage.mcp;

import ai.claudian.storage.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.jetbrains.annotations.Nullable;

/** How to reach an MCP server, in the CLI's {@code mcpServers} entry format. */
public sealed interface McpServerConfig {

    /** A local process speaking MCP over stdin/stdout. */
    record Stdio(String command, List<String> args, Map<String, String> env) implements McpServerConfig {
        public Stdio {
            args = List.copyOf(args);
            env = Map.copyOf(env);
        }
    }

    /** A server reached over HTTP, either streamable HTTP or server-sent events. */
    record Remote(Transport transport, String url, Map<String, String> headers) implements McpServerConfig {
        public Remote {
            headers = Map.copyOf(headers);
        }
    }

    enum Transport {
        HTTP,
        SSE;

        String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Reads one {@code mcpServers} value. The transport comes from {@code type} when present, otherwise from which of
     * {@code command} or {@code url} is set.
     *
     * @return empty if the value is not a usable config
     */
    static Optional<McpServerConfig> parse(@Nullable JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        String type = node.path("type").asText("");
        if (type.isEmpty()) {
            type = node.hasNonNull("command") ? "stdio" : node.hasNonNull("url") ? "http" : "";
        }
        switch (type) {
            case "stdio": {
                String command = node.path("command").asText("");
                if (!node.path("command").isTextual() || command.isBlank()) {
                    return Optional.empty();
                }
                return Optional.of(new Stdio(command, strings(node.get("args")), stringMap(node.get("env"))));
            }
            case "http":
            case "sse": {
                String url = node.path("url").asText("");
                if (!node.path("url").isTextual() || url.isBlank()) {
                    return Optional.empty();
                }
                var transport = type.equals("sse") ? Transport.SSE : Transport.HTTP;
                return Optional.of(new Remote(transport, url, stringMap(node.get("headers"))));
            }
            default:
                return Optional.empty();
        }
    }

    /** Serialized form; stdio configs omit {@code type}, as the CLI writes them. */
    default ObjectNode toNode() {
        ObjectNode node = Json.newObject();
        if (this instanceof Stdio stdio) {
            node.put("command", stdio.command());
            if (!stdio.args().isEmpty()) {
                var args = node.putArray("args");
                stdio.args().forEach(args::add);
            }
            if (!stdio.env().isEmpty()) {
                node.set("env", Json.mapper().valueToTree(new TreeMap<>(stdio.env())));
            }
        } else if (this instanceof Remote remote) {
            node.put("type", remote.transport().wireName());
            node.put("url", remote.url());
            if (!remote.headers().isEmpty()) {
                node.set("headers", Json.mapper().valueToTree(new TreeMap<>(remote.headers())));
            }
        }
        return node;
    }

    private static List<String> strings(@Nullable JsonNode array) {
        var values = new ArrayList<String>();
        if (array != null && array.isArray()) {
            array.forEach(item -> {
                if (item.isTextual()) {
                    values.add(item.asText());
                }
            });
        }
        return values;
    }

    private static Map<String, String> stringMap(@Nullable JsonNode object) {
        var values = new LinkedHashMap<String, String>();
        if (object != null && object.isObject()) {
            object.fields().forEachRemaining(e -> {
                if (e.getValue().isTextual()) {
                    values.put(e.getKey(), e.getValue().asText());
                }
            });
        }
        return values;
    }
}
