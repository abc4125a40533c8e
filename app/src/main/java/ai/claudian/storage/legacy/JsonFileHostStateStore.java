package ai.claudian.storage.legacy;

import ai.claudian.storage.FileAdapter;
import ai.claudian.storage.Json;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/** {@link HostStateStore} kept in a JSON file, the way the host keeps a plugin's {@code data.json}. */
public class JsonFileHostStateStore implements HostStateStore {
    public static final Path DEFAULT_FILE = Path.of(".obsidian", "plugins", "claudian", "data.json");

    private final FileAdapter adapter;
    private final Path file;

    public JsonFileHostStateStore(FileAdapter adapter, Path file) {
        this.adapter = adapter;
        this.file = file;
    }

    public JsonFileHostStateStore(FileAdapter adapter) {
        this(adapter, DEFAULT_FILE);
    }

    @Override
    public Optional<ObjectNode> load() throws IOException {
        if (!adapter.exists(file)) {
            return Optional.empty();
        }
        String text = adapter.read(file);
        if (text.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Json.readObject(text, file.toString()));
    }

    @Override
    public void save(ObjectNode state) throws IOException {
        adapter.write(file, Json.toPrettyJson(state));
    }
}
