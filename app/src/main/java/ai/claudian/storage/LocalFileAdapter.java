package ai.claudian.storage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** {@link FileAdapter} rooted at a directory on the local filesystem. */
public final class LocalFileAdapter implements FileAdapter {
    private static final Logger logger = LogManager.getLogger(LocalFileAdapter.class);

    private final Path root;

    public LocalFileAdapter(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public boolean exists(Path path) {
        return Files.exists(resolve(path));
    }

    @Override
    public String read(Path path) throws IOException {
        return Files.readString(resolve(path), StandardCharsets.UTF_8);
    }

    /**
     * Write to a temp file next to the target, then move it into place so readers never observe a partially
     * written settings file.
     */
    @Override
    public void write(Path path, String content) throws IOException {
        Path target = resolve(path);
        Path dir = target.getParent();
        Files.createDirectories(dir);

        Path temp = Files.createTempFile(dir, target.getFileName().toString() + ".", ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                logger.debug("Atomic move not supported for {}; falling back to plain replace", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @Override
    public void remove(Path path) throws IOException {
        Files.deleteIfExists(resolve(path));
    }

    @Override
    public List<Path> listFiles(Path folder) throws IOException {
        return list(folder, Files::isRegularFile);
    }

    @Override
    public List<Path> listFolders(Path folder) throws IOException {
        return list(folder, Files::isDirectory);
    }

    @Override
    public void ensureFolder(Path folder) throws IOException {
        Files.createDirectories(resolve(folder));
    }

    private List<Path> list(Path folder, Predicate<Path> filter) throws IOException {
        Path dir = resolve(folder);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (var stream = Files.list(dir)) {
            return stream.filter(filter)
                    .map(p -> folder.resolve(p.getFileName().toString()))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private Path resolve(Path relative) {
        if (relative.isAbsolute()) {
            throw new IllegalArgumentException("Expected a storage-relative path, got " + relative);
        }
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes storage root: " + relative);
        }
        return resolved;
    }
}
