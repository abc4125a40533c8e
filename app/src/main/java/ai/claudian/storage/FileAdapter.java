package ai.claudian.storage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.jetbrains.annotations.Blocking;

/**
 * Thin access layer over the host filesystem. All paths are relative to the storage root (the vault).
 *
 * <p>Implementations carry no business logic: no parsing, no defaults, no migration decisions.
 */
public interface FileAdapter {

    boolean exists(Path path);

    @Blocking
    String read(Path path) throws IOException;

    /** Writes {@code content}, creating parent folders as needed and replacing any existing file. */
    @Blocking
    void write(Path path, String content) throws IOException;

    /** Removes a file. Removing a missing file is a no-op. */
    @Blocking
    void remove(Path path) throws IOException;

    /** Regular files directly inside {@code folder}; empty if the folder does not exist. */
    @Blocking
    List<Path> listFiles(Path folder) throws IOException;

    /** Sub-folders directly inside {@code folder}; empty if the folder does not exist. */
    @Blocking
    List<Path> listFolders(Path folder) throws IOException;

    @Blocking
    void ensureFolder(Path folder) throws IOException;
}
