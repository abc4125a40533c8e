package ai.claudian.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalFileAdapterTest {

    @TempDir
    Path vault;

    private LocalFileAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new LocalFileAdapter(vault);
    }

    @Test
    void writeCreatesParentsAndReplacesContent() throws Exception {
        Path file = Path.of(".claude", "sessions", "a.jsonl");

        adapter.write(file, "first");
        adapter.write(file, "second");

        assertTrue(adapter.exists(file));
        assertEquals("second", adapter.read(file));
        try (var entries = Files.list(vault.resolve(".claude/sessions"))) {
            assertEquals(1, entries.count(), "no temp files left behind");
        }
    }

    @Test
    void listingSeparatesFilesFromFoldersAndIsRelative() throws Exception {
        adapter.write(Path.of("commands/b.md"), "b");
        adapter.write(Path.of("commands/a.md"), "a");
        adapter.ensureFolder(Path.of("commands/git"));

        assertEquals(
                List.of(Path.of("commands/a.md"), Path.of("commands/b.md")), adapter.listFiles(Path.of("commands")));
        assertEquals(List.of(Path.of("commands/git")), adapter.listFolders(Path.of("commands")));
    }

    @Test
    void missingFolderListsNothingAndRemoveIsIdempotent() throws Exception {
        assertTrue(adapter.listFiles(Path.of("nope")).isEmpty());
        assertDoesNotThrow(() -> adapter.remove(Path.of("nope/file.md")));
    }

    @Test
    void pathsOutsideTheVaultAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> adapter.read(Path.of("../outside.txt")));
        assertThrows(IllegalArgumentException.class, () -> adapter.exists(vault.resolve("abs")));
    }
}
