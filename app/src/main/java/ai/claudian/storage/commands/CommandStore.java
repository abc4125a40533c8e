package ai.claudian.storage.commands;

import ai.claudian.storage.FileAdapter;
import ai.claudian.storage.StorageLayout;
import ai.claudian.util.ParseOutcome;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;

/** One markdown file per command under {@code commands/}, nested folders for names containing {@code /}. */
public class CommandStore {
    private static final Logger logger = LogManager.getLogger(CommandStore.class);

    private final FileAdapter adapter;
    private final Path commandsDir;

    public CommandStore(FileAdapter adapter, StorageLayout layout) {
        this.adapter = adapter;
        this.commandsDir = layout.commandsDir();
    }

    public Path getFilePath(CommandDefinition command) {
        return getFilePath(command.name());
    }

    public Path getFilePath(String name) {
        return commandsDir.resolve(CommandFiles.slugPath(name));
    }

    /** Writes the command, replacing any file with the same derived name. */
    @Blocking
    public void save(CommandDefinition command) throws IOException {
        Path file = getFilePath(command);
        adapter.write(file, CommandFiles.serialize(command));
        logger.debug("Saved command {} to {}", command.name(), file);
    }

    /** Every readable command, nested folders included. Files that fail to parse are skipped. */
    @Blocking
    public List<CommandDefinition> loadAll() throws IOException {
        var outcomes = new ArrayList<ParseOutcome<CommandDefinition>>();
        for (Path file : commandFiles()) {
            outcomes.add(parse(file));
        }
        return ParseOutcome.collect(outcomes, logger);
    }

    /** Removes the command with {@code id}. Unknown ids are ignored. */
    @Blocking
    public void delete(String id) throws IOException {
        for (Path file : commandFiles()) {
            if (CommandFiles.idFor(nameOf(file)).equals(id)) {
                adapter.remove(file);
                logger.debug("Deleted command {}", id);
                return;
            }
        }
        logger.debug("No command file for id {}", id);
    }

    private ParseOutcome<CommandDefinition> parse(Path file) {
        try {
            return ParseOutcome.ok(CommandFiles.parse(nameOf(file), adapter.read(file)));
        } catch (IOException | RuntimeException e) {
            return ParseOutcome.skip(file.toString(), String.valueOf(e.getMessage()));
        }
    }

    private String nameOf(Path file) {
        return CommandFiles.nameFromRelativePath(commandsDir.relativize(file).toString());
    }

    private List<Path> commandFiles() throws IOException {
        var files = new ArrayList<Path>();
        collect(commandsDir, files);
        return files;
    }

    private void collect(Path folder, List<Path> into) throws IOException {
        for (Path file : adapter.listFiles(folder)) {
            if (file.getFileName().toString().endsWith(CommandFiles.EXTENSION)) {
                into.add(file);
            }
        }
        for (Path sub : adapter.listFolders(folder)) {
            collect(sub, into);
        }
    }
}
