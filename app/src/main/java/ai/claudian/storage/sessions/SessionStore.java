package ai.claudian.storage.sessions;

import ai.claudian.storage.FileAdapter;
import ai.claudian.storage.StorageLayout;
import ai.claudian.util.ParseOutcome;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;

/** One {@code .jsonl} transcript per conversation under {@code sessions/}, named by conversation id. */
public class SessionStore {
    private static final Logger logger = LogManager.getLogger(SessionStore.class);

    private final FileAdapter adapter;
    private final Path sessionsDir;

    public SessionStore(FileAdapter adapter, StorageLayout layout) {
        this.adapter = adapter;
        this.sessionsDir = layout.sessionsDir();
    }

    /**
     * @throws IllegalArgumentException if {@code id} is blank or could escape the sessions folder
     */
    public Path getFilePath(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Conversation id must not be blank");
        }
        if (id.contains("/") || id.contains("\\") || id.equals(".") || id.equals("..")) {
            throw new IllegalArgumentException("Conversation id contains a path separator: " + id);
        }
        return sessionsDir.resolve(id + SessionFiles.EXTENSION);
    }

    @Blocking
    public void saveConversation(ConversationTranscript transcript) throws IOException {
        Path file = getFilePath(transcript.id());
        adapter.write(file, SessionFiles.serialize(transcript));
        logger.debug("Saved conversation {} ({} messages)", transcript.id(), transcript.messages().size());
    }

    /** The conversation, or empty if no file exists for {@code id}. */
    @Blocking
    public Optional<ConversationTranscript> loadConversation(String id) throws IOException {
        Path file = getFilePath(id);
        if (!adapter.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(SessionFiles.parse(file.toString(), adapter.read(file)));
    }

    /** Every readable conversation, most recently updated first. Unreadable files are skipped. */
    @Blocking
    public List<ConversationTranscript> loadAllConversations() throws IOException {
        var outcomes = new ArrayList<ParseOutcome<ConversationTranscript>>();
        for (Path file : adapter.listFiles(sessionsDir)) {
            if (file.getFileName().toString().endsWith(SessionFiles.EXTENSION)) {
                outcomes.add(parse(file));
            }
        }
        var conversations = new ArrayList<>(ParseOutcome.collect(outcomes, logger));
        conversations.sort(Comparator.comparingLong(ConversationTranscript::updatedAt).reversed());
        return conversations;
    }

    @Blocking
    public List<ConversationMeta> loadMetadata() throws IOException {
        return loadAllConversations().stream().map(ConversationMeta::of).toList();
    }

    /** Deleting an unknown conversation is a no-op. */
    @Blocking
    public void deleteConversation(String id) throws IOException {
        adapter.remove(getFilePath(id));
    }

    private ParseOutcome<ConversationTranscript> parse(Path file) {
        try {
            return ParseOutcome.ok(SessionFiles.parse(file.toString(), adapter.read(file)));
        } catch (IOException | RuntimeException e) {
            return ParseOutcome.skip(file.toString(), String.valueOf(e.getMessage()));
        }
    }
}
