package ai.claudian.storage.migration;

/** What happened to one legacy command or conversation during content migration. */
public sealed interface ItemOutcome {

    enum Kind {
        COMMAND,
        CONVERSATION
    }

    Kind kind();

    /** Human-readable identity of the item, for logs. */
    String item();

    record Written(Kind kind, String item) implements ItemOutcome {}

    /** The target file already existed and was left as is. */
    record AlreadyPresent(Kind kind, String item) implements ItemOutcome {}

    record Failed(Kind kind, String item, String reason) implements ItemOutcome {}
}
