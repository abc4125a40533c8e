package ai.claudian.storage.migration;

import java.util.List;

/**
 * Per-item outcomes of copying legacy inline content to per-entity files. Legacy state may only be cleared when
 * {@link #hadErrors()} is false.
 */
public record ContentMigrationResult(List<ItemOutcome> outcomes) {

    public ContentMigrationResult {
        outcomes = List.copyOf(outcomes);
    }

    public static ContentMigrationResult empty() {
        return new ContentMigrationResult(List.of());
    }

    public boolean hadErrors() {
        return outcomes.stream().anyMatch(o -> o instanceof ItemOutcome.Failed);
    }

    public long writtenCount() {
        return outcomes.stream().filter(o -> o instanceof ItemOutcome.Written).count();
    }

    public List<ItemOutcome.Failed> failures() {
        return outcomes.stream()
                .filter(o -> o instanceof ItemOutcome.Failed)
                .map(o -> (ItemOutcome.Failed) o)
                .toList();
    }
}
