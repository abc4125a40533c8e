package ai.claudian.util;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.Logger;

/**
 * Result of parsing one stored entity: either the entity or the reason it was skipped.
 *
 * <p>Loaders produce one outcome per file and fold them with {@link #collect}, so a single corrupt file never fails
 * a whole load.
 */
public sealed interface ParseOutcome<T> {

    record Ok<T>(T value) implements ParseOutcome<T> {}

    record Skip<T>(String source, String reason) implements ParseOutcome<T> {}

    static <T> ParseOutcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> ParseOutcome<T> skip(String source, String reason) {
        return new Skip<>(source, reason);
    }

    /** Keeps the {@code Ok} values in order and logs every {@code Skip} at warn level. */
    static <T> List<T> collect(List<ParseOutcome<T>> outcomes, Logger logger) {
        var values = new ArrayList<T>(outcomes.size());
        for (var outcome : outcomes) {
            if (outcome instanceof Ok<T> ok) {
                values.add(ok.value());
            } else if (outcome instanceof Skip<T> skip) {
                logger.warn("Skipping {}: {}", skip.source(), skip.reason());
            }
        }
        return values;
    }
}
