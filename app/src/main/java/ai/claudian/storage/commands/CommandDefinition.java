package ai.claudian.storage.commands;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A user-defined slash command: a named prompt template with optional model and tool restrictions.
 *
 * @param name command name as typed after {@code /}; a {@code /} inside the name nests it in a folder
 * @param content prompt body; may reference {@code $ARGUMENTS}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommandDefinition(
        String id,
        String name,
        @Nullable String description,
        @Nullable String argumentHint,
        @Nullable String model,
        @Nullable List<String> allowedTools,
        String content) {

    public CommandDefinition {
        content = content == null ? "" : content;
        allowedTools = allowedTools == null ? null : List.copyOf(allowedTools);
    }

    /**
     * Builds a command with its name normalized to the form its file is stored under and the id derived from it, so
     * {@code my cmd} becomes {@code my-cmd} with id {@code cmd-my-cmd}.
     *
     * @throws IllegalArgumentException if the name is blank or has an empty segment
     */
    public static CommandDefinition of(
            String name,
            @Nullable String description,
            @Nullable String argumentHint,
            @Nullable String model,
            @Nullable List<String> allowedTools,
            String content) {
        String normalized = CommandFiles.normalizeName(name);
        return new CommandDefinition(
                CommandFiles.idFor(normalized), normalized, description, argumentHint, model, allowedTools, content);
    }
}
