package ai.claudian.storage.settings;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jetbrains.annotations.Nullable;

/**
 * One record of the old flat permissions array that predates the CLI's {@code {allow, deny, ask}} object.
 *
 * @param scope {@code "always"} or {@code "session"}; session approvals do not survive a restart
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LegacyPermission(
        @Nullable String toolName, @Nullable String pattern, @Nullable Long approvedAt, @Nullable String scope) {

    public static final String SCOPE_ALWAYS = "always";

    public boolean isPermanent() {
        return SCOPE_ALWAYS.equals(scope);
    }
}
