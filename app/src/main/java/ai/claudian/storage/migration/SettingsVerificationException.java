package ai.claudian.storage.migration;

import java.io.IOException;
import org.jetbrains.annotations.Nullable;

/**
 * A settings file did not read back as written. Raised before any destructive follow-up step, so the source data is
 * still intact when this propagates.
 */
public class SettingsVerificationException extends IOException {
    public SettingsVerificationException(String message) {
        super(message);
    }

    public SettingsVerificationException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
