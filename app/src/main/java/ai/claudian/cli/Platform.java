package ai.claudian.cli;

import java.util.Locale;
import org.jetbrains.annotations.Nullable;

/** Operating system family, as used to key the legacy per-platform CLI paths. */
public enum Platform {
    MACOS("macos"),
    LINUX("linux"),
    WINDOWS("windows");

    private final String key;

    Platform(String key) {
        this.key = key;
    }

    /** Key of this platform in the legacy {@code claudeCliPaths} map. */
    public String key() {
        return key;
    }

    public static Platform current() {
        return fromOsName(System.getProperty("os.name"));
    }

    /** Unrecognized names are treated as Linux. */
    public static Platform fromOsName(@Nullable String osName) {
        if (osName == null) {
            return LINUX;
        }
        String normalized = osName.toLowerCase(Locale.ROOT);
        if (normalized.contains("mac") || normalized.contains("darwin")) {
            return MACOS;
        }
        if (normalized.contains("win")) {
            return WINDOWS;
        }
        return LINUX;
    }
}
