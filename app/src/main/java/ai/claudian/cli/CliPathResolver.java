package ai.claudian.cli;

import ai.claudian.storage.settings.PluginSettings;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Resolves which CLI executable to use on this device. Holds the hostname and the last resolution, so one instance
 * should be created at startup and shared.
 *
 * <p>Only configured paths are considered; nothing is searched on {@code PATH}.
 */
public class CliPathResolver {
    private static final Logger logger = LogManager.getLogger(CliPathResolver.class);

    private final String hostname;
    private final Platform platform;
    private final Path userHome;

    private @Nullable CacheKey cachedKey;
    private @Nullable Path cachedPath;

    private record CacheKey(@Nullable String hostPath, @Nullable String legacyPath) {}

    public CliPathResolver() {
        this(detectHostname(), Platform.current(), Path.of(System.getProperty("user.home", "")));
    }

    public CliPathResolver(String hostname, Platform platform, Path userHome) {
        this.hostname = hostname;
        this.platform = platform;
        this.userHome = userHome;
    }

    public String hostname() {
        return hostname;
    }

    public Platform platform() {
        return platform;
    }

    /** Key of this device's platform in the legacy {@code claudeCliPaths} map. */
    public String platformKey() {
        return platform.key();
    }

    public Optional<Path> resolve(PluginSettings settings) {
        return resolve(settings.claudeCliPathsByHost(), settings.claudeCliPath());
    }

    /**
     * First existing regular file among this host's configured path and the legacy single path, each with a leading
     * {@code ~} expanded. The answer is cached until either input changes.
     */
    public synchronized Optional<Path> resolve(Map<String, String> pathsByHost, @Nullable String legacyPath) {
        var key = new CacheKey(pathsByHost.get(hostname), legacyPath);
        if (key.equals(cachedKey)) {
            return Optional.ofNullable(cachedPath);
        }
        Path found = null;
        for (String candidate : new String[] {key.hostPath(), key.legacyPath()}) {
            Path path = expand(candidate);
            if (path != null && Files.isRegularFile(path)) {
                found = path;
                break;
            }
        }
        if (found == null) {
            logger.debug("No configured CLI path exists for host {}", hostname);
        }
        cachedKey = key;
        cachedPath = found;
        return Optional.ofNullable(found);
    }

    /** Forgets the cached resolution, e.g. after the user edits CLI paths. */
    public synchronized void reset() {
        cachedKey = null;
        cachedPath = null;
    }

    @Nullable
    Path expand(@Nullable String configured) {
        if (configured == null || configured.isBlank()) {
            return null;
        }
        String trimmed = configured.trim();
        if (trimmed.equals("~")) {
            return userHome;
        }
        if (trimmed.startsWith("~/") || trimmed.startsWith("~\\")) {
            return userHome.resolve(trimmed.substring(2));
        }
        try {
            return Path.of(trimmed);
        } catch (InvalidPathException e) {
            logger.warn("Ignoring unusable CLI path {}: {}", trimmed, e.getReason());
            return null;
        }
    }

    static String detectHostname() {
        try {
            String name = InetAddress.getLocalHost().getHostName();
            if (name != null && !name.isBlank()) {
                return name;
            }
        } catch (UnknownHostException e) {
            logger.debug("Local host lookup failed, falling back to environment: {}", e.getMessage());
        }
        for (String variable : List.of("HOSTNAME", "COMPUTERNAME")) {
            String value = System.getenv(variable);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return "localhost";
    }
}
