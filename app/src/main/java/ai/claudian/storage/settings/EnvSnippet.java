package ai.claudian.storage.settings;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jetbrains.annotations.Nullable;

/** A named, reusable block of environment variables the user can swap in. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EnvSnippet(String id, String name, @Nullable String description, String envVars) {}
