package ai.claudian.storage.migration;

import ai.claudian.storage.settings.AgentSettings;
import ai.claudian.storage.settings.PluginSettings;

/** Both settings files as loaded after startup migration. */
public record CombinedSettings(AgentSettings agent, PluginSettings plugin) {}
