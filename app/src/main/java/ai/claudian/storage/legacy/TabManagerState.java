package ai.claudian.storage.legacy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Open chat tabs and the focused one, persisted in host state so the layout survives restarts. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TabManagerState(List<OpenTab> openTabs, @Nullable String activeTabId) {

    public static final String KEY = "tabManagerState";

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record OpenTab(String tabId, @Nullable String conversationId) {}

    public TabManagerState {
        openTabs = openTabs == null ? List.of() : List.copyOf(openTabs);
    }

    public static TabManagerState empty() {
        return new TabManagerState(List.of(), null);
    }

    /**
     * Reads whatever is stored, keeping only well-formed tabs. A root that is not an object yields an empty state;
     * an active tab id that names no open tab is dropped.
     */
    public static TabManagerState sanitize(@Nullable JsonNode stored) {
        if (stored == null || !stored.isObject()) {
            return empty();
        }
        var tabs = new ArrayList<OpenTab>();
        for (JsonNode tab : stored.path("openTabs")) {
            JsonNode tabId = tab.get("tabId");
            if (tabId == null || !tabId.isTextual() || tabId.asText().isBlank()) {
                continue;
            }
            JsonNode conversationId = tab.get("conversationId");
            tabs.add(new OpenTab(
                    tabId.asText(), conversationId != null && conversationId.isTextual() ? conversationId.asText() : null));
        }
        JsonNode active = stored.get("activeTabId");
        String activeTabId = active != null && active.isTextual() ? active.asText() : null;
        boolean activeIsOpen = activeTabId != null && tabs.stream().anyMatch(t -> t.tabId().equals(activeTabId));
        return new TabManagerState(tabs, activeIsOpen ? activeTabId : null);
    }
}
