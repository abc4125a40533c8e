package ai.claudian.storage.legacy;

import ai.claudian.storage.Json;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;

/** Tab layout and the legacy active-conversation marker, both kept in host state. */
public class TabStateStore {
    private static final Logger logger = LogManager.getLogger(TabStateStore.class);

    private final HostStateStore hostState;

    public TabStateStore(HostStateStore hostState) {
        this.hostState = hostState;
    }

    @Blocking
    public TabManagerState getTabManagerState() throws IOException {
        return hostState.load().map(LegacyStateBlob::of).map(LegacyStateBlob::tabManagerState)
                .orElseGet(TabManagerState::empty);
    }

    /** Rewrites only the tab layout key; every other host key is kept as stored. */
    @Blocking
    public void setTabManagerState(TabManagerState state) throws IOException {
        ObjectNode root = hostState.load().orElseGet(Json::newObject);
        root.set(TabManagerState.KEY, Json.valueToObject(state));
        hostState.save(root);
    }

    @Blocking
    public Optional<String> getLegacyActiveConversationId() throws IOException {
        return hostState.load().map(LegacyStateBlob::of).flatMap(LegacyStateBlob::activeConversationId);
    }

    /** Removes the legacy marker from host state. No-op if absent. */
    @Blocking
    public void clearLegacyActiveConversationId() throws IOException {
        var stored = hostState.load();
        if (stored.isEmpty() || !stored.get().has(LegacyStateBlob.ACTIVE_CONVERSATION_ID)) {
            return;
        }
        ObjectNode root = stored.get();
        root.remove(LegacyStateBlob.ACTIVE_CONVERSATION_ID);
        hostState.save(root);
        logger.debug("Cleared legacy {} from host state", LegacyStateBlob.ACTIVE_CONVERSATION_ID);
    }
}
