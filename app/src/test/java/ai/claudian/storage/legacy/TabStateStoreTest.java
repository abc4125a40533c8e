package ai.claudian.storage.legacy;

import static org.junit.jupiter.api.Assertions.*;

import ai.claudian.testutil.InMemoryHostStateStore;
import java.util.List;
import org.junit.jupiter.api.Test;

class TabStateStoreTest {

    @Test
    void setTabManagerStateTouchesOnlyItsKey() throws Exception {
        var host = new InMemoryHostStateStore("{\"hostFlag\":true,\"lastEnvHash\":\"h\"}");
        var store = new TabStateStore(host);
        var state = new TabManagerState(List.of(new TabManagerState.OpenTab("t1", "conv-1")), "t1");

        store.setTabManagerState(state);

        assertEquals(state, store.getTabManagerState());
        assertTrue(host.current().path("hostFlag").asBoolean());
        assertEquals("h", host.current().path("lastEnvHash").asText());
    }

    @Test
    void emptyHostStateHasNoTabs() throws Exception {
        assertEquals(TabManagerState.empty(), new TabStateStore(new InMemoryHostStateStore()).getTabManagerState());
    }

    @Test
    void legacyActiveConversationIdIsReadAndCleared() throws Exception {
        var host = new InMemoryHostStateStore("{\"activeConversationId\":\"conv-9\",\"hostFlag\":1}");
        var store = new TabStateStore(host);

        assertEquals("conv-9", store.getLegacyActiveConversationId().orElseThrow());
        store.clearLegacyActiveConversationId();
        store.clearLegacyActiveConversationId();

        assertTrue(store.getLegacyActiveConversationId().isEmpty());
        assertEquals(1, host.saves().size());
        assertEquals(1, host.current().path("hostFlag").asInt());
    }
}
