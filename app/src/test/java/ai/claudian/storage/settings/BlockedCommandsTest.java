package ai.claudian.storage.settings;

import static org.junit.jupiter.api.Assertions.*;

import ai.claudian.storage.Json;
import java.util.List;
import org.junit.jupiter.api.Test;

class BlockedCommandsTest {

    private static final BlockedCommands DEFAULTS = BlockedCommands.defaults();

    @Test
    void flatListBecomesUnixBucketWithDefaultWindows() throws Exception {
        var normalized = BlockedCommands.normalize(Json.readTree("[\"rm -rf\", \"  \"]"));

        assertEquals(List.of("rm -rf"), normalized.unix());
        assertEquals(DEFAULTS.windows(), normalized.windows());
    }

    @Test
    void platformKeyedBucketsAreValidatedIndependently() throws Exception {
        var normalized = BlockedCommands.normalize(
                Json.readTree("{\"unix\":[\" shutdown \", 5, \"\"], \"windows\":\"not a list\"}"));

        assertEquals(List.of("shutdown"), normalized.unix());
        assertEquals(DEFAULTS.windows(), normalized.windows());
    }

    @Test
    void missingBucketFallsBackToDefaults() throws Exception {
        var normalized = BlockedCommands.normalize(Json.readTree("{\"windows\":[\"format d:\"]}"));

        assertEquals(DEFAULTS.unix(), normalized.unix());
        assertEquals(List.of("format d:"), normalized.windows());
    }

    @Test
    void emptyListIsKeptAsDeliberateChoice() throws Exception {
        var normalized = BlockedCommands.normalize(Json.readTree("{\"unix\":[],\"windows\":[]}"));

        assertTrue(normalized.unix().isEmpty());
        assertTrue(normalized.windows().isEmpty());
    }

    @Test
    void unrecognizedShapesYieldDefaults() throws Exception {
        assertEquals(DEFAULTS, BlockedCommands.normalize(null));
        assertEquals(DEFAULTS, BlockedCommands.normalize(Json.readTree("42")));
    }
}
