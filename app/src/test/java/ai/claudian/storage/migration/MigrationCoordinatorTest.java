package ai.claudian.storage.migration;

import static org.junit.jupiter.api.Assertions.*;

import ai.claudian.cli.CliPathResolver;
import ai.claudian.cli.Platform;
import ai.claudian.storage.Json;
import ai.claudian.storage.StorageLayout;
import ai.claudian.storage.commands.CommandDefinition;
import ai.claudian.storage.legacy.LegacyStateBlob;
import ai.claudian.storage.legacy.TabManagerState;
import ai.claudian.storage.settings.BlockedCommands;
import ai.claudian.storage.settings.PluginSettings;
import ai.claudian.storage.settings.ToolPrivateFields;
import ai.claudian.testutil.InMemoryFileAdapter;
import ai.claudian.testutil.InMemoryHostStateStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MigrationCoordinatorTest {
    private static final String AGENT_FILE = ".claude/settings.json";
    private static final String PLUGIN_FILE = ".claude/claudian-settings.json";
    private static final String HOST = "laptop";

    private InMemoryFileAdapter adapter;
    private InMemoryHostStateStore hostState;

    @BeforeEach
    void setUp() {
        adapter = new InMemoryFileAdapter();
        hostState = new InMemoryHostStateStore();
    }

    private MigrationCoordinator coordinator() {
        return new MigrationCoordinator(
                adapter,
                StorageLayout.defaults(),
                hostState,
                new CliPathResolver(HOST, Platform.LINUX, Path.of("/home/test")));
    }

    private ObjectNode agentRoot() throws Exception {
        return Json.readObject(adapter.get(AGENT_FILE), AGENT_FILE);
    }

    private static List<String> keys(ObjectNode node) {
        var names = new ArrayList<String>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    @Test
    void freshInstallCreatesFoldersAndReturnsDefaultsWithoutWriting() throws Exception {
        var settings = coordinator().initialize();

        assertEquals(PluginSettings.defaults(), settings.plugin());
        assertTrue(settings.agent().permissions().allow().isEmpty());
        assertTrue(adapter.exists(Path.of(".claude/commands")));
        assertTrue(adapter.exists(Path.of(".claude/sessions")));
        assertEquals(0, adapter.totalWrites());
    }

    @Nested
    class SplitMigration {

        @Test
        void combinedFileIsSplitEndToEnd() throws Exception {
            // given a combined settings.json and no plugin settings
            adapter.put(
                    AGENT_FILE,
                    """
                    {"userName":"Ann","blockedCommands":["rm -rf"],
                     "permissions":[{"toolName":"Bash","pattern":"git *","approvedAt":1,"scope":"always"}]}
                    """);

            // when
            var settings = coordinator().initialize();

            // then
            assertEquals("Ann", settings.plugin().userName());
            assertEquals(List.of("rm -rf"), settings.plugin().blockedCommands().unix());
            assertEquals(BlockedCommands.defaults().windows(), settings.plugin().blockedCommands().windows());
            assertEquals(List.of("Bash(git *)"), settings.agent().permissions().allow());
            assertEquals(List.of("$schema", "permissions"), keys(agentRoot()));
        }

        @Test
        void secondInitializeWritesNothingAndFilesStayByteIdentical() throws Exception {
            adapter.put(AGENT_FILE, "{\"userName\":\"Ann\",\"model\":\"opus\",\"permissions\":[]}");
            hostState = new InMemoryHostStateStore("{\"lastEnvHash\":\"h\",\"tabManagerState\":{\"openTabs\":[]}}");

            var first = coordinator().initialize();
            String agentAfterFirst = adapter.get(AGENT_FILE);
            String pluginAfterFirst = adapter.get(PLUGIN_FILE);
            int writesAfterFirst = adapter.totalWrites();
            int hostSavesAfterFirst = hostState.saves().size();

            var second = coordinator().initialize();

            assertEquals(first, second);
            assertEquals(agentAfterFirst, adapter.get(AGENT_FILE));
            assertEquals(pluginAfterFirst, adapter.get(PLUGIN_FILE));
            assertEquals(writesAfterFirst, adapter.totalWrites());
            assertEquals(hostSavesAfterFirst, hostState.saves().size());
        }

        @Test
        void agentSettingsShareNoKeyWithToolPrivateFields() throws Exception {
            adapter.put(
                    AGENT_FILE,
                    """
                    {"userName":"Ann","enableBlocklist":false,"model":"opus","thinkingBudget":"high",
                     "environmentVariables":"A=1","env":{"B":"2"},"claudeCliPaths":{"linux":"/opt/claude"},
                     "showToolUse":true,"allowedContextPaths":["/x"],"keyboardNavigation":{"scrollUpKey":"k"},
                     "permissions":{"allow":["Read"]}}
                    """);

            assertTrue(coordinator().migrateSplit());

            for (String key : keys(agentRoot())) {
                assertFalse(ToolPrivateFields.ALL.contains(key), "leaked " + key);
            }
        }

        @Test
        void everyPluginFieldIsEitherLegacyValueOrDefault() throws Exception {
            ObjectNode legacy = Json.readObject(
                    """
                    {"userName":"Ann","enableBlocklist":false,
                     "blockedCommands":{"unix":["shutdown"],"windows":["format d:"]},
                     "permissionMode":"normal","model":"sonnet","thinkingBudget":"high",
                     "excludedTags":["private"],"mediaFolder":"media","systemPrompt":"Be brief",
                     "allowedExportPaths":["~/Exports"],"persistentExternalContextPaths":["~/notes"],
                     "environmentVariables":"A=1",
                     "envSnippets":[{"id":"s1","name":"Work","description":"office","envVars":"A=2"}],
                     "keyboardNavigation":{"scrollUpKey":"k","scrollDownKey":"j","focusInputKey":"i"},
                     "claudeCliPath":"/usr/local/bin/claude","loadUserClaudeSettings":false,
                     "enableAutoTitleGeneration":false,"titleGenerationModel":"haiku",
                     "showToolUse":true,"permissions":[]}
                    """,
                    "legacy");
            adapter.put(AGENT_FILE, Json.toPrettyJson(legacy));

            coordinator().migrateSplit();

            ObjectNode migrated = Json.readObject(adapter.get(PLUGIN_FILE), PLUGIN_FILE);
            ObjectNode defaults = Json.valueToObject(PluginSettings.defaults());
            for (String field : keys(defaults)) {
                JsonNode expected = legacy.has(field) ? legacy.get(field) : defaults.get(field);
                assertEquals(expected, migrated.get(field), field);
            }
            assertFalse(migrated.has("showToolUse"));
        }

        @Test
        void absentPersistentContextPathsDefaultToEmpty() throws Exception {
            adapter.put(AGENT_FILE, "{\"userName\":\"Ann\"}");

            var settings = coordinator().initialize();

            assertTrue(settings.plugin().persistentExternalContextPaths().isEmpty());
        }

        @Test
        void cliEnvMapIsMergedIntoTextAndWins() throws Exception {
            adapter.put(
                    AGENT_FILE,
                    "{\"environmentVariables\":\"A=1\\nB=2\",\"env\":{\"B\":\"20\",\"C\":\"3\"},\"permissions\":[]}");

            var settings = coordinator().initialize();

            assertEquals("A=1\nB=20\nC=3", settings.plugin().environmentVariables());
        }

        @Test
        void structuredPermissionsArePreservedVerbatim() throws Exception {
            adapter.put(
                    AGENT_FILE,
                    """
                    {"userName":"Ann","permissions":{"allow":["Read"],"deny":["Bash(rm *)"],"ask":[],
                     "defaultMode":"acceptEdits","additionalDirectories":["/data"]}}
                    """);
            JsonNode before = Json.readTree(adapter.get(AGENT_FILE)).get("permissions");

            coordinator().initialize();

            assertEquals(before, agentRoot().get("permissions"));
        }

        @Test
        void cleanSettingsFileIsLeftAlone() throws Exception {
            String clean = "{\"$schema\":\"x\",\"permissions\":{\"allow\":[]},\"env\":{\"A\":\"1\"}}";
            adapter.put(AGENT_FILE, clean);

            assertFalse(coordinator().migrateSplit());

            assertEquals(clean, adapter.get(AGENT_FILE));
            assertFalse(adapter.exists(Path.of(PLUGIN_FILE)));
            assertEquals(0, adapter.writeCount(AGENT_FILE));
        }

        @Test
        void silentlyDroppedPluginWriteAbortsBeforeTouchingSettingsJson() throws Exception {
            String original = "{\"userName\":\"Ann\",\"permissions\":[{\"toolName\":\"Read\",\"scope\":\"always\"}]}";
            adapter.put(AGENT_FILE, original);
            adapter.dropWritesTo(p -> p.endsWith("claudian-settings.json"));

            assertThrows(SettingsVerificationException.class, () -> coordinator().initialize());

            assertEquals(original, adapter.get(AGENT_FILE));
            assertEquals(0, adapter.writeCount(AGENT_FILE));
        }

        @Test
        void failedPluginWriteLeavesSettingsJsonUntouched() throws Exception {
            String original = "{\"userName\":\"Ann\",\"permissions\":[]}";
            adapter.put(AGENT_FILE, original);
            adapter.failWritesTo(p -> p.endsWith("claudian-settings.json"));

            assertThrows(IOException.class, () -> coordinator().initialize());

            assertEquals(original, adapter.get(AGENT_FILE));
        }

        @Test
        void legacyPlatformCliPathIsRecordedForThisHost() throws Exception {
            adapter.put(
                    AGENT_FILE,
                    "{\"userName\":\"Ann\",\"claudeCliPaths\":{\"linux\":\"/opt/claude\",\"macos\":\"/Applications/c\"}}");

            var settings = coordinator().initialize();

            assertEquals(Map.of(HOST, "/opt/claude"), settings.plugin().claudeCliPathsByHost());
            assertEquals("", settings.plugin().claudeCliPath());
        }
    }

    @Nested
    class HostStateMigration {

        @Test
        void bookkeepingIsAdoptedOnlyWherePluginValueIsBlank() throws Exception {
            adapter.put(PLUGIN_FILE, "{\"userName\":\"Ann\",\"lastClaudeModel\":\"opus\"}");
            hostState = new InMemoryHostStateStore(
                    "{\"lastEnvHash\":\"h1\",\"lastClaudeModel\":\"sonnet\",\"lastCustomModel\":\"proxy\",\"hostFlag\":1}");

            var settings = coordinator().initialize();

            assertEquals("h1", settings.plugin().lastEnvHash());
            assertEquals("opus", settings.plugin().lastClaudeModel());
            assertEquals("proxy", settings.plugin().lastCustomModel());
            assertEquals(List.of("hostFlag"), keys(hostState.current()));
        }

        @Test
        void contentIsCopiedToFilesAndConsumedKeysCleared() throws Exception {
            hostState = new InMemoryHostStateStore(
                    """
                    {"migrationVersion":1,
                     "slashCommands":[{"id":"cmd-1","name":"/review","description":"Review","content":"Review it"}],
                     "conversations":[{"id":"conv-1","title":"Plan","createdAt":1,"updatedAt":2,"sessionId":null,
                       "messages":[{"id":"m1","role":"user","content":"hi","timestamp":1,"toolCalls":[]}]}],
                     "tabManagerState":{"openTabs":[{"tabId":"t1","conversationId":"conv-1"}],"activeTabId":"t1"}}
                    """);
            var coordinator = coordinator();

            coordinator.initialize();

            assertEquals(List.of("review"), coordinator.commands().loadAll().stream().map(CommandDefinition::name).toList());
            var conversation = coordinator.sessions().loadConversation("conv-1").orElseThrow();
            assertEquals("hi", conversation.messages().get(0).content());
            assertEquals(List.of("tabManagerState"), keys(hostState.current()));
            assertEquals(
                    new TabManagerState(List.of(new TabManagerState.OpenTab("t1", "conv-1")), "t1"),
                    coordinator.tabs().getTabManagerState());
        }

        @Test
        void conversationFieldsOutsideTheCoreModelSurviveImport() throws Exception {
            // given a legacy conversation carrying plan state, usage and rich message content
            hostState = new InMemoryHostStateStore(
                    """
                    {"conversations":[{"id":"conv-7","title":"Rich","createdAt":1,"updatedAt":2,
                       "usage":{"inputTokens":12,"outputTokens":3},"approvedPlan":"step 1",
                       "messages":[{"id":"m1","role":"assistant","content":"done","timestamp":2,
                         "toolCalls":[{"id":"t1","name":"Read","input":{"file_path":"a.md"}}],
                         "contentBlocks":[{"type":"text","content":"done"}]}]}]}
                    """);
            var coordinator = coordinator();

            // when
            coordinator.initialize();

            // then the legacy array is gone and the session file holds every field
            assertFalse(hostState.current().has("conversations"));
            var lines = adapter.get(".claude/sessions/conv-7.jsonl").split("\n");
            var meta = Json.readObject(lines[0], "meta");
            assertEquals(12, meta.path("usage").path("inputTokens").asInt());
            assertEquals("step 1", meta.path("approvedPlan").asText());
            var message = Json.readObject(lines[1], "message").path("message");
            assertEquals("Read", message.path("toolCalls").path(0).path("name").asText());
            assertEquals("text", message.path("contentBlocks").path(0).path("type").asText());

            // and reading the conversation back keeps them too
            var loaded = coordinator.sessions().loadConversation("conv-7").orElseThrow();
            assertTrue(loaded.extra().has("usage"));
            assertTrue(loaded.messages().get(0).extra().has("toolCalls"));
        }

        @Test
        void existingTargetFilesAreLeftUnmodified() throws Exception {
            adapter.put(".claude/commands/review.md", "edited by the user");
            hostState = new InMemoryHostStateStore(
                    "{\"slashCommands\":[{\"name\":\"review\",\"content\":\"old\"}],\"hostFlag\":true}");

            var result = coordinator().migrateLegacyContent(
                    LegacyStateBlob.of(hostState.current()));

            assertFalse(result.hadErrors());
            assertInstanceOf(ItemOutcome.AlreadyPresent.class, result.outcomes().get(0));
            assertEquals("edited by the user", adapter.get(".claude/commands/review.md"));
            assertEquals(0, adapter.writeCount(".claude/commands/review.md"));
        }

        @Test
        void writeFailureKeepsLegacyStateUntilRetrySucceeds() throws Exception {
            String blob =
                    """
                    {"lastEnvHash":"h1",
                     "slashCommands":[{"name":"one","content":"1"}],
                     "conversations":[{"id":"conv-1","title":"T","createdAt":1,"updatedAt":1,"messages":[]}]}
                    """;
            hostState = new InMemoryHostStateStore(blob);
            adapter.failWritesTo(p -> p.startsWith(".claude/sessions"));

            coordinator().initialize();

            assertTrue(hostState.current().has("conversations"));
            assertTrue(hostState.current().has("lastEnvHash"));
            assertTrue(hostState.saves().isEmpty());

            adapter.failWritesTo(p -> false);
            coordinator().initialize();

            assertFalse(hostState.current().has("conversations"));
            assertFalse(hostState.current().has("slashCommands"));
            assertTrue(coordinator().sessions().loadConversation("conv-1").isPresent());
        }

        @Test
        void unusableItemCountsAsFailure() throws Exception {
            hostState = new InMemoryHostStateStore(
                    "{\"conversations\":[{\"title\":\"no id\"},{\"id\":\"a/b\",\"title\":\"bad id\"}]}");

            var coordinator = coordinator();
            var result = coordinator.migrateLegacyContent(
                    LegacyStateBlob.of(hostState.current()));

            assertTrue(result.hadErrors());
            assertEquals(2, result.failures().size());

            coordinator.initialize();
            assertTrue(hostState.current().has("conversations"));
        }

        @Test
        void unreadableHostStateIsTreatedAsAbsent() throws Exception {
            hostState.makeUnreadable();

            var settings = assertDoesNotThrow(() -> coordinator().initialize());

            assertEquals(PluginSettings.defaults(), settings.plugin());
        }

        @Test
        void activeConversationIdIsNotMigratedButCanBeLookedUp() throws Exception {
            adapter.put(PLUGIN_FILE, "{\"userName\":\"Ann\"}");
            hostState = new InMemoryHostStateStore("{\"activeConversationId\":\"conv-3\",\"lastEnvHash\":\"h\"}");
            var coordinator = coordinator();

            coordinator.initialize();

            assertFalse(Json.readObject(adapter.get(PLUGIN_FILE), PLUGIN_FILE).has("activeConversationId"));
            assertEquals("conv-3", coordinator.getLegacyActiveConversationId().orElseThrow());

            coordinator.clearLegacyActiveConversationId();
            assertTrue(coordinator.getLegacyActiveConversationId().isEmpty());
        }

        @Test
        void pluginMarkerTakesPrecedenceOverHostState() throws Exception {
            adapter.put(PLUGIN_FILE, "{\"userName\":\"Ann\",\"activeConversationId\":\"from-settings\"}");
            hostState = new InMemoryHostStateStore("{\"activeConversationId\":\"from-host\"}");

            assertEquals("from-settings", coordinator().getLegacyActiveConversationId().orElseThrow());
        }
    }
}
