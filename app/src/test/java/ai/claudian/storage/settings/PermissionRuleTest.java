package ai.claudian.storage.settings;

import static org.junit.jupiter.api.Assertions.*;

import ai.claudian.storage.Json;
import ai.claudian.storage.settings.AgentPermissions.RuleList;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PermissionRuleTest {

    @Nested
    class Grammar {
        @Test
        void patternIsParenthesized() {
            assertEquals("Bash(git status)", PermissionRule.of("Bash", "git status").toString());
        }

        @Test
        void wildcardAndEmptyPatternsCollapseToBareTool() {
            assertEquals("Bash", PermissionRule.of("Bash", "*").toString());
            assertEquals("Bash", PermissionRule.of("Bash", "").toString());
            assertEquals("Bash", PermissionRule.of("Bash", null).toString());
        }

        @Test
        void parseRoundTripsBothForms() {
            assertEquals(PermissionRule.of("Read", "/tmp/*"), PermissionRule.parse("Read(/tmp/*)"));
            assertEquals(PermissionRule.of("WebFetch", null), PermissionRule.parse(" WebFetch "));
        }

        @Test
        void blankToolNameIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> PermissionRule.of("  ", "x"));
        }
    }

    @Nested
    class LegacyConversion {
        @Test
        void onlyAlwaysScopedRecordsSurviveDeduplicatedIntoAllow() throws Exception {
            var node = Json.readTree(
                    """
                    [
                      {"toolName":"Bash","pattern":"git status","approvedAt":1,"scope":"always"},
                      {"toolName":"Bash","pattern":"*","approvedAt":2,"scope":"always"},
                      {"toolName":"Read","pattern":"","approvedAt":3,"scope":"always"},
                      {"toolName":"Write","pattern":"a.txt","approvedAt":4,"scope":"session"},
                      {"toolName":"Bash","pattern":"git status","approvedAt":5,"scope":"always"},
                      "garbage"
                    ]
                    """);

            var permissions = PermissionsShape.of(node).toPermissions();

            assertEquals(List.of("Bash(git status)", "Bash", "Read"), permissions.allow());
            assertTrue(permissions.deny().isEmpty());
            assertTrue(permissions.ask().isEmpty());
        }

        @Test
        void structuredShapeIsWrittenBackVerbatim() throws Exception {
            var node = Json.readTree(
                    "{\"allow\":[\"Read\"],\"deny\":[],\"ask\":[\"Bash\"],\"defaultMode\":\"plan\","
                            + "\"additionalDirectories\":[\"/data\"],\"futureKey\":true}");

            var shape = PermissionsShape.of(node);

            assertInstanceOf(PermissionsShape.Structured.class, shape);
            assertEquals(node, shape.toNode());
            assertEquals("plan", shape.toPermissions().defaultMode());
        }

        @Test
        void anythingElseYieldsDefaults() throws Exception {
            assertEquals(AgentPermissions.defaults(), PermissionsShape.of(Json.readTree("\"allow all\"")).toPermissions());
            assertEquals(AgentPermissions.defaults(), PermissionsShape.of(null).toPermissions());
        }
    }

    @Nested
    class ListEditing {
        @Test
        void addingToOneListRemovesFromTheOthers() {
            var rule = PermissionRule.parse("Bash(npm test)");
            var permissions = AgentPermissions.defaults().withRule(RuleList.DENY, rule);

            var moved = permissions.withRule(RuleList.ALLOW, rule);

            assertEquals(List.of("Bash(npm test)"), moved.allow());
            assertTrue(moved.deny().isEmpty());
        }

        @Test
        void withoutRuleRemovesEverywhere() {
            var rule = PermissionRule.parse("Read");
            var permissions = new AgentPermissions(List.of("Read"), List.of(), List.of("Read", "Bash"), null, null);

            var cleared = permissions.withoutRule(rule);

            assertTrue(cleared.allow().isEmpty());
            assertEquals(List.of("Bash"), cleared.ask());
        }
    }
}
