package ai.claudian.storage.settings;

import ai.claudian.storage.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * The {@code permissions} value of a settings file, discriminated by shape: the old flat array, the CLI's structured
 * object, or anything else.
 */
public sealed interface PermissionsShape {

    record LegacyList(List<LegacyPermission> records) implements PermissionsShape {
        private static final Logger logger = LogManager.getLogger(LegacyList.class);

        /** Reads each array element; elements that are not permission objects are dropped. */
        static LegacyList parse(JsonNode array) {
            var records = new ArrayList<LegacyPermission>();
            for (JsonNode item : array) {
                if (!item.isObject()) {
                    continue;
                }
                try {
                    records.add(Json.treeToValue(item, LegacyPermission.class));
                } catch (JsonProcessingException e) {
                    logger.debug("Dropping unreadable legacy permission {}: {}", item, e.getMessage());
                }
            }
            return new LegacyList(List.copyOf(records));
        }
    }

    /** Kept as the raw node so fields this code does not model survive a rewrite unchanged. */
    record Structured(ObjectNode raw) implements PermissionsShape {}

    record Unrecognized() implements PermissionsShape {}

    static PermissionsShape of(@Nullable JsonNode permissions) {
        if (permissions == null) {
            return new Unrecognized();
        }
        if (permissions.isArray()) {
            return LegacyList.parse(permissions);
        }
        if (permissions instanceof ObjectNode obj) {
            return new Structured(obj);
        }
        return new Unrecognized();
    }

    /** Typed view of this shape; unrecognized input yields the built-in defaults. */
    default AgentPermissions toPermissions() throws JsonProcessingException {
        if (this instanceof LegacyList legacy) {
            return AgentPermissions.fromLegacy(legacy.records());
        }
        if (this instanceof Structured structured) {
            return Json.treeToValue(structured.raw(), AgentPermissions.class);
        }
        return AgentPermissions.defaults();
    }

    /** JSON to write back for this shape: structured input verbatim, everything else converted. */
    default ObjectNode toNode() throws JsonProcessingException {
        if (this instanceof Structured structured) {
            return structured.raw().deepCopy();
        }
        return Json.valueToObject(toPermissions());
    }
}
