package ai.claudian.storage.legacy;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.Optional;
import org.jetbrains.annotations.Blocking;

/**
 * The host application's opaque per-plugin state object. Claudian reads legacy fields out of it and writes back only
 * the keys it owns; every other key belongs to the host.
 */
public interface HostStateStore {

    /** The stored object, or empty if nothing has been stored. */
    @Blocking
    Optional<ObjectNode> load() throws IOException;

    /** Replaces the stored object. */
    @Blocking
    void save(ObjectNode state) throws IOException;
}
