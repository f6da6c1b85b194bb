package work.lcod.spatial.api;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A scene file: the root element (inline object or identifier) and the serialized resources
 * that identifiers may resolve to.
 */
public record SceneDocument(JsonNode element, Map<String, JsonNode> resources) {
    public SceneDocument {
        Objects.requireNonNull(element, "element");
        resources = Collections.unmodifiableMap(new LinkedHashMap<>(resources));
    }
}
