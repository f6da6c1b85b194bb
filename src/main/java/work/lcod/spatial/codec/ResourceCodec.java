package work.lcod.spatial.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.spatial.ref.Ref;
import work.lcod.spatial.resource.Resource;
import work.lcod.spatial.runtime.ResourceRegistry;
import work.lcod.spatial.runtime.ResourceType;
import work.lcod.spatial.runtime.SpatialRegistry;
import work.lcod.spatial.runtime.TypeKey;
import work.lcod.spatial.validation.ValidationException;

/**
 * Reads and writes resources as JSON trees.
 *
 * <p>Every resource carries {@code "type": "<base>/<sub>"} next to its snake_case fields.
 * Unresolved references are written as their identifier. Resolved references are written
 * inline in {@link RefMode#INLINE} mode and as a JSON-encoded string in
 * {@link RefMode#SNAPSHOT} mode; both forms are accepted when reading.
 */
public final class ResourceCodec {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResourceCodec.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    public enum RefMode {
        INLINE,
        SNAPSHOT
    }

    private final ResourceRegistry registry;
    private final RefMode mode;

    public ResourceCodec(ResourceRegistry registry, RefMode mode) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    /**
     * Inline codec over {@link SpatialRegistry#standard()}; build one on a custom registry with
     * the constructor.
     */
    public static ResourceCodec inline() {
        return new ResourceCodec(SpatialRegistry.standard(), RefMode.INLINE);
    }

    public static ResourceCodec snapshot() {
        return new ResourceCodec(SpatialRegistry.standard(), RefMode.SNAPSHOT);
    }

    public RefMode mode() {
        return mode;
    }

    public ObjectMapper mapper() {
        return JSON;
    }

    public ObjectNode write(Resource resource) {
        Objects.requireNonNull(resource, "resource");
        return writeTyped(resource);
    }

    public String writeString(Resource resource) {
        return toJson(write(resource));
    }

    /**
     * Reads a resource whose {@code type} names any registered pair.
     */
    public Resource read(JsonNode node) {
        return readUnion("type", node, List.of(Resource.class));
    }

    public <T extends Resource> T read(JsonNode node, Class<T> type) {
        return type.cast(readUnion(type.getSimpleName(), node, List.of(type)));
    }

    public <T extends Resource> T readString(String json, Class<T> type) {
        return read(parse(json), type);
    }

    /**
     * Reads one of several allowed types. A {@code type} field selects the reader directly;
     * without one each candidate is tried in order.
     */
    public Resource readUnion(String field, JsonNode node, List<Class<?>> allowed) {
        JsonNode tree = node != null && node.isTextual() ? parse(node.asText()) : node;
        if (tree == null || !tree.isObject()) {
            throw ValidationException.invalid(field, "The '" + field + "' property must be an object", null);
        }
        ObjectNode object = (ObjectNode) tree;
        List<ResourceType<?>> candidates = candidates(allowed);
        JsonNode typeNode = object.get("type");
        if (typeNode != null && typeNode.isTextual()) {
            TypeKey key = TypeKey.parse(typeNode.asText());
            ResourceType<?> type = registry.find(key).orElseThrow(() -> ValidationException.invalid(
                field,
                "Unknown resource type '" + key + "'",
                null
            ));
            if (!candidates.contains(type)) {
                throw ValidationException.invalid(field, "Resource type '" + key + "' is not allowed here", null);
            }
            return readTyped(type, object);
        }
        RuntimeException last = null;
        for (ResourceType<?> candidate : candidates) {
            try {
                Resource value = readTyped(candidate, object);
                value.checkFields();
                return value;
            } catch (RuntimeException ex) {
                LOGGER.debug("{} does not read as {}: {}", field, candidate.key(), ex.getMessage());
                last = ex;
            }
        }
        var failure = ValidationException.invalid(field, "The '" + field + "' property matches none of " + keys(candidates), null);
        if (last != null) {
            failure.initCause(last);
        }
        throw failure;
    }

    public JsonNode writeRef(Ref<?> ref) {
        if (!ref.isResolved()) {
            return TextNode.valueOf(ref.id().orElseThrow());
        }
        Object value = ref.value().orElseThrow();
        if (!(value instanceof Resource resource)) {
            throw new IllegalArgumentException("Cannot serialize reference to " + value.getClass().getName());
        }
        ObjectNode inline = write(resource);
        return mode == RefMode.SNAPSHOT ? TextNode.valueOf(toJson(inline)) : inline;
    }

    /**
     * Reads an identifier, an inline object or a JSON-encoded object; {@code null} when absent.
     * Identifiers are type-checked against this codec's registry.
     */
    @SuppressWarnings("unchecked")
    public <T> Ref<T> readRef(String field, JsonNode node, List<Class<?>> allowed) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            if (text.startsWith("{")) {
                return Ref.of((T) readUnion(field, parse(text), allowed));
            }
            Ref<T> ref = Ref.to(text);
            ref.checkTarget(field, null, allowed, registry);
            return ref;
        }
        if (node.isObject()) {
            return Ref.of((T) readUnion(field, node, allowed));
        }
        throw ValidationException.invalid(field, "The '" + field + "' property must be an identifier or an object", null);
    }

    public void putRef(ObjectNode out, String field, Ref<?> ref) {
        if (ref != null) {
            out.set(field, writeRef(ref));
        }
    }

    public <T> Ref<T> ref(JsonNode parent, String field, Class<?>... allowed) {
        return readRef(field, parent.get(field), List.of(allowed));
    }

    public <T> List<Ref<T>> refs(JsonNode parent, String field, Class<?>... allowed) {
        return refs(parent, field, List.of(allowed));
    }

    public void putRefs(ObjectNode out, String field, List<? extends Ref<?>> refs) {
        ArrayNode array = out.putArray(field);
        for (Ref<?> ref : refs) {
            array.add(writeRef(ref));
        }
    }

    public <T> List<Ref<T>> refs(JsonNode parent, String field, List<Class<?>> allowed) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw ValidationException.invalid(field, "The '" + field + "' property must be a list", null);
        }
        List<Ref<T>> refs = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            Ref<T> ref = readRef(field + "[" + i + "]", node.get(i), allowed);
            if (ref == null) {
                throw ValidationException.invalid(field, "The '" + field + "' property may not contain null entries", null);
            }
            refs.add(ref);
        }
        return refs;
    }

    /**
     * Embeds a value object as-is in inline mode or as a JSON string in snapshot mode.
     */
    public JsonNode snapshot(ObjectNode value) {
        return mode == RefMode.SNAPSHOT ? TextNode.valueOf(toJson(value)) : value;
    }

    /**
     * Accepts an inline object or its JSON-encoded form.
     */
    public JsonNode unwrapSnapshot(JsonNode node) {
        if (node != null && node.isTextual()) {
            return parse(node.asText());
        }
        return node;
    }

    public JsonNode parse(String json) {
        try {
            return JSON.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("json parse error: " + ex.getOriginalMessage(), ex);
        }
    }

    public String toJson(JsonNode node) {
        try {
            return JSON.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize " + node.getNodeType(), ex);
        }
    }

    @SuppressWarnings("unchecked")
    private <T extends Resource> ObjectNode writeTyped(T resource) {
        ResourceType<T> type = registry.find((Class<T>) resource.getClass())
            .orElseThrow(() -> new IllegalArgumentException(
                "Unregistered resource class: " + resource.getClass().getName()
            ));
        ObjectNode out = JSON.createObjectNode();
        out.put("type", type.key().toString());
        if (resource.uid() != null) {
            out.put("uid", resource.uid());
        }
        if (resource.name() != null) {
            out.put("name", resource.name());
        }
        if (resource.description() != null) {
            out.put("description", resource.description());
        }
        type.writer().write(resource, out, this);
        return out;
    }

    private <T extends Resource> T readTyped(ResourceType<T> type, ObjectNode node) {
        T value = type.reader().read(node, this);
        value.setUid(Fields.text(node, "uid"));
        value.setName(Fields.text(node, "name"));
        value.setDescription(Fields.text(node, "description"));
        return value;
    }

    /**
     * Registered types assignable to any allowed class: exact matches first, then subtypes.
     */
    private List<ResourceType<?>> candidates(List<Class<?>> allowed) {
        List<ResourceType<?>> candidates = new ArrayList<>();
        for (Class<?> type : allowed) {
            for (ResourceType<?> entry : registry.entries()) {
                if (entry.type() == type && !candidates.contains(entry)) {
                    candidates.add(entry);
                }
            }
        }
        for (Class<?> type : allowed) {
            for (ResourceType<?> entry : registry.entries()) {
                if (type.isAssignableFrom(entry.type()) && !candidates.contains(entry)) {
                    candidates.add(entry);
                }
            }
        }
        return candidates;
    }

    private static List<String> keys(List<ResourceType<?>> types) {
        return types.stream().map(type -> type.key().toString()).toList();
    }
}
