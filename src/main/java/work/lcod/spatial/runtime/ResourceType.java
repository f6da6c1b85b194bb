package work.lcod.spatial.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;
import work.lcod.spatial.codec.ResourceCodec;
import work.lcod.spatial.resource.Resource;

/**
 * Registry entry describing one concrete resource type and how it is read and written.
 */
public record ResourceType<T extends Resource>(
    TypeKey key,
    Class<T> type,
    String description,
    Reader<T> reader,
    Writer<T> writer
) {
    public ResourceType {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(reader, "reader");
        Objects.requireNonNull(writer, "writer");
        description = description == null ? "" : description;
    }

    @FunctionalInterface
    public interface Reader<T> {
        T read(ObjectNode node, ResourceCodec codec);
    }

    @FunctionalInterface
    public interface Writer<T> {
        void write(T value, ObjectNode out, ResourceCodec codec);
    }

    public boolean accepts(JsonNode node) {
        JsonNode typeNode = node == null ? null : node.get("type");
        return typeNode == null || !typeNode.isTextual() || key.toString().equals(typeNode.asText());
    }
}
