package work.lcod.spatial.runtime;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import work.lcod.spatial.resource.Resource;

/**
 * Maps type keys to resource types. Filled by explicit registration, read-only once frozen.
 */
public final class ResourceRegistry {
    private final Map<TypeKey, ResourceType<?>> byKey = new LinkedHashMap<>();
    private final Map<Class<?>, ResourceType<?>> byClass = new LinkedHashMap<>();
    private volatile boolean frozen;

    public synchronized <T extends Resource> ResourceRegistry register(ResourceType<T> type) {
        if (frozen) {
            throw new IllegalStateException("Registry is frozen; cannot register " + type.key());
        }
        if (byKey.containsKey(type.key())) {
            throw new IllegalStateException("Type key already registered: " + type.key());
        }
        if (byClass.containsKey(type.type())) {
            throw new IllegalStateException("Class already registered: " + type.type().getName());
        }
        byKey.put(type.key(), type);
        byClass.put(type.type(), type);
        return this;
    }

    public synchronized ResourceRegistry freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public Optional<ResourceType<?>> find(TypeKey key) {
        return Optional.ofNullable(byKey.get(key));
    }

    @SuppressWarnings("unchecked")
    public <T extends Resource> Optional<ResourceType<T>> find(Class<T> type) {
        return Optional.ofNullable((ResourceType<T>) byClass.get(type));
    }

    public Optional<TypeKey> keyFor(Class<?> type) {
        var entry = byClass.get(type);
        return entry == null ? Optional.empty() : Optional.of(entry.key());
    }

    /**
     * Finds the first registered {@code base/sub} pair appearing as consecutive path segments
     * of an identifier, e.g. {@code https://host/api/mappings/continuous/abc}.
     */
    public Optional<TypeKey> identify(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        String path = id;
        int cut = indexOfAny(path, '?', '#');
        if (cut >= 0) {
            path = path.substring(0, cut);
        }
        String[] segments = path.split("/");
        for (int i = 0; i + 1 < segments.length; i++) {
            if (segments[i].isEmpty() || segments[i + 1].isEmpty()) {
                continue;
            }
            var key = new TypeKey(segments[i], segments[i + 1]);
            if (byKey.containsKey(key)) {
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }

    public Collection<ResourceType<?>> entries() {
        return Collections.unmodifiableCollection(byKey.values());
    }

    private static int indexOfAny(String value, char first, char second) {
        int a = value.indexOf(first);
        int b = value.indexOf(second);
        if (a < 0) {
            return b;
        }
        return b < 0 ? a : Math.min(a, b);
    }
}
