package work.lcod.spatial.ref;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.spatial.resource.Resource;
import work.lcod.spatial.runtime.ResourceRegistry;
import work.lcod.spatial.runtime.SpatialRegistry;
import work.lcod.spatial.runtime.TypeKey;
import work.lcod.spatial.validation.ValidationException;

/**
 * Link to another object: either an opaque identifier that has not been fetched yet, or the
 * resolved object itself.
 *
 * <p>Checks that need the referent's contents must no-op on unresolved references; checks that
 * only need the referent's type run in both states (see {@link #checkTarget}).
 */
public final class Ref<T> {
    private final String id;
    private final T value;

    private Ref(String id, T value) {
        this.id = id;
        this.value = value;
    }

    public static <T> Ref<T> to(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Reference identifier must be a non-empty string");
        }
        return new Ref<>(id, null);
    }

    public static <T> Ref<T> of(T value) {
        return new Ref<>(null, Objects.requireNonNull(value, "value"));
    }

    public boolean isResolved() {
        return value != null;
    }

    /**
     * @return the identifier of an unresolved reference, or the uid of a resolved resource
     */
    public Optional<String> id() {
        if (value instanceof Resource resource) {
            return Optional.ofNullable(resource.uid());
        }
        return Optional.ofNullable(id);
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    /**
     * Returns the resolved value, failing with a {@code missing} error when unresolved.
     */
    public T require(String field, Object owner) {
        if (value == null) {
            throw ValidationException.missing(
                field,
                "The '" + field + "' reference must be resolved, but is still '" + id + "'",
                owner
            );
        }
        return value;
    }

    /**
     * Type-only check against the standard registry.
     */
    public void checkTarget(String field, Object owner, List<Class<?>> allowed) {
        checkTarget(field, owner, allowed, SpatialRegistry.standard());
    }

    /**
     * Type-only check: a resolved value must be an instance of an allowed class; an identifier
     * that names a type registered in {@code registry} must name an allowed one.
     */
    public void checkTarget(String field, Object owner, List<Class<?>> allowed, ResourceRegistry registry) {
        if (value != null) {
            for (Class<?> type : allowed) {
                if (type.isInstance(value)) {
                    return;
                }
            }
            throw ValidationException.invalid(
                field,
                "The '" + field + "' property must be one of " + names(allowed, registry) + ", not "
                    + value.getClass().getSimpleName(),
                owner
            );
        }
        Optional<TypeKey> named = registry.identify(id);
        if (named.isEmpty()) {
            return;
        }
        for (Class<?> type : allowed) {
            if (registry.keyFor(type).filter(named.get()::equals).isPresent()) {
                return;
            }
        }
        throw ValidationException.invalid(
            field,
            "The '" + field + "' identifier '" + id + "' points to " + named.get() + ", expected one of "
                + names(allowed, registry),
            owner
        );
    }

    private static String names(List<Class<?>> types, ResourceRegistry registry) {
        var names = new StringBuilder("[");
        for (int i = 0; i < types.size(); i++) {
            if (i > 0) {
                names.append(", ");
            }
            Class<?> type = types.get(i);
            names.append(registry.keyFor(type).map(TypeKey::toString).orElse(type.getSimpleName()));
        }
        return names.append(']').toString();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Ref<?> ref)) {
            return false;
        }
        return Objects.equals(id, ref.id) && Objects.equals(value, ref.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, value);
    }

    @Override
    public String toString() {
        return value != null ? "Ref[" + value + "]" : "Ref[" + id + "]";
    }
}
