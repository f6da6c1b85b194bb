package work.lcod.spatial.runtime;

import java.util.Objects;

/**
 * The {@code (base_type, sub_type)} discriminator advertised by every concrete resource.
 */
public record TypeKey(String baseType, String subType) {
    public TypeKey {
        Objects.requireNonNull(baseType, "baseType");
        Objects.requireNonNull(subType, "subType");
        if (baseType.isBlank() || subType.isBlank() || baseType.contains("/") || subType.contains("/")) {
            throw new IllegalArgumentException("Invalid type key: " + baseType + "/" + subType);
        }
    }

    /**
     * Parses the wire form {@code base/sub}.
     */
    public static TypeKey parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("type must be provided");
        }
        int slash = raw.indexOf('/');
        if (slash <= 0 || slash != raw.lastIndexOf('/') || slash == raw.length() - 1) {
            throw new IllegalArgumentException("type must look like 'base/sub': " + raw);
        }
        return new TypeKey(raw.substring(0, slash), raw.substring(slash + 1));
    }

    @Override
    public String toString() {
        return baseType + "/" + subType;
    }
}
