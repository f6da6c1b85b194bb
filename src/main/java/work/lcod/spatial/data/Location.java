package work.lcod.spatial.data;

import java.util.List;
import java.util.Locale;
import work.lcod.spatial.validation.ValidationException;

/**
 * Where data values sit on an element's topology.
 */
public enum Location {
    NODES("nodes", List.of("n", "node", "vertices", "corners")),
    CELLS("cells", List.of("cc", "cell", "segments", "faces", "blocks"));

    private final String wireName;
    private final List<String> synonyms;

    Location(String wireName, List<String> synonyms) {
        this.wireName = wireName;
        this.synonyms = synonyms;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Normalizes a canonical name or synonym (case-insensitive) to its location.
     */
    public static Location parse(String raw) {
        if (raw != null) {
            String key = raw.trim().toLowerCase(Locale.ROOT);
            for (Location location : values()) {
                if (location.wireName.equals(key) || location.synonyms.contains(key)) {
                    return location;
                }
            }
        }
        throw ValidationException.invalid(
            "location",
            "Invalid location '" + raw + "' - valid values: nodes, cells",
            null
        );
    }
}
