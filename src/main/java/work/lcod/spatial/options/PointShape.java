package work.lcod.spatial.options;

import java.util.Locale;
import work.lcod.spatial.validation.ValidationException;

public enum PointShape {
    SQUARE,
    SPHERE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PointShape parse(String raw) {
        if (raw != null) {
            for (PointShape shape : values()) {
                if (shape.name().equalsIgnoreCase(raw.trim())) {
                    return shape;
                }
            }
        }
        throw ValidationException.invalid("shape", "Invalid point shape '" + raw + "' - valid values: square, sphere", null);
    }
}
