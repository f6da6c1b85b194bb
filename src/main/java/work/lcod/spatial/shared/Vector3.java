package work.lcod.spatial.shared;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Three-component vector; accepts the compass names {@code east}, {@code north}, {@code up}
 * and their opposites.
 */
public record Vector3(double x, double y, double z) {
    public static final Vector3 ZERO = new Vector3(0, 0, 0);

    private static final Map<String, Vector3> NAMED = Map.of(
        "east", new Vector3(1, 0, 0),
        "west", new Vector3(-1, 0, 0),
        "north", new Vector3(0, 1, 0),
        "south", new Vector3(0, -1, 0),
        "up", new Vector3(0, 0, 1),
        "down", new Vector3(0, 0, -1)
    );

    public Vector3 {
        if (!Double.isFinite(x) || !Double.isFinite(y) || !Double.isFinite(z)) {
            throw new IllegalArgumentException("Vector components must be finite: [" + x + ", " + y + ", " + z + "]");
        }
    }

    public static Vector3 named(String name) {
        Vector3 vector = name == null ? null : NAMED.get(name.trim().toLowerCase(Locale.ROOT));
        if (vector == null) {
            throw new IllegalArgumentException("Unknown vector name: " + name);
        }
        return vector;
    }

    public static Vector3 of(List<? extends Number> components) {
        if (components == null || components.size() != 3) {
            throw new IllegalArgumentException("Vector must have exactly 3 components: " + components);
        }
        return new Vector3(
            components.get(0).doubleValue(),
            components.get(1).doubleValue(),
            components.get(2).doubleValue()
        );
    }

    public double length() {
        return Math.sqrt(x * x + y * y + z * z);
    }

    /**
     * @throws IllegalArgumentException for the zero vector
     */
    public Vector3 normalized() {
        double length = length();
        if (length == 0) {
            throw new IllegalArgumentException("Cannot scale the zero vector to unit length");
        }
        if (length == 1) {
            return this;
        }
        return new Vector3(x / length, y / length, z / length);
    }

    public double[] toArray() {
        return new double[] {x, y, z};
    }

    public List<Double> toList() {
        return List.of(x, y, z);
    }
}
