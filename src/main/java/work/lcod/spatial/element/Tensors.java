package work.lcod.spatial.element;

import java.util.List;
import java.util.OptionalLong;
import work.lcod.spatial.shared.Vector3;
import work.lcod.spatial.validation.Checks;
import work.lcod.spatial.validation.ValidationException;

/**
 * Grid cell widths and axis helpers shared by surface and volume grids.
 */
final class Tensors {
    private Tensors() {}

    static List<Double> check(String field, List<Double> widths, int max, Object owner) {
        if (widths == null) {
            return null;
        }
        Checks.noNulls(field, widths, owner);
        Checks.maxSize(field, widths, max, owner);
        Checks.eachAtLeast(field, widths, 0, owner);
        return List.copyOf(widths);
    }

    static Vector3 axis(String field, Vector3 axis, Object owner) {
        if (axis == null) {
            return null;
        }
        try {
            return axis.normalized();
        } catch (IllegalArgumentException ex) {
            throw ValidationException.invalid(field, "The '" + field + "' property must be a non-zero vector", owner);
        }
    }

    /**
     * Product of {@code size + 1} (nodes) or {@code size} (cells) over every axis; empty when
     * any tensor is missing.
     */
    @SafeVarargs
    static OptionalLong count(boolean nodes, List<Double>... tensors) {
        long count = 1;
        for (List<Double> tensor : tensors) {
            if (tensor == null) {
                return OptionalLong.empty();
            }
            count *= nodes ? tensor.size() + 1 : tensor.size();
        }
        return OptionalLong.of(count);
    }
}
