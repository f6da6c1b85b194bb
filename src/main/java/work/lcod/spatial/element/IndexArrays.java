package work.lcod.spatial.element;

import java.util.List;
import work.lcod.spatial.files.ArrayDescriptor;
import work.lcod.spatial.files.DType;
import work.lcod.spatial.ref.Ref;
import work.lcod.spatial.validation.ValidationException;

/**
 * Shape, dtype and bound checks on vertex and index arrays.
 */
final class IndexArrays {
    private IndexArrays() {}

    static void checkVertices(Ref<ArrayDescriptor> vertices, Element owner) {
        if (vertices == null) {
            return;
        }
        vertices.checkTarget("vertices", owner, List.of(ArrayDescriptor.class));
        vertices.value().ifPresent(array -> {
            if (array.rank() != 2 || array.shape().get(1) != 3) {
                throw ValidationException.invalid(
                    "vertices",
                    label(owner) + " vertices must be Nx3 array, not of shape " + array.shape(),
                    owner
                );
            }
        });
    }

    /**
     * Checks an {@code M x columns} array of non-negative integer indices.
     */
    static void checkIndices(String field, Ref<ArrayDescriptor> indices, int columns, Element owner) {
        if (indices == null) {
            return;
        }
        indices.checkTarget(field, owner, List.of(ArrayDescriptor.class));
        ArrayDescriptor array = indices.value().orElse(null);
        if (array == null) {
            return;
        }
        if (array.rank() != 2 || array.shape().get(1) != columns) {
            throw ValidationException.invalid(
                field,
                label(owner) + " " + field + " must be Mx" + columns + " array, not of shape " + array.shape(),
                owner
            );
        }
        if (array.kind() != DType.INTEGER) {
            throw ValidationException.invalid(
                field,
                label(owner) + " " + field + " must be an integer array, not " + array.dtype(),
                owner
            );
        }
        if (array.min().orElse(0) < 0) {
            throw ValidationException.invalid(field, capitalize(field) + " may only have non-negative integers", owner);
        }
    }

    /**
     * Runs only when the indices are materialized and the vertex count is known.
     */
    static void checkBounds(String field, Ref<ArrayDescriptor> indices, Ref<ArrayDescriptor> vertices, Element owner) {
        var nodes = Element.firstDimension(vertices);
        if (indices == null || nodes.isEmpty()) {
            return;
        }
        var max = indices.value().map(ArrayDescriptor::max).orElse(null);
        if (max == null || max.isEmpty()) {
            return;
        }
        if (max.getAsDouble() >= nodes.getAsLong()) {
            throw ValidationException.invalid(
                field,
                capitalize(singular(field)) + " index " + (long) max.getAsDouble()
                    + " is outside bounds for " + nodes.getAsLong() + " vertices",
                owner
            );
        }
    }

    private static String label(Element owner) {
        return owner.getClass().getSimpleName();
    }

    private static String singular(String field) {
        return field.endsWith("s") ? field.substring(0, field.length() - 1) : field;
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
