package work.lcod.spatial.validation;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;

/**
 * Field-local checks shared by resources and options.
 */
public final class Checks {
    private Checks() {}

    public static <T> T required(String field, T value, Object owner) {
        if (value == null) {
            throw ValidationException.missing(field, "The '" + field + "' property is required", owner);
        }
        return value;
    }

    public static void maxSize(String field, Collection<?> values, int max, Object owner) {
        if (values != null && values.size() > max) {
            throw ValidationException.invalid(
                field,
                "The '" + field + "' property must have at most " + max + " entries (got " + values.size() + ")",
                owner
            );
        }
    }

    public static void sizeBetween(String field, Collection<?> values, int min, int max, Object owner) {
        if (values == null) {
            return;
        }
        if (values.size() < min || values.size() > max) {
            throw ValidationException.invalid(
                field,
                "The '" + field + "' property must have between " + min + " and " + max
                    + " entries (got " + values.size() + ")",
                owner
            );
        }
    }

    public static void inRange(String field, double value, double min, double max, Object owner) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw ValidationException.invalid(
                field,
                "The '" + field + "' property must be between " + min + " and " + max + " (got " + value + ")",
                owner
            );
        }
    }

    public static void atLeast(String field, double value, double min, Object owner) {
        if (Double.isNaN(value) || value < min) {
            throw ValidationException.invalid(
                field,
                "The '" + field + "' property must be at least " + min + " (got " + value + ")",
                owner
            );
        }
    }

    public static void eachInRange(String field, List<Double> values, double min, double max, Object owner) {
        if (values == null) {
            return;
        }
        for (Double value : values) {
            inRange(field, value == null ? Double.NaN : value, min, max, owner);
        }
    }

    public static void eachAtLeast(String field, List<Double> values, double min, Object owner) {
        if (values == null) {
            return;
        }
        for (Double value : values) {
            atLeast(field, value == null ? Double.NaN : value, min, owner);
        }
    }

    /**
     * Adjacent differences must all be non-negative.
     */
    public static void nonDecreasing(String field, List<Double> values, String label, Object owner) {
        if (values == null) {
            return;
        }
        for (int i = 1; i < values.size(); i++) {
            if (!(values.get(i) - values.get(i - 1) >= 0)) {
                throw ValidationException.invalid(field, label + " must not decrease: " + values, owner);
            }
        }
    }

    public static void unique(String field, List<Integer> values, Object owner) {
        if (values == null) {
            return;
        }
        if (new HashSet<>(values).size() != values.size()) {
            throw ValidationException.invalid(field, field + " must be unique: " + values, owner);
        }
    }

    public static void noNulls(String field, Collection<?> values, Object owner) {
        if (values == null) {
            return;
        }
        for (Object value : values) {
            if (value == null) {
                throw ValidationException.invalid(field, "The '" + field + "' property may not contain null entries", owner);
            }
        }
    }
}
