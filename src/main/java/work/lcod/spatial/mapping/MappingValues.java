package work.lcod.spatial.mapping;

import java.util.Arrays;
import java.util.List;
import work.lcod.spatial.shared.Color;
import work.lcod.spatial.shared.ShortString;
import work.lcod.spatial.validation.Checks;
import work.lcod.spatial.validation.ValidationException;

/**
 * Homogeneous list of display values: all colors, all numbers or all labels.
 */
public interface MappingValues {
    int MAX_SIZE = 256;

    List<?> items();

    default int size() {
        return items().size();
    }

    static Colors colors(Color... colors) {
        return new Colors(Arrays.asList(colors));
    }

    static Numbers numbers(double... numbers) {
        return new Numbers(Arrays.stream(numbers).boxed().toList());
    }

    static Labels labels(String... labels) {
        return new Labels(Arrays.asList(labels));
    }

    /**
     * Field-level check shared by the mappings holding values.
     */
    static void check(MappingValues values, Object owner) {
        if (values == null) {
            return;
        }
        Checks.maxSize("values", values.items(), MAX_SIZE, owner);
        if (values instanceof Labels labels) {
            for (String label : labels.items()) {
                ShortString.check("values", label, ShortString.LABEL_MAX, owner);
            }
        }
    }

    record Colors(List<Color> items) implements MappingValues {
        public Colors {
            items = copy(items);
        }
    }

    record Numbers(List<Double> items) implements MappingValues {
        public Numbers {
            items = copy(items);
            for (Double value : items) {
                if (value.isNaN()) {
                    throw ValidationException.invalid("values", "mapping values may not be NaN: " + items, null);
                }
            }
        }
    }

    record Labels(List<String> items) implements MappingValues {
        public Labels {
            items = copy(items);
        }
    }

    private static <T> List<T> copy(List<T> items) {
        if (items == null) {
            throw new IllegalArgumentException("values must be provided");
        }
        for (T item : items) {
            if (item == null) {
                throw ValidationException.invalid("values", "mapping values may not contain null entries", null);
            }
        }
        return List.copyOf(items);
    }
}
