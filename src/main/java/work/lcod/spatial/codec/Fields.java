package work.lcod.spatial.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;
import work.lcod.spatial.shared.Color;
import work.lcod.spatial.shared.Vector3;
import work.lcod.spatial.validation.ValidationException;

/**
 * Scalar and list field accessors over JSON trees. Absent and {@code null} fields read as
 * {@code null}.
 */
final class Fields {
    private Fields() {}

    static <T> void ifPresent(T value, Consumer<T> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }

    static boolean present(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        return node != null && !node.isNull();
    }

    static String text(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw typeError(field, "a string", node);
        }
        return node.asText();
    }

    static Double number(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return asNumber(field, node);
    }

    static Long integer(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isIntegralNumber()) {
            throw typeError(field, "an integer", node);
        }
        return node.asLong();
    }

    static Boolean bool(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isBoolean()) {
            throw typeError(field, "a boolean", node);
        }
        return node.asBoolean();
    }

    static List<Double> doubles(JsonNode parent, String field) {
        return list(parent, field, node -> asNumber(field, node));
    }

    static List<Boolean> booleans(JsonNode parent, String field) {
        return list(parent, field, node -> {
            if (!node.isBoolean()) {
                throw typeError(field, "a list of booleans", node);
            }
            return node.asBoolean();
        });
    }

    static List<Integer> integers(JsonNode parent, String field) {
        return list(parent, field, node -> {
            if (!node.isIntegralNumber()) {
                throw typeError(field, "a list of integers", node);
            }
            return node.asInt();
        });
    }

    /**
     * A 3-vector as {@code [x, y, z]} or a direction name such as {@code east}.
     */
    static Vector3 vector(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            if (node.isTextual()) {
                return Vector3.named(node.asText());
            }
            return Vector3.of(doubles(parent, field));
        } catch (IllegalArgumentException ex) {
            throw ValidationException.invalid(field, ex.getMessage(), null);
        }
    }

    /**
     * A color as {@code #RRGGBB}, a color name, {@code random}, or {@code [r, g, b]}.
     */
    static Color color(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            if (node.isTextual()) {
                return Color.parse(node.asText());
            }
            List<Integer> channels = integers(parent, field);
            if (channels.size() != 3) {
                throw new IllegalArgumentException("Color must have exactly 3 channels: " + channels);
            }
            return new Color(channels.get(0), channels.get(1), channels.get(2));
        } catch (IllegalArgumentException ex) {
            throw ValidationException.invalid(field, ex.getMessage(), null);
        }
    }

    static void putDoubles(ObjectNode out, String field, List<Double> values) {
        if (values == null) {
            return;
        }
        ArrayNode array = out.putArray(field);
        values.forEach(array::add);
    }

    static void putBooleans(ObjectNode out, String field, List<Boolean> values) {
        if (values == null) {
            return;
        }
        ArrayNode array = out.putArray(field);
        values.forEach(array::add);
    }

    static void putIntegers(ObjectNode out, String field, List<Integer> values) {
        if (values == null) {
            return;
        }
        ArrayNode array = out.putArray(field);
        values.forEach(array::add);
    }

    static void putVector(ObjectNode out, String field, Vector3 value) {
        if (value != null) {
            putDoubles(out, field, value.toList());
        }
    }

    static void putColor(ObjectNode out, String field, Color value) {
        if (value != null) {
            out.put(field, value.toHex());
        }
    }

    private static <T> List<T> list(JsonNode parent, String field, Function<JsonNode, T> item) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isArray()) {
            throw typeError(field, "a list", node);
        }
        List<T> values = new ArrayList<>(node.size());
        for (JsonNode entry : node) {
            values.add(item.apply(entry));
        }
        return values;
    }

    static double asNumber(String field, JsonNode node) {
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            // non-finite values travel as strings
            switch (node.asText()) {
                case "NaN":
                    return Double.NaN;
                case "Infinity":
                    return Double.POSITIVE_INFINITY;
                case "-Infinity":
                    return Double.NEGATIVE_INFINITY;
                default:
                    break;
            }
        }
        throw typeError(field, "a number", node);
    }

    private static ValidationException typeError(String field, String expected, JsonNode node) {
        return ValidationException.invalid(
            field,
            "The '" + field + "' property must be " + expected + ", not " + node.getNodeType().name().toLowerCase(Locale.ROOT),
            null
        );
    }
}
