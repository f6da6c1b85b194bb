package work.lcod.spatial.files;

import java.util.Locale;

/**
 * Coarse classification of an array element-type tag such as {@code Int16Array}.
 */
public enum DType {
    INTEGER,
    FLOAT,
    OTHER;

    public static final String FLOAT64 = "Float64Array";
    public static final String FLOAT32 = "Float32Array";
    public static final String INT32 = "Int32Array";

    /**
     * Inclusive value range of an integer tag, {@code null} when the tag has no fixed range.
     */
    public static long[] integerRange(String tag) {
        if (tag == null) {
            return null;
        }
        return switch (tag.toLowerCase(Locale.ROOT)) {
            case "int8array" -> new long[] {Byte.MIN_VALUE, Byte.MAX_VALUE};
            case "uint8array", "uint8clampedarray" -> new long[] {0, 0xFFL};
            case "int16array" -> new long[] {Short.MIN_VALUE, Short.MAX_VALUE};
            case "uint16array" -> new long[] {0, 0xFFFFL};
            case "int32array" -> new long[] {Integer.MIN_VALUE, Integer.MAX_VALUE};
            case "uint32array" -> new long[] {0, 0xFFFFFFFFL};
            default -> null;
        };
    }

    public static DType classify(String tag) {
        if (tag == null) {
            return OTHER;
        }
        String lower = tag.toLowerCase(Locale.ROOT);
        if (lower.contains("int")) {
            return INTEGER;
        }
        if (lower.contains("float")) {
            return FLOAT;
        }
        return OTHER;
    }
}
