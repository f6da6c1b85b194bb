package work.lcod.spatial.shared;

import work.lcod.spatial.validation.ValidationException;

/**
 * Length-capped strings. Oversized values are reported elided as {@code first5...last5}.
 */
public final class ShortString {
    public static final int NAME_MAX = 300;
    public static final int DESCRIPTION_MAX = 5000;
    public static final int LABEL_MAX = 300;

    private ShortString() {}

    public static String check(String field, String value, int maxLength, Object owner) {
        if (value != null && value.length() > maxLength) {
            throw ValidationException.invalid(
                field,
                "The '" + field + "' property must be a string of less than " + maxLength + " characters, not '"
                    + elide(value) + "' (Length is " + value.length() + ")",
                owner
            );
        }
        return value;
    }

    static String elide(String value) {
        if (value.length() < 14) {
            return value;
        }
        return value.substring(0, 5) + "..." + value.substring(value.length() - 5);
    }
}
