package work.lcod.spatial.validation;

import java.util.Locale;

/**
 * Why a value was rejected.
 */
public enum Reason {
    INVALID,
    MISSING;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
