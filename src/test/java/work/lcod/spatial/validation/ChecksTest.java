package work.lcod.spatial.validation;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChecksTest {
    @Test
    void requiredRaisesMissing() {
        var error = assertThrows(ValidationException.class, () -> Checks.required("location", null, this));
        assertEquals(Reason.MISSING, error.reason());
        assertEquals("location", error.field());
        assertEquals("missing", error.reason().wireName());
    }

    @Test
    void rangeChecksRejectNaN() {
        assertThrows(ValidationException.class, () -> Checks.inRange("value", Double.NaN, 0, 1, this));
        assertThrows(ValidationException.class, () -> Checks.atLeast("value", -0.1, 0, this));
        assertDoesNotThrow(() -> Checks.inRange("value", 1.0, 0, 1, this));
    }

    @Test
    void nonDecreasingAllowsTies() {
        assertDoesNotThrow(() -> Checks.nonDecreasing("end_points", List.of(0.0, 1.0, 1.0, 2.0), "end points", this));
        var error = assertThrows(
            ValidationException.class,
            () -> Checks.nonDecreasing("end_points", List.of(3.0, 2.0), "end points", this)
        );
        assertEquals(Reason.INVALID, error.reason());
    }

    @Test
    void noNullsAndUnique() {
        assertThrows(ValidationException.class, () -> Checks.noNulls("data", Arrays.asList(1, null), this));
        assertThrows(ValidationException.class, () -> Checks.unique("indices", List.of(0, 1, 1), this));
        assertDoesNotThrow(() -> Checks.unique("indices", List.of(0, 1, 2), this));
    }
}
