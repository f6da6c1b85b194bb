package work.lcod.spatial.ref;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.spatial.files.ArrayDescriptor;
import work.lcod.spatial.mapping.MappingContinuous;
import work.lcod.spatial.validation.Reason;
import work.lcod.spatial.validation.ValidationException;

class RefTest {
    private static final String ARRAY_ID = "https://example.com/api/files/array/abc";
    private static final String MAPPING_ID = "https://example.com/api/mappings/continuous/xyz";

    @Test
    void unresolvedRequireIsMissing() {
        Ref<ArrayDescriptor> ref = Ref.to(ARRAY_ID);
        assertFalse(ref.isResolved());
        assertEquals(Optional.of(ARRAY_ID), ref.id());
        var error = assertThrows(ValidationException.class, () -> ref.require("vertices", null));
        assertEquals(Reason.MISSING, error.reason());
        assertEquals("vertices", error.field());
    }

    @Test
    void resolvedExposesValueAndUid() {
        var array = ArrayDescriptor.of(1, 2, 3);
        array.setUid("arr-1");
        Ref<ArrayDescriptor> ref = Ref.of(array);
        assertTrue(ref.isResolved());
        assertSame(array, ref.require("array", null));
        assertEquals(Optional.of("arr-1"), ref.id());
    }

    @Test
    void identifiersAreCheckedAgainstTheirNamedType() {
        assertDoesNotThrow(() -> Ref.to(ARRAY_ID).checkTarget("array", null, List.of(ArrayDescriptor.class)));
        assertDoesNotThrow(() -> Ref.to("opaque-id").checkTarget("array", null, List.of(ArrayDescriptor.class)));
        var error = assertThrows(
            ValidationException.class,
            () -> Ref.to(MAPPING_ID).checkTarget("array", null, List.of(ArrayDescriptor.class))
        );
        assertEquals(Reason.INVALID, error.reason());
    }

    @Test
    void resolvedValuesMustBeAllowed() {
        Ref<Object> ref = Ref.of(new MappingContinuous());
        assertThrows(
            ValidationException.class,
            () -> ref.checkTarget("array", null, List.of(ArrayDescriptor.class))
        );
    }

    @Test
    void blankIdentifiersAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> Ref.to(" "));
    }
}
