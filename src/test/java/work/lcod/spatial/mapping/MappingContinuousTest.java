package work.lcod.spatial.mapping;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.spatial.files.ArrayDescriptor;
import work.lcod.spatial.ref.Ref;
import work.lcod.spatial.validation.Reason;
import work.lcod.spatial.validation.ValidationException;

class MappingContinuousTest {
    static MappingContinuous valid() {
        var mapping = new MappingContinuous();
        mapping.setGradient(Ref.of(ArrayDescriptor.of(new double[][] {{0, 0, 0}, {1, 1, 1}})));
        mapping.setDataControls(List.of(0.0, 1.0, 2.0, 3.0));
        return mapping;
    }

    @Test
    void defaultControlsValidate() {
        var mapping = valid();
        assertEquals(List.of(0.0, 0.0, 1.0, 1.0), mapping.gradientControls());
        assertEquals(List.of(false, true, true, true, false), mapping.visibility());
        assertTrue(mapping.validate());
        assertEquals(5, mapping.bucketCount());
    }

    @Test
    void decreasingDataControlsAreRejected() {
        var mapping = new MappingContinuous();
        var error = assertThrows(
            ValidationException.class,
            () -> mapping.setDataControls(List.of(3.0, 2.0, 1.0, 0.0))
        );
        assertEquals(Reason.INVALID, error.reason());
        assertEquals("data_controls", error.field());
    }

    @Test
    void gradientControlsStayInUnitRange() {
        assertThrows(ValidationException.class, () -> valid().setGradientControls(List.of(0.0, 1.5)));
    }

    @Test
    void controlLengthsMustAgree() {
        var mapping = valid();
        mapping.setGradientControls(List.of(0.0, 1.0));
        var error = assertThrows(ValidationException.class, mapping::validate);
        assertEquals("data_controls", error.field());

        var shortVisibility = valid();
        shortVisibility.setVisibility(List.of(true, true, true, true));
        assertThrows(ValidationException.class, shortVisibility::validate);
    }

    @Test
    void gradientMustHaveThreeColumns() {
        var mapping = new MappingContinuous();
        assertThrows(
            ValidationException.class,
            () -> mapping.setGradient(Ref.of(ArrayDescriptor.of(new double[][] {{0, 0}, {1, 1}})))
        );
    }

    @Test
    void unresolvedGradientStillValidates() {
        var mapping = new MappingContinuous();
        mapping.setGradient(Ref.to("https://example.com/api/files/array/gradient"));
        mapping.setDataControls(List.of(0.0, 1.0, 2.0, 3.0));
        assertTrue(mapping.validate());
    }
}
