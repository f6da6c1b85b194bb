package work.lcod.spatial.options;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.lcod.spatial.ref.Ref;
import work.lcod.spatial.shared.Color;
import work.lcod.spatial.validation.Reason;
import work.lcod.spatial.validation.ValidationException;

class ChannelOptionsTest {
    private static final String DATA_ID = "https://example.com/api/data/basic/porosity";
    private static final String MAPPING_ID = "https://example.com/api/mappings/continuous/ramp";

    @Test
    void staticValueValidates() {
        assertTrue(new OpacityOptions(0.5).validate());
        assertTrue(new ColorOptions(Color.parse("teal")).validate());
    }

    @Test
    void dataWithoutMappingIsMissingMapping() {
        var opacity = new OpacityOptions();
        opacity.setData(Ref.to(DATA_ID));
        var error = assertThrows(ValidationException.class, opacity::validate);
        assertEquals(Reason.MISSING, error.reason());
        assertEquals("mapping", error.field());
    }

    @Test
    void noDataAndNoValueIsMissingValue() {
        var error = assertThrows(ValidationException.class, () -> new ColorOptions().validate());
        assertEquals(Reason.MISSING, error.reason());
        assertEquals("value", error.field());
    }

    @Test
    void dataWithMappingNeedsNoValue() {
        var color = new ColorOptions();
        color.setData(Ref.to(DATA_ID));
        color.setMapping(Ref.to(MAPPING_ID));
        assertTrue(color.validate());
    }

    @Test
    void valuesAreRangeChecked() {
        assertThrows(ValidationException.class, () -> new OpacityOptions(1.5));
        assertThrows(ValidationException.class, () -> new SizeOptions(-1.0));
        assertEquals(SizeOptions.DEFAULT_SIZE, new SizeOptions().value());
    }

    @Test
    void mappingIdentifiersMustNameMappings() {
        var color = new ColorOptions();
        assertThrows(ValidationException.class, () -> color.setMapping(Ref.to(DATA_ID)));
        assertThrows(ValidationException.class, () -> color.setData(Ref.to(MAPPING_ID)));
    }
}
