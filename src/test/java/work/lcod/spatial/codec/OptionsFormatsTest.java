package work.lcod.spatial.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.spatial.options.BlockModelOptions;
import work.lcod.spatial.options.LinesOptions;
import work.lcod.spatial.options.PointShape;
import work.lcod.spatial.options.TubesOptions;
import work.lcod.spatial.options.VolumeSlicesOptions;
import work.lcod.spatial.shared.Color;
import work.lcod.spatial.validation.ValidationException;

class OptionsFormatsTest {
    private final ResourceCodec codec = ResourceCodec.inline();

    @Test
    void radiusSelectsTubes() {
        var tubes = OptionsFormats.readLineSet(codec.parse("{\"radius\": {\"value\": 2.5}}"), codec);
        assertInstanceOf(TubesOptions.class, tubes);
        assertEquals(2.5, ((TubesOptions) tubes).radius().value());

        var lines = OptionsFormats.readLineSet(codec.parse("{\"visible\": false}"), codec);
        assertInstanceOf(LinesOptions.class, lines);
        assertEquals(false, lines.visible());
    }

    @Test
    void slicesSelectVolumeSlices() {
        var slices = OptionsFormats.readVolume(codec.parse("{\"slices_w\": [0.1, 0.9]}"), codec);
        assertInstanceOf(VolumeSlicesOptions.class, slices);
        assertEquals(List.of(0.1, 0.9), ((VolumeSlicesOptions) slices).slicesW());
        assertEquals(List.of(0.5), ((VolumeSlicesOptions) slices).slicesU());

        var blocks = OptionsFormats.readVolume(codec.parse("{\"wireframe\": {\"active\": true}}"), codec);
        assertInstanceOf(BlockModelOptions.class, blocks);
        assertTrue(((BlockModelOptions) blocks).wireframe().active());
    }

    @Test
    void partialOptionsKeepTheirDefaults() {
        var points = OptionsFormats.readPoints(
            codec.parse("{\"color\": {\"value\": \"orange\"}, \"shape\": \"sphere\"}"),
            codec
        );
        assertEquals(Color.parse("orange"), points.color().value());
        assertEquals(1.0, points.opacity().value());
        assertEquals(PointShape.SPHERE, points.shape());
        assertTrue(points.validate());
    }

    @Test
    void dataDrivenColorClearsTheValue() {
        var surface = OptionsFormats.readSurface(codec.parse("{\"color\": {\"value\": null,"
            + " \"data\": \"https://example.com/api/data/basic/1\","
            + " \"mapping\": \"https://example.com/api/mappings/continuous/2\"}}"), codec);
        assertNull(surface.color().value());
        assertEquals("https://example.com/api/data/basic/1", surface.color().data().id().orElseThrow());
        assertTrue(surface.validate());
    }

    @Test
    void outOfRangeValuesFailWhileReading() {
        var error = assertThrows(
            ValidationException.class,
            () -> OptionsFormats.readPoints(codec.parse("{\"opacity\": {\"value\": 2}}"), codec)
        );
        assertEquals("value", error.field());
    }
}
