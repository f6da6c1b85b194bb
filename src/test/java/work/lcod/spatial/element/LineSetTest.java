package work.lcod.spatial.element;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;
import work.lcod.spatial.data.Attachment;
import work.lcod.spatial.files.ArrayDescriptor;
import work.lcod.spatial.options.TubesOptions;
import work.lcod.spatial.ref.Ref;
import work.lcod.spatial.validation.Reason;
import work.lcod.spatial.validation.ValidationException;

class LineSetTest {
    static LineSet lineSet(long[][] segments) {
        var lines = new LineSet();
        lines.setVertices(Ref.of(ArrayDescriptor.of(new double[][] {{0, 0, 0}, {1, 0, 0}, {2, 0, 0}})));
        lines.setSegments(Ref.of(ArrayDescriptor.ofIntegers(segments)));
        return lines;
    }

    @Test
    void segmentsWithinBoundsValidate() {
        var lines = lineSet(new long[][] {{0, 1}, {1, 2}});
        assertTrue(lines.validate());
        assertEquals(OptionalLong.of(3), lines.numNodes());
        assertEquals(OptionalLong.of(2), lines.numCells());
    }

    @Test
    void segmentIndexOutsideVerticesFails() {
        var lines = lineSet(new long[][] {{0, 3}});
        var error = assertThrows(ValidationException.class, lines::validate);
        assertEquals(Reason.INVALID, error.reason());
        assertEquals("segments", error.field());
        assertEquals("Segment index 3 is outside bounds for 3 vertices", error.getMessage());
    }

    @Test
    void segmentsMustBeIntegerPairs() {
        var lines = new LineSet();
        assertThrows(
            ValidationException.class,
            () -> lines.setSegments(Ref.of(ArrayDescriptor.ofIntegers(new long[][] {{0, 1, 2}})))
        );
        assertThrows(
            ValidationException.class,
            () -> lines.setSegments(Ref.of(ArrayDescriptor.of(new double[][] {{0, 1}})))
        );
        var error = assertThrows(
            ValidationException.class,
            () -> lines.setSegments(Ref.of(ArrayDescriptor.ofIntegers(new long[][] {{0, -1}})))
        );
        assertEquals("Segments may only have non-negative integers", error.getMessage());
    }

    @Test
    void boundsAreSkippedWhileVerticesAreUnresolved() {
        var lines = new LineSet();
        lines.setVertices(Ref.to("https://example.com/api/files/array/vertices"));
        lines.setSegments(Ref.of(ArrayDescriptor.ofIntegers(new long[][] {{0, 30}})));
        assertTrue(lines.validate());
    }

    @Test
    void texturesCannotAttachToLines() {
        var lines = lineSet(new long[][] {{0, 1}});
        assertThrows(
            ValidationException.class,
            () -> lines.setData(List.of(Ref.<Attachment>to("https://example.com/api/textures/projection/1")))
        );
    }

    @Test
    void tubesAreAcceptedAsDefaults() {
        var lines = lineSet(new long[][] {{0, 1}});
        lines.setDefaults(TubesOptions.defaults());
        assertTrue(lines.validate());
    }
}
