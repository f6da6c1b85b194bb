package work.lcod.spatial.element;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;
import work.lcod.spatial.data.Attachment;
import work.lcod.spatial.data.DataBasic;
import work.lcod.spatial.data.Location;
import work.lcod.spatial.files.ArrayDescriptor;
import work.lcod.spatial.files.DType;
import work.lcod.spatial.ref.Ref;
import work.lcod.spatial.validation.Reason;
import work.lcod.spatial.validation.ValidationException;

class PointSetTest {
    static PointSet twoPoints() {
        var points = new PointSet();
        points.setName("collars");
        points.setVertices(Ref.of(ArrayDescriptor.of(new double[][] {{0, 0, 0}, {1, 1, 1}})));
        return points;
    }

    static DataBasic nodeData(double... values) {
        var data = new DataBasic();
        data.setName("grade");
        data.setArray(Ref.of(ArrayDescriptor.of(values)));
        data.setLocation(Location.NODES);
        return data;
    }

    @Test
    void countsFollowVertices() {
        var points = twoPoints();
        assertEquals(OptionalLong.of(2), points.numNodes());
        assertEquals(OptionalLong.of(2), points.numCells());
        assertTrue(points.validate());
    }

    @Test
    void countsAreUnknownUntilVerticesResolve() {
        var points = new PointSet();
        assertEquals(OptionalLong.empty(), points.numNodes());
        points.setVertices(Ref.to("https://example.com/api/files/array/vertices"));
        assertEquals(OptionalLong.empty(), points.numCells());
        assertTrue(points.validate());

        points.setVertices(Ref.of(ArrayDescriptor.describe(DType.FLOAT64, 7, 3)));
        assertEquals(OptionalLong.of(7), points.numNodes());
    }

    @Test
    void verticesMustBeNx3() {
        var points = new PointSet();
        var error = assertThrows(
            ValidationException.class,
            () -> points.setVertices(Ref.of(ArrayDescriptor.of(new double[][] {{0, 0}, {1, 1}})))
        );
        assertEquals("vertices", error.field());
    }

    @Test
    void verticesAreRequired() {
        var error = assertThrows(ValidationException.class, () -> new PointSet().validate());
        assertEquals(Reason.MISSING, error.reason());
        assertEquals("vertices", error.field());
    }

    @Test
    void dataLengthMustMatchNodes() {
        var points = twoPoints();
        points.setData(List.of(Ref.<Attachment>of(nodeData(1, 2, 3))));
        var error = assertThrows(ValidationException.class, points::validate);
        assertEquals(Reason.INVALID, error.reason());
        assertEquals("data[0]", error.field());
        assertEquals("data grade length 3 does not match nodes length 2", error.getMessage());
    }

    @Test
    void resolvingToConsistentDataKeepsTheElementValid() {
        var points = twoPoints();
        points.setData(List.of(Ref.<Attachment>to("https://example.com/api/data/basic/grade")));
        assertTrue(points.validate());

        points.setData(List.of(Ref.<Attachment>of(nodeData(1, 2))));
        assertTrue(points.validate());
        assertTrue(points.validate());
    }
}
