package work.lcod.spatial.element;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;
import work.lcod.spatial.data.Attachment;
import work.lcod.spatial.data.DataBasic;
import work.lcod.spatial.data.Location;
import work.lcod.spatial.files.ArrayDescriptor;
import work.lcod.spatial.options.VolumeSlicesOptions;
import work.lcod.spatial.ref.Ref;
import work.lcod.spatial.shared.Vector3;
import work.lcod.spatial.validation.ValidationException;

class VolumeGridTest {
    static VolumeGrid unitCube() {
        var grid = new VolumeGrid();
        grid.setTensorU(List.of(1.0));
        grid.setTensorV(List.of(1.0));
        grid.setTensorW(List.of(1.0));
        return grid;
    }

    @Test
    void unitCubeCounts() {
        var grid = unitCube();
        assertEquals(OptionalLong.of(8), grid.numNodes());
        assertEquals(OptionalLong.of(1), grid.numCells());
        assertEquals(Vector3.named("up"), grid.axisW());
        assertTrue(grid.validate());
    }

    @Test
    void cellDataMatchesCells() {
        var grid = unitCube();
        var data = new DataBasic();
        data.setArray(Ref.of(ArrayDescriptor.of(0.25)));
        data.setLocation(Location.CELLS);
        grid.setData(List.of(Ref.<Attachment>of(data)));
        assertTrue(grid.validate());

        data.setArray(Ref.of(ArrayDescriptor.of(0.25, 0.5)));
        var error = assertThrows(ValidationException.class, grid::validate);
        assertEquals("data[0]", error.field());
    }

    @Test
    void tensorsAreCapped() {
        var grid = new VolumeGrid();
        var widths = Collections.nCopies(VolumeGrid.MAX_TENSOR + 1, 1.0);
        assertThrows(ValidationException.class, () -> grid.setTensorW(widths));
    }

    @Test
    void largestGridCountsBeyondIntRange() {
        var grid = new VolumeGrid();
        var widths = Collections.nCopies(VolumeGrid.MAX_TENSOR, 1.0);
        grid.setTensorU(widths);
        grid.setTensorV(widths);
        grid.setTensorW(widths);
        assertEquals(OptionalLong.of(2001L * 2001L * 2001L), grid.numNodes());
        assertEquals(OptionalLong.of(2000L * 2000L * 2000L), grid.numCells());
        assertTrue(grid.validate());

        var data = new DataBasic();
        data.setName("density");
        data.setArray(Ref.of(ArrayDescriptor.of(2.7)));
        data.setLocation(Location.CELLS);
        grid.setData(List.of(Ref.<Attachment>of(data)));
        var error = assertThrows(ValidationException.class, grid::validate);
        assertEquals("data density length 1 does not match cells length 8000000000", error.getMessage());
    }

    @Test
    void slicesAreAcceptedAsDefaults() {
        var grid = unitCube();
        grid.setDefaults(VolumeSlicesOptions.defaults());
        assertTrue(grid.validate());
    }
}
