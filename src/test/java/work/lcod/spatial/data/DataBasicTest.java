package work.lcod.spatial.data;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.spatial.files.ArrayDescriptor;
import work.lcod.spatial.mapping.Mapping;
import work.lcod.spatial.mapping.MappingCategory;
import work.lcod.spatial.ref.Ref;
import work.lcod.spatial.validation.Reason;
import work.lcod.spatial.validation.ValidationException;

class DataBasicTest {
    @Test
    void oneDimensionalArrayValidates() {
        var data = new DataBasic();
        data.setName("porosity");
        data.setArray(Ref.of(ArrayDescriptor.of(0.1, 0.2, Double.NaN)));
        data.setLocation(Location.NODES);
        assertTrue(data.validate());
    }

    @Test
    void twoDimensionalArraysAreRejected() {
        var data = new DataBasic();
        var error = assertThrows(
            ValidationException.class,
            () -> data.setArray(Ref.of(ArrayDescriptor.of(new double[][] {{1, 2}})))
        );
        assertEquals("array", error.field());
    }

    @Test
    void locationIsRequired() {
        var data = new DataBasic();
        data.setArray(Ref.to("https://example.com/api/files/array/1"));
        var error = assertThrows(ValidationException.class, data::validate);
        assertEquals(Reason.MISSING, error.reason());
        assertEquals("location", error.field());
    }

    @Test
    void categoryMappingsAreNotBasicMappings() {
        var data = new DataBasic();
        Ref<Mapping> category = Ref.of(new MappingCategory());
        assertThrows(ValidationException.class, () -> data.setMappings(List.of(category)));
    }

    @Test
    void locationSynonymsParse() {
        assertEquals(Location.NODES, Location.parse("vertices"));
        assertEquals(Location.CELLS, Location.parse("faces"));
        assertEquals(Location.CELLS, Location.parse("cells"));
        assertThrows(ValidationException.class, () -> Location.parse("edges"));
    }
}
