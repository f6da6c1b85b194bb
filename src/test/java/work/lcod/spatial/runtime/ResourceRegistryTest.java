package work.lcod.spatial.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import work.lcod.spatial.data.DataCategory;
import work.lcod.spatial.element.SurfaceGrid;
import work.lcod.spatial.files.ArrayDescriptor;
import work.lcod.spatial.mapping.MappingContinuous;

class ResourceRegistryTest {
    @Test
    void standardRegistryHoldsEveryType() {
        var keys = SpatialRegistry.standard().entries().stream()
            .map(type -> type.key().toString())
            .collect(Collectors.toSet());
        assertEquals(Set.of(
            "files/array", "files/image",
            "data/basic", "data/category", "textures/projection",
            "mappings/continuous", "mappings/discrete", "mappings/category",
            "elements/pointset", "elements/lineset", "elements/surface",
            "elements/surfacegrid", "elements/volumegrid"
        ), keys);
    }

    @Test
    void keysAndClassesLookUpBothWays() {
        var registry = SpatialRegistry.standard();
        assertEquals(Optional.of(SurfaceGrid.TYPE), registry.keyFor(SurfaceGrid.class));
        assertEquals(DataCategory.class, registry.find(DataCategory.TYPE).orElseThrow().type());
        assertTrue(registry.find(MappingContinuous.class).isPresent());
    }

    @Test
    void identifiesTypesFromPathSegments() {
        var registry = SpatialRegistry.standard();
        assertEquals(
            Optional.of(ArrayDescriptor.TYPE),
            registry.identify("https://example.com/api/v1/files/array/abc?token=1")
        );
        assertEquals(Optional.of(MappingContinuous.TYPE), registry.identify("mappings/continuous/42"));
        assertEquals(Optional.empty(), registry.identify("https://example.com/files/unknown/abc"));
    }

    @Test
    void frozenRegistryRejectsRegistration() {
        var registry = SpatialRegistry.standard();
        assertTrue(registry.isFrozen());
        var type = registry.find(ArrayDescriptor.TYPE).orElseThrow();
        assertThrows(IllegalStateException.class, () -> registry.register(type));
    }

    @Test
    void duplicateKeysAreRejected() {
        var registry = SpatialRegistry.create();
        var type = registry.find(ArrayDescriptor.class).orElseThrow();
        assertThrows(IllegalStateException.class, () -> registry.register(type));
    }

    @Test
    void typeKeysParseTheWireForm() {
        assertEquals(new TypeKey("elements", "pointset"), TypeKey.parse("elements/pointset"));
        assertThrows(IllegalArgumentException.class, () -> TypeKey.parse("elements"));
        assertThrows(IllegalArgumentException.class, () -> TypeKey.parse("a/b/c"));
    }
}
