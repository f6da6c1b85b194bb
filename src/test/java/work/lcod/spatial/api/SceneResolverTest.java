package work.lcod.spatial.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.spatial.codec.ResourceCodec;
import work.lcod.spatial.files.DType;
import work.lcod.spatial.runtime.SpatialRegistry;

class SceneResolverTest {
    private static final Path ARRAYS = Path.of("src", "test", "resources", "scenes", "arrays");
    private final ResourceCodec codec = ResourceCodec.inline();

    @TempDir
    Path tempDir;

    @Test
    void inlinesSceneResourcesAndRecordsTheirIdentifier() {
        String id = "https://example.com/api/mappings/category/rocks";
        var resources = Map.of(id, json("{\"type\":\"mappings/category\",\"values\":[\"granite\"],\"indices\":[0]}"));
        var resolver = new SceneResolver(codec, SpatialRegistry.standard(), resources, Optional.empty());

        JsonNode resolved = resolver.resolve(json("{\"categories\":\"" + id + "\",\"name\":\"" + id + "\"}"));
        assertEquals(id, resolved.get("categories").get("uid").asText());
        assertEquals("granite", resolved.get("categories").get("values").get(0).asText());
        assertEquals(id, resolved.get("name").asText());
        assertEquals(1, resolver.resolvedCount());
    }

    @Test
    void selfReferencesStayUnresolved() {
        String id = "https://example.com/api/data/basic/loop";
        var resources = Map.of(id, json("{\"type\":\"data/basic\",\"array\":\"" + id + "\"}"));
        var resolver = new SceneResolver(codec, SpatialRegistry.standard(), resources, Optional.empty());

        JsonNode resolved = resolver.resolve(json("\"" + id + "\""));
        assertEquals(id, resolved.get("array").asText());
    }

    @Test
    void arrayIdentifiersReadCsvFiles() {
        var resolver = new SceneResolver(codec, SpatialRegistry.standard(), Map.of(), Optional.of(ARRAYS));

        JsonNode vertices = resolver.resolve(json("\"https://example.com/api/files/array/vertices\""));
        assertEquals(DType.INT32, vertices.get("dtype").asText());
        assertEquals(List.of(3, 3), List.of(vertices.get("shape").get(0).asInt(), vertices.get("shape").get(1).asInt()));

        JsonNode unknown = resolver.resolve(json("\"https://example.com/api/files/array/absent\""));
        assertTrue(unknown.isTextual());
        JsonNode notAnArray = resolver.resolve(json("\"https://example.com/api/data/basic/vertices\""));
        assertTrue(notAnArray.isTextual());
        assertEquals(1, resolver.resolvedCount());
    }

    @Test
    void csvColumnsDecideRankAndValuesDecideType() {
        var depth = SceneResolver.readCsv(ARRAYS.resolve("depth.csv"));
        assertEquals(DType.FLOAT64, depth.dtype());
        assertEquals(List.of(3), depth.shape());
        assertTrue(Double.isNaN(depth.values()[2]));

        var segments = SceneResolver.readCsv(ARRAYS.resolve("segments.csv"));
        assertEquals(DType.INT32, segments.dtype());
        assertArrayEquals(new int[] {1, 2}, segments.intRows()[1]);
    }

    @Test
    void raggedOrNonNumericCsvIsRejected() throws Exception {
        Path ragged = tempDir.resolve("ragged.csv");
        Files.writeString(ragged, "1,2\n3\n");
        assertThrows(IllegalArgumentException.class, () -> SceneResolver.readCsv(ragged));

        Path text = tempDir.resolve("text.csv");
        Files.writeString(text, "1\nabc\n");
        var error = assertThrows(IllegalArgumentException.class, () -> SceneResolver.readCsv(text));
        assertTrue(error.getMessage().contains("'abc'"));
    }

    private JsonNode json(String raw) {
        return codec.parse(raw);
    }
}
