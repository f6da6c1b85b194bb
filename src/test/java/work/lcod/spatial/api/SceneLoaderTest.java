package work.lcod.spatial.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class SceneLoaderTest {
    @Test
    void loadsJsonSceneWithResources() {
        var document = SceneLoader.load(Path.of("src", "test", "resources", "scenes", "lines.json"));
        assertTrue(document.element().isTextual());
        assertEquals(2, document.resources().size());
        assertTrue(document.resources().containsKey("https://example.com/api/data/basic/depth"));
    }

    @Test
    void loadsYamlSceneWithInlineElement() {
        var document = SceneLoader.load(Path.of("src", "test", "resources", "scenes", "points-invalid.yaml"));
        assertEquals("elements/pointset", document.element().get("type").asText());
        assertTrue(document.resources().isEmpty());
    }

    @Test
    void rejectsDocumentsWithoutElement() {
        var in = new ByteArrayInputStream("resources: {}\n".getBytes(StandardCharsets.UTF_8));
        var error = assertThrows(IllegalArgumentException.class, () -> SceneLoader.parse(in, true));
        assertTrue(error.getMessage().contains("'element'"));

        var list = new ByteArrayInputStream("{\"element\": {}, \"resources\": []}".getBytes(StandardCharsets.UTF_8));
        assertThrows(IllegalArgumentException.class, () -> SceneLoader.parse(list, false));
    }
}
