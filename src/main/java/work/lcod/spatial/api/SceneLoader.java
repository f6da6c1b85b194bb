package work.lcod.spatial.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Loads scene documents from JSON or YAML files.
 */
public final class SceneLoader {
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private SceneLoader() {}

    public static SceneDocument load(Path path) {
        try (var in = Files.newInputStream(path)) {
            return parse(in, isYaml(path));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read scene: " + path, ex);
        }
    }

    public static SceneDocument parse(InputStream in, boolean yaml) throws IOException {
        JsonNode root = (yaml ? YAML_MAPPER : JSON_MAPPER).readTree(in);
        return fromTree(root);
    }

    public static SceneDocument fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Scene document must be an object with an 'element' entry");
        }
        JsonNode element = root.get("element");
        if (element == null || element.isNull()) {
            throw new IllegalArgumentException("Scene document has no 'element' entry");
        }
        Map<String, JsonNode> resources = new LinkedHashMap<>();
        JsonNode raw = root.get("resources");
        if (raw != null && !raw.isNull()) {
            if (!raw.isObject()) {
                throw new IllegalArgumentException("Scene 'resources' must map identifiers to resources");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = raw.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                resources.put(entry.getKey(), entry.getValue());
            }
        }
        return new SceneDocument(element, resources);
    }

    private static boolean isYaml(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }
}
