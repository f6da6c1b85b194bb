package work.lcod.spatial.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.spatial.codec.ResourceCodec;
import work.lcod.spatial.files.ArrayDescriptor;
import work.lcod.spatial.files.DType;
import work.lcod.spatial.runtime.ResourceRegistry;

/**
 * Inlines identifiers found in a serialized scene.
 *
 * <p>An identifier resolves to the scene resource registered under it, or, when it names a
 * {@code files/array}, to the CSV file {@code <last segment>.csv} in the arrays directory.
 * Identifiers that resolve to nothing are left in place and stay unresolved references.
 */
public final class SceneResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(SceneResolver.class);
    private static final Set<String> SCALAR_FIELDS = Set.of(
        "type", "uid", "name", "description", "location", "dtype", "content_type", "shape", "value", "values", "back"
    );

    private final ResourceCodec codec;
    private final ResourceRegistry registry;
    private final Map<String, JsonNode> resources;
    private final Optional<Path> arraysDirectory;
    private int resolved;

    public SceneResolver(
        ResourceCodec codec,
        ResourceRegistry registry,
        Map<String, JsonNode> resources,
        Optional<Path> arraysDirectory
    ) {
        this.codec = codec;
        this.registry = registry;
        this.resources = resources;
        this.arraysDirectory = arraysDirectory;
    }

    /**
     * @return a copy of {@code node} with every resolvable identifier replaced by its resource
     */
    public JsonNode resolve(JsonNode node) {
        return resolve(node, new HashSet<>());
    }

    /**
     * @return number of identifiers inlined so far
     */
    public int resolvedCount() {
        return resolved;
    }

    private JsonNode resolve(JsonNode node, Set<String> expanding) {
        if (node == null) {
            return null;
        }
        if (node.isTextual()) {
            return lookup(node.asText(), expanding).orElse(node);
        }
        if (node.isArray()) {
            ArrayNode copy = codec.mapper().createArrayNode();
            for (JsonNode entry : node) {
                copy.add(resolve(entry, expanding));
            }
            return copy;
        }
        if (node.isObject()) {
            ObjectNode copy = codec.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                var field = fields.next();
                JsonNode value = SCALAR_FIELDS.contains(field.getKey())
                    ? field.getValue()
                    : resolve(field.getValue(), expanding);
                copy.set(field.getKey(), value);
            }
            return copy;
        }
        return node;
    }

    private Optional<JsonNode> lookup(String id, Set<String> expanding) {
        if (expanding.contains(id)) {
            LOGGER.debug("identifier {} refers back to itself; leaving it unresolved", id);
            return Optional.empty();
        }
        JsonNode resource = resources.get(id);
        if (resource != null) {
            expanding.add(id);
            try {
                JsonNode expanded = resolve(resource, expanding);
                if (expanded.isObject() && !expanded.has("uid")) {
                    ((ObjectNode) expanded).put("uid", id);
                }
                resolved++;
                return Optional.of(expanded);
            } finally {
                expanding.remove(id);
            }
        }
        return csvArray(id).map(array -> {
            resolved++;
            return codec.write(array);
        });
    }

    private Optional<ArrayDescriptor> csvArray(String id) {
        if (arraysDirectory.isEmpty()) {
            return Optional.empty();
        }
        boolean namesArray = registry.identify(id).filter(ArrayDescriptor.TYPE::equals).isPresent();
        if (!namesArray) {
            return Optional.empty();
        }
        Path file = arraysDirectory.get().resolve(lastSegment(id) + ".csv");
        if (!Files.isRegularFile(file)) {
            LOGGER.debug("no CSV file for {} at {}", id, file);
            return Optional.empty();
        }
        ArrayDescriptor array = readCsv(file);
        array.setUid(id);
        return Optional.of(array);
    }

    /**
     * One row per entry; a single column gives a 1D array, several columns a 2D array. Files of
     * integers within the int range become {@code Int32Array}, anything else {@code Float64Array}.
     */
    static ArrayDescriptor readCsv(Path file) {
        CSVFormat format = CSVFormat.DEFAULT
            .withCommentMarker('#')
            .withIgnoreEmptyLines()
            .withTrim();
        List<double[]> rows = new ArrayList<>();
        boolean integral = true;
        try (Reader reader = Files.newBufferedReader(file); CSVParser parser = new CSVParser(reader, format)) {
            for (CSVRecord record : parser) {
                double[] row = new double[record.size()];
                for (int i = 0; i < row.length; i++) {
                    row[i] = parseNumber(record.get(i), file, record.getRecordNumber());
                    integral &= row[i] == Math.rint(row[i])
                        && row[i] >= Integer.MIN_VALUE && row[i] <= Integer.MAX_VALUE;
                }
                rows.add(row);
            }
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read array file: " + file, ex);
        }
        int columns = rows.isEmpty() ? 1 : rows.get(0).length;
        double[] flat = new double[rows.size() * columns];
        for (int i = 0; i < rows.size(); i++) {
            double[] row = rows.get(i);
            if (row.length != columns) {
                throw new IllegalArgumentException(
                    file + ": row " + (i + 1) + " has " + row.length + " columns, expected " + columns
                );
            }
            System.arraycopy(row, 0, flat, i * columns, columns);
        }
        String dtype = integral && !rows.isEmpty() ? DType.INT32 : DType.FLOAT64;
        List<Integer> shape = columns == 1 ? List.of(rows.size()) : List.of(rows.size(), columns);
        return new ArrayDescriptor(dtype, shape, flat, null);
    }

    private static double parseNumber(String raw, Path file, long line) {
        if (raw.isEmpty() || raw.equalsIgnoreCase("nan")) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(file + ": line " + line + " holds a non-numeric value '" + raw + "'", ex);
        }
    }

    private static String lastSegment(String id) {
        String path = id;
        int cut = path.indexOf('?');
        if (cut >= 0) {
            path = path.substring(0, cut);
        }
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
