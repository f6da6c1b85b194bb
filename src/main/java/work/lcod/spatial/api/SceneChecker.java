package work.lcod.spatial.api;

import com.fasterxml.jackson.databind.JsonNode;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.spatial.codec.ResourceCodec;
import work.lcod.spatial.element.Element;
import work.lcod.spatial.interchange.InterchangeElement;
import work.lcod.spatial.interchange.InterchangeExporter;
import work.lcod.spatial.interchange.InterchangeWriter;
import work.lcod.spatial.runtime.ResourceRegistry;
import work.lcod.spatial.runtime.SpatialRegistry;
import work.lcod.spatial.validation.ValidationException;

/**
 * Public entry point: loads a scene, resolves what it can, validates the element graph and
 * optionally exports it.
 */
public final class SceneChecker {
    private static final Logger LOGGER = LoggerFactory.getLogger(SceneChecker.class);

    private final ResourceRegistry registry;
    private final ResourceCodec codec;

    public SceneChecker() {
        this(SpatialRegistry.standard());
    }

    public SceneChecker(ResourceRegistry registry) {
        this.registry = registry;
        this.codec = new ResourceCodec(registry, ResourceCodec.RefMode.INLINE);
    }

    public CheckResult check(CheckConfiguration configuration) {
        var started = Instant.now();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("scene", configuration.scene().toString());
        try {
            var document = SceneLoader.load(configuration.scene());
            Element element = load(document, configuration.arraysDirectory(), metadata);
            metadata.put("type", element.typeKey().toString());
            if (element.name() != null) {
                metadata.put("name", element.name());
            }
            metadata.put("numNodes", count(element.numNodes()));
            metadata.put("numCells", count(element.numCells()));

            element.validate();
            LOGGER.info("{} {} is valid", element.typeKey(), element.name() == null ? "" : element.name());

            if (configuration.exportTarget().isPresent()) {
                var target = configuration.exportTarget().get();
                InterchangeElement exported = InterchangeExporter.toInterchange(element);
                InterchangeWriter.write(exported, target);
                metadata.put("export", target.toString());
                LOGGER.info("exported {} to {}", exported.kind(), target);
            }
            if (configuration.snapshot()) {
                metadata.put("snapshot", new ResourceCodec(registry, ResourceCodec.RefMode.SNAPSHOT).writeString(element));
            }
            return CheckResult.valid(metadata, started);
        } catch (ValidationException ex) {
            LOGGER.info("{} failed on {}: {}", configuration.scene(), ex.field(), ex.getMessage());
            return CheckResult.invalid(ex, metadata, started);
        } catch (RuntimeException ex) {
            LOGGER.debug("{} could not be checked", configuration.scene(), ex);
            return CheckResult.error(ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage(), metadata, started);
        }
    }

    /**
     * Decodes the scene's element with every resolvable identifier inlined.
     */
    public Element load(SceneDocument document, Optional<Path> arraysDirectory) {
        return load(document, arraysDirectory, new LinkedHashMap<>());
    }

    private Element load(SceneDocument document, Optional<Path> arraysDirectory, Map<String, Object> metadata) {
        var resolver = new SceneResolver(codec, registry, document.resources(), arraysDirectory);
        JsonNode root = resolver.resolve(document.element());
        metadata.put("resolved", resolver.resolvedCount());
        LOGGER.debug("resolved {} identifiers", resolver.resolvedCount());
        if (root.isTextual()) {
            throw ValidationException.missing(
                "element",
                "Scene element '" + root.asText() + "' is not among the scene resources",
                null
            );
        }
        return codec.read(root, Element.class);
    }

    private static Object count(OptionalLong count) {
        return count.isPresent() ? count.getAsLong() : "unknown";
    }
}
