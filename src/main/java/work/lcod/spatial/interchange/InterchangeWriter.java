package work.lcod.spatial.interchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders exported elements as snake_case JSON.
 */
public final class InterchangeWriter {
    private static final ObjectMapper JSON = new ObjectMapper()
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .enable(SerializationFeature.INDENT_OUTPUT);

    private InterchangeWriter() {}

    public static String write(InterchangeElement element) {
        try {
            return JSON.writeValueAsString(element);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to render interchange element " + element.name(), ex);
        }
    }

    public static void write(InterchangeElement element, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, write(element));
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to write interchange output: " + target, ex);
        }
    }
}
