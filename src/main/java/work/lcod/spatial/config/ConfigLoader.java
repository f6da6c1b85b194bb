package work.lcod.spatial.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.spatial.api.LogLevel;

/**
 * Reads the {@code [check]} table of a {@code spatial.toml} file:
 *
 * <pre>
 * [check]
 * arrays = "arrays"
 * export = "out/element.json"
 * snapshot = false
 * log_level = "info"
 * </pre>
 */
public final class ConfigLoader {
    public static final String FILE_NAME = "spatial.toml";

    private ConfigLoader() {}

    /**
     * @return the settings, or empty when the file does not exist
     * @throws IllegalStateException when the file cannot be read or parsed
     */
    public static Optional<SpatialSettings> load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            TomlParseResult result = Toml.parse(Files.readString(path));
            if (result.hasErrors()) {
                throw new IllegalStateException("Invalid " + path + ": " + result.errors().get(0).toString());
            }
            Path base = path.toAbsolutePath().getParent();
            return Optional.of(fromToml(result, base));
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read " + path, ex);
        }
    }

    /**
     * Looks for {@value #FILE_NAME} next to a scene file.
     */
    public static Optional<SpatialSettings> discover(Path scene) {
        Path parent = scene.toAbsolutePath().getParent();
        return parent == null ? Optional.empty() : load(parent.resolve(FILE_NAME));
    }

    public static SpatialSettings fromToml(TomlParseResult result, Path base) {
        TomlTable check = result.getTable("check");
        if (check == null || check.isEmpty()) {
            return SpatialSettings.empty();
        }
        return new SpatialSettings(
            Optional.ofNullable(check.getString("arrays")).map(raw -> resolve(base, raw)),
            Optional.ofNullable(check.getString("export")).map(raw -> resolve(base, raw)),
            Optional.ofNullable(check.getBoolean("snapshot")),
            Optional.ofNullable(check.getString("log_level")).map(LogLevel::from)
        );
    }

    private static Path resolve(Path base, String raw) {
        Path path = Path.of(raw);
        return base == null || path.isAbsolute() ? path : base.resolve(path).normalize();
    }
}
