package work.lcod.spatial.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.spatial.api.CheckConfiguration;
import work.lcod.spatial.api.LogLevel;

class ConfigLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void discoversSettingsNextToScene() {
        var scenes = Path.of("src", "test", "resources", "scenes").toAbsolutePath();
        var settings = ConfigLoader.discover(scenes.resolve("lines.json")).orElseThrow();
        assertEquals(Optional.of(scenes.resolve("arrays").normalize()), settings.arraysDirectory());
        assertEquals(Optional.of(LogLevel.WARN), settings.logLevel());
        assertTrue(settings.exportTarget().isEmpty());
        assertTrue(settings.snapshot().isEmpty());
    }

    @Test
    void resolvesRelativePathsAgainstTheFile() throws Exception {
        Path file = tempDir.resolve(ConfigLoader.FILE_NAME);
        Files.writeString(file, "[check]\n"
            + "export = \"out/element.json\"\n"
            + "arrays = \"/data/arrays\"\n"
            + "snapshot = true\n"
            + "log_level = \"debug\"\n");

        var settings = ConfigLoader.load(file).orElseThrow();
        assertEquals(tempDir.toAbsolutePath().resolve("out/element.json"), settings.exportTarget().orElseThrow());
        assertEquals(Path.of("/data/arrays"), settings.arraysDirectory().orElseThrow());

        var config = settings.applyTo(CheckConfiguration.builder().scene(tempDir.resolve("scene.json")))
            .snapshot(false)
            .build();
        assertEquals(LogLevel.DEBUG, config.logLevel());
        assertEquals(false, config.snapshot());
        assertEquals(settings.exportTarget(), config.exportTarget());
    }

    @Test
    void absentFileOrTableGivesNoSettings() throws Exception {
        assertTrue(ConfigLoader.load(tempDir.resolve("missing.toml")).isEmpty());
        assertTrue(ConfigLoader.discover(tempDir.resolve("scene.json")).isEmpty());

        Path file = tempDir.resolve(ConfigLoader.FILE_NAME);
        Files.writeString(file, "[other]\nkey = 1\n");
        assertEquals(SpatialSettings.empty(), ConfigLoader.load(file).orElseThrow());
    }

    @Test
    void rejectsMalformedToml() throws Exception {
        Path file = tempDir.resolve(ConfigLoader.FILE_NAME);
        Files.writeString(file, "[check\narrays = \n");
        var error = assertThrows(IllegalStateException.class, () -> ConfigLoader.load(file));
        assertTrue(error.getMessage().startsWith("Invalid "));
    }

    @Test
    void rejectsUnknownLogLevel() throws Exception {
        Path file = tempDir.resolve(ConfigLoader.FILE_NAME);
        Files.writeString(file, "[check]\nlog_level = \"loud\"\n");
        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(file));
    }
}
