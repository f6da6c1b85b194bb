package work.lcod.spatial.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class SpatialCheckCommandTest {
    private static final Path SCENES = Path.of("src", "test", "resources", "scenes");

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void listsRegisteredTypes() {
        int code = run("--list-types");
        assertEquals(0, code);
        String[] lines = out.toString().strip().split("\\R");
        assertEquals(13, lines.length);
        assertTrue(lines[0].startsWith("data/basic\t"));
        assertTrue(out.toString().contains("elements/volumegrid\t"));
    }

    @Test
    void checksSceneUsingDiscoveredSettings() {
        int code = run("--scene", SCENES.resolve("lines.json").toString(), "--log-level", "error");
        assertEquals(0, code, out.toString());
        assertTrue(out.toString().contains("\"status\" : \"valid\""));
        assertTrue(out.toString().contains("\"numNodes\" : 3"));
    }

    @Test
    void exportsWhenAsked() {
        Path target = tempDir.resolve("collars.json");
        int code = run("-s", SCENES.resolve("lines.json").toString(), "-e", target.toString(), "--snapshot");
        assertEquals(0, code, out.toString());
        assertTrue(Files.exists(target));
        assertTrue(out.toString().contains("\"snapshot\""));
    }

    @Test
    void invalidSceneExitsWithOne() {
        int code = run("-s", SCENES.resolve("points-invalid.yaml").toString());
        assertEquals(1, code);
        assertTrue(out.toString().contains("\"reason\" : \"invalid\""));
    }

    @Test
    void missingSceneIsAUsageError() {
        assertEquals(CommandLine.ExitCode.USAGE, run());
        assertTrue(err.toString().contains("--scene"));

        assertEquals(CommandLine.ExitCode.USAGE, run("-s", tempDir.resolve("absent.json").toString()));
        assertTrue(err.toString().contains("Scene file not found"));
    }

    @Test
    void explicitConfigMustExist() {
        int code = run("-s", SCENES.resolve("lines.json").toString(), "-c", tempDir.resolve("none.toml").toString());
        assertEquals(CommandLine.ExitCode.USAGE, code);
        assertTrue(err.toString().contains("Config file not found"));
    }

    @Test
    void unknownLogLevelIsReportedShortly() {
        int code = run("-s", SCENES.resolve("lines.json").toString(), "--log-level", "loud");
        assertEquals(CommandLine.ExitCode.SOFTWARE, code);
        assertTrue(err.toString().contains("Unsupported log level: loud"));
    }

    private int run(String... args) {
        CommandLine commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }
}
