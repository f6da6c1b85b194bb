package work.lcod.spatial.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SceneCheckerTest {
    private static final Path SCENES = Path.of("src", "test", "resources", "scenes").toAbsolutePath();

    @TempDir
    Path tempDir;

    @Test
    void validatesSceneResolvedFromResourcesAndCsv() {
        var config = CheckConfiguration.builder()
            .scene(SCENES.resolve("lines.json"))
            .arraysDirectory(SCENES.resolve("arrays"))
            .logLevel(LogLevel.INFO)
            .build();

        var result = new SceneChecker().check(config);
        assertEquals(CheckResult.Status.VALID, result.status(), result.toPrettyJson());
        assertEquals("elements/lineset", result.metadata().get("type"));
        assertEquals("collars", result.metadata().get("name"));
        assertEquals(3L, result.metadata().get("numNodes"));
        assertEquals(2L, result.metadata().get("numCells"));
        assertEquals(5, result.metadata().get("resolved"));
        assertFalse(result.metadata().containsKey("snapshot"));
    }

    @Test
    void unresolvedArraysLeaveCountsUnknown() {
        var config = CheckConfiguration.builder().scene(SCENES.resolve("lines.json")).build();

        var result = new SceneChecker().check(config);
        assertEquals(CheckResult.Status.VALID, result.status(), result.toPrettyJson());
        assertEquals("unknown", result.metadata().get("numNodes"));
        assertEquals("unknown", result.metadata().get("numCells"));
    }

    @Test
    void exportsAndSnapshotsValidScene() throws Exception {
        Path target = tempDir.resolve("export/collars.json");
        var config = CheckConfiguration.builder()
            .scene(SCENES.resolve("lines.json"))
            .arraysDirectory(SCENES.resolve("arrays"))
            .exportTarget(target)
            .snapshot(true)
            .build();

        var result = new SceneChecker().check(config);
        assertTrue(result.isValid(), result.toPrettyJson());
        assertEquals(target.toString(), result.metadata().get("export"));
        assertTrue(Files.readString(target).contains("LineSetElement"));
        var snapshot = (String) result.metadata().get("snapshot");
        assertTrue(snapshot.contains("\"type\":\"elements/lineset\""));
        assertTrue(snapshot.contains("\"defaults\":\"{"));
    }

    @Test
    void exportWithoutArraysIsInvalid() {
        var config = CheckConfiguration.builder()
            .scene(SCENES.resolve("lines.json"))
            .exportTarget(tempDir.resolve("collars.json"))
            .build();

        var result = new SceneChecker().check(config);
        assertEquals(CheckResult.Status.INVALID, result.status());
        assertEquals("missing", result.metadata().get("reason"));
        assertFalse(Files.exists(tempDir.resolve("collars.json")));
    }

    @Test
    void reportsFailingFieldPath() {
        var config = CheckConfiguration.builder().scene(SCENES.resolve("points-invalid.yaml")).build();

        var result = new SceneChecker().check(config);
        assertEquals(CheckResult.Status.INVALID, result.status());
        assertEquals(1, result.status().exitCode());
        assertEquals("invalid", result.metadata().get("reason"));
        assertEquals("data[0]", result.metadata().get("field"));
        assertTrue(((String) result.metadata().get("error")).contains("does not match nodes length 2"));
    }

    @Test
    void danglingElementIdentifierIsMissing() {
        var config = CheckConfiguration.builder().scene(SCENES.resolve("dangling.json")).build();

        var result = new SceneChecker().check(config);
        assertEquals(CheckResult.Status.INVALID, result.status());
        assertEquals("missing", result.metadata().get("reason"));
        assertEquals("element", result.metadata().get("field"));
    }

    @Test
    void unreadableSceneIsAnError() throws Exception {
        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{\"element\": ");

        var result = new SceneChecker().check(CheckConfiguration.builder().scene(broken).build());
        assertEquals(CheckResult.Status.ERROR, result.status());
        assertEquals(2, result.status().exitCode());
        assertTrue(result.metadata().containsKey("error"));

        var missing = new SceneChecker().check(CheckConfiguration.builder().scene(tempDir.resolve("absent.json")).build());
        assertEquals(CheckResult.Status.ERROR, missing.status());
    }

    @Test
    void resultSerializesStatusInLowerCase() {
        var result = new SceneChecker().check(CheckConfiguration.builder().scene(SCENES.resolve("dangling.json")).build());
        assertEquals("invalid", result.toSerializableMap().get("status"));
        assertTrue(result.toPrettyJson().contains("\"reason\" : \"missing\""));
    }
}
