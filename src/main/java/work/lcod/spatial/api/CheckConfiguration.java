package work.lcod.spatial.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration of one scene check.
 *
 * @param scene           JSON or YAML scene document
 * @param arraysDirectory directory of CSV files resolving {@code files/array} identifiers
 * @param exportTarget    where to write the interchange JSON; no export when empty
 * @param snapshot        include the snapshot-encoded element in the result
 */
public record CheckConfiguration(
    Path scene,
    Optional<Path> arraysDirectory,
    Optional<Path> exportTarget,
    boolean snapshot,
    LogLevel logLevel
) {
    public CheckConfiguration {
        Objects.requireNonNull(scene, "scene");
        Objects.requireNonNull(arraysDirectory, "arraysDirectory");
        Objects.requireNonNull(exportTarget, "exportTarget");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path scene;
        private Optional<Path> arraysDirectory = Optional.empty();
        private Optional<Path> exportTarget = Optional.empty();
        private boolean snapshot;
        private LogLevel logLevel = LogLevel.FATAL;

        public Builder scene(Path scene) {
            this.scene = scene;
            return this;
        }

        public Builder arraysDirectory(Path arraysDirectory) {
            this.arraysDirectory = Optional.ofNullable(arraysDirectory);
            return this;
        }

        public Builder exportTarget(Path exportTarget) {
            this.exportTarget = Optional.ofNullable(exportTarget);
            return this;
        }

        public Builder snapshot(boolean snapshot) {
            this.snapshot = snapshot;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public CheckConfiguration build() {
            return new CheckConfiguration(scene, arraysDirectory, exportTarget, snapshot, logLevel);
        }
    }
}
