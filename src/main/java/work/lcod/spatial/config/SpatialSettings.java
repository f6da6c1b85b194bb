package work.lcod.spatial.config;

import java.nio.file.Path;
import java.util.Optional;
import work.lcod.spatial.api.CheckConfiguration;
import work.lcod.spatial.api.LogLevel;

/**
 * Defaults read from a {@code spatial.toml} file. Paths are already resolved against the
 * file's directory.
 */
public record SpatialSettings(
    Optional<Path> arraysDirectory,
    Optional<Path> exportTarget,
    Optional<Boolean> snapshot,
    Optional<LogLevel> logLevel
) {
    public static SpatialSettings empty() {
        return new SpatialSettings(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }

    /**
     * Seeds a builder with these defaults; later builder calls override them.
     */
    public CheckConfiguration.Builder applyTo(CheckConfiguration.Builder builder) {
        arraysDirectory.ifPresent(builder::arraysDirectory);
        exportTarget.ifPresent(builder::exportTarget);
        snapshot.ifPresent(builder::snapshot);
        logLevel.ifPresent(builder::logLevel);
        return builder;
    }
}
