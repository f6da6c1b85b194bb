package work.lcod.spatial.cli;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.spatial.api.CheckConfiguration;
import work.lcod.spatial.api.CheckResult;
import work.lcod.spatial.api.LogLevel;
import work.lcod.spatial.api.SceneChecker;
import work.lcod.spatial.config.ConfigLoader;
import work.lcod.spatial.config.SpatialSettings;
import work.lcod.spatial.runtime.ResourceType;
import work.lcod.spatial.runtime.SpatialRegistry;

@CommandLine.Command(
    name = "spatial-check",
    description = "Validate a spatial scene and optionally export it to the interchange format.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class SpatialCheckCommand implements Callable<Integer> {
    static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-s", "--scene"},
        description = "Scene file (.json, .yaml or .yml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path scene;

    @CommandLine.Option(
        names = {"-a", "--arrays"},
        description = "Directory of CSV files backing files/array identifiers.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path arrays;

    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "Settings file (default: spatial.toml next to the scene).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = {"-e", "--export"},
        description = "Write the validated element as interchange JSON to this path.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path export;

    @CommandLine.Option(
        names = "--snapshot",
        description = "Include the snapshot-encoded element in the report."
    )
    private boolean snapshot;

    @CommandLine.Option(
        names = "--list-types",
        description = "Print the registered resource types and exit."
    )
    private boolean listTypes;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        if (listTypes) {
            SpatialRegistry.standard().entries().stream()
                .sorted(Comparator.comparing(type -> type.key().toString()))
                .forEach(type -> out.println(describe(type)));
            out.flush();
            return 0;
        }
        if (scene == null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Missing required option: '--scene=<scene>'");
        }
        Path scenePath = scene.toAbsolutePath().normalize();
        if (!Files.isRegularFile(scenePath)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Scene file not found: " + scenePath);
        }

        SpatialSettings settings = loadSettings(scenePath);
        var builder = settings.applyTo(CheckConfiguration.builder().scene(scenePath));
        if (arrays != null) {
            builder.arraysDirectory(arrays.toAbsolutePath().normalize());
        }
        if (export != null) {
            builder.exportTarget(export.toAbsolutePath().normalize());
        }
        if (snapshot) {
            builder.snapshot(true);
        }
        LogLevel logLevel = resolveLogLevel(settings);
        builder.logLevel(logLevel);
        System.setProperty(LOG_LEVEL_PROPERTY, logLevel.simpleLoggerName());

        CheckResult result = new SceneChecker().check(builder.build());
        out.println(result.toPrettyJson());
        out.flush();
        return result.status().exitCode();
    }

    private SpatialSettings loadSettings(Path scenePath) {
        if (config != null) {
            Path path = config.toAbsolutePath().normalize();
            return ConfigLoader.load(path).orElseThrow(() ->
                new CommandLine.ParameterException(spec.commandLine(), "Config file not found: " + path));
        }
        return ConfigLoader.discover(scenePath).orElse(SpatialSettings.empty());
    }

    private LogLevel resolveLogLevel(SpatialSettings settings) {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv("SPATIAL_LOG_LEVEL");
        }
        if (candidate != null && !candidate.isBlank()) {
            return LogLevel.from(candidate);
        }
        return settings.logLevel().orElse(LogLevel.FATAL);
    }

    private static String describe(ResourceType<?> type) {
        return Optional.of(type.description())
            .filter(description -> !description.isBlank())
            .map(description -> type.key() + "\t" + description)
            .orElse(type.key().toString());
    }
}
