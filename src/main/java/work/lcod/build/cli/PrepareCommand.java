package work.lcod.build.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.build.api.LogLevel;
import work.lcod.build.api.PreparationConfiguration;
import work.lcod.build.api.PreparationReport;
import work.lcod.build.api.PreparationRunner;

@CommandLine.Command(
    name = "lcod-build",
    description = "Prepare the incremental build workspace: load or rebuild the asset graph and detect changes.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class PrepareCommand implements Callable<Integer> {
    @CommandLine.Option(
        names = {"-r", "--root"},
        description = "Workspace root containing packages.toml (default: current directory).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String root;

    @CommandLine.Option(
        names = "--delete-conflicting-outputs",
        description = "Delete files that collide with declared outputs without prompting."
    )
    private boolean deleteConflictingOutputs;

    @CommandLine.Option(
        names = "--assume-tty",
        description = "Prompt for conflicting outputs even when no console is detected."
    )
    private boolean assumeTty;

    @CommandLine.Option(
        names = "--skip-build-script-check",
        description = "Keep the cached graph even when build script inputs changed."
    )
    private boolean skipBuildScriptCheck;

    @CommandLine.Option(
        names = "--low-resources-mode",
        description = "Run every step on a single worker thread."
    )
    private boolean lowResourcesMode;

    @CommandLine.Option(
        names = "--save-graph",
        negatable = true,
        defaultValue = "true",
        fallbackValue = "true",
        description = "Persist the asset graph under .lcod_build after preparation."
    )
    private boolean saveGraph = true;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        LogLevel logLevel;
        try {
            logLevel = LogLevel.from(logLevelRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
        LogLevels.apply(logLevel);

        Path rootDirectory = root != null ? Paths.get(root) : Paths.get("");
        var configuration = PreparationConfiguration.builder()
            .rootDirectory(rootDirectory)
            .deleteConflictingOutputs(deleteConflictingOutputs)
            .assumeTty(assumeTty)
            .skipBuildScriptCheck(skipBuildScriptCheck)
            .lowResourcesMode(lowResourcesMode)
            .saveGraph(saveGraph)
            .logLevel(logLevel)
            .build();

        PreparationReport report = new PreparationRunner().run(configuration);
        spec.commandLine().getOut().println(report.toPrettyJson());
        if (report.failure().isPresent()) {
            throw new PreparationFailedException(report.failure().get());
        }
        return report.status().exitCode();
    }
}
