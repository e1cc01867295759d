package work.lcod.build.api;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.build.asset.AssetId;
import work.lcod.build.config.BuildAction;
import work.lcod.build.config.BuildConfigLoader;
import work.lcod.build.generate.BuildDefinition;
import work.lcod.build.generate.BuildOptions;
import work.lcod.build.generate.InvalidBuildActionException;
import work.lcod.build.generate.Terminal;
import work.lcod.build.generate.UnexpectedExistingOutputsException;
import work.lcod.build.packages.PackageGraph;
import work.lcod.build.packages.PackageGraphLoader;

/**
 * Public entry point for preparing a workspace from its {@code packages.toml} and {@code build.yaml}.
 */
public final class PreparationRunner {
    private static final Logger LOG = LoggerFactory.getLogger(PreparationRunner.class);

    private final Terminal terminal;

    public PreparationRunner() {
        this(null);
    }

    /**
     * @param terminal terminal used for conflict prompts, or {@code null} for the process console
     */
    public PreparationRunner(Terminal terminal) {
        this.terminal = terminal;
    }

    public PreparationReport run(PreparationConfiguration configuration) {
        var started = Instant.now();
        Path rootDirectory = configuration.rootDirectory();
        List<AssetId> deleted = Collections.synchronizedList(new ArrayList<>());
        try {
            PackageGraph packageGraph = PackageGraphLoader.load(rootDirectory);
            List<BuildAction> actions = BuildConfigLoader.load(packageGraph);
            BuildOptions options = BuildOptions.builder(packageGraph)
                .deleteFilesByDefault(configuration.deleteConflictingOutputs())
                .assumeTty(configuration.assumeTty())
                .skipBuildScriptCheck(configuration.skipBuildScriptCheck())
                .enableLowResourcesMode(configuration.lowResourcesMode())
                .terminal(terminal)
                .build();

            BuildDefinition definition = BuildDefinition.prepareWorkspace(options, actions, deleted::add);
            try {
                if (configuration.saveGraph()) {
                    definition.saveAssetGraph();
                }
            } finally {
                definition.resourceManager().disposeAll();
            }

            var changes = PreparationReport.ChangeCounts.of(definition.updates());
            LOG.info("Workspace ready ({} changes since the last build{})",
                changes.total(), definition.fromCache() ? "" : ", fresh asset graph");
            var summary = new PreparationReport.Summary(
                packageGraph.root().name(),
                actions.size(),
                definition.fromCache(),
                changes,
                definition.assetGraph().allNodes().size(),
                definition.assetGraph().outputs().size(),
                List.copyOf(deleted)
            );
            return PreparationReport.success(rootDirectory, summary, started);
        } catch (UnexpectedExistingOutputsException ex) {
            return failure(rootDirectory, ex, new PreparationReport.Failure(
                PreparationReport.Reason.CONFLICTING_OUTPUTS,
                ex.getMessage(),
                List.copyOf(ex.conflictingOutputs()),
                ex.deletable(),
                Optional.empty()
            ), started);
        } catch (InvalidBuildActionException ex) {
            return failure(rootDirectory, ex, new PreparationReport.Failure(
                PreparationReport.Reason.INVALID_BUILD_ACTION,
                ex.getMessage(),
                List.of(),
                false,
                Optional.of(ex.action().toString())
            ), started);
        } catch (UncheckedIOException ex) {
            return failure(rootDirectory, ex, workspaceFailure(ex.getCause() != null ? ex.getCause() : ex), started);
        } catch (IOException | RuntimeException ex) {
            return failure(rootDirectory, ex, workspaceFailure(ex), started);
        }
    }

    private static PreparationReport.Failure workspaceFailure(Throwable cause) {
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return PreparationReport.Failure.of(PreparationReport.Reason.WORKSPACE, message);
    }

    private static PreparationReport failure(
        Path rootDirectory,
        Exception ex,
        PreparationReport.Failure failure,
        Instant started
    ) {
        LOG.debug("Workspace preparation failed", ex);
        return PreparationReport.failure(rootDirectory, failure, started);
    }
}
