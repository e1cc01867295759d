package work.lcod.build.generate;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.build.asset.AssetId;
import work.lcod.build.asset.AssetReader;
import work.lcod.build.asset.AssetWriter;
import work.lcod.build.cache.BuildCacheReader;
import work.lcod.build.cache.BuildCacheWriter;
import work.lcod.build.changes.BuildScriptUpdates;
import work.lcod.build.config.BuildAction;
import work.lcod.build.graph.AssetGraph;
import work.lcod.build.graph.ChangeType;
import work.lcod.build.shared.Logging;

/**
 * One build preparation pass: validate the actions, list sources, reuse or rebuild the asset graph and clear
 * conflicting outputs.
 */
final class WorkspaceLoader {
    private final BuildOptions options;
    private final List<BuildAction> buildActions;
    private final OnDelete onDelete;
    private final Logger logger;
    private final GeneratedOutputDirectory generatedOutputDirectory;

    WorkspaceLoader(BuildOptions options, List<BuildAction> buildActions, OnDelete onDelete) {
        this(options, buildActions, onDelete, LoggerFactory.getLogger(BuildDefinition.class));
    }

    WorkspaceLoader(BuildOptions options, List<BuildAction> buildActions, OnDelete onDelete, Logger logger) {
        this.options = Objects.requireNonNull(options, "options");
        this.buildActions = List.copyOf(buildActions);
        this.onDelete = Objects.requireNonNull(onDelete, "onDelete");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.generatedOutputDirectory = new GeneratedOutputDirectory(options.packageGraph());
    }

    BuildDefinition prepareWorkspace() {
        checkBuildActions();

        var resourceManager = new ResourceManager();
        try {
            return prepare(resourceManager);
        } catch (RuntimeException ex) {
            try {
                resourceManager.disposeAll();
            } catch (RuntimeException disposeFailure) {
                ex.addSuppressed(disposeFailure);
            }
            throw ex;
        }
    }

    private BuildDefinition prepare(ResourceManager resourceManager) {
        Executor executor = resolveExecutor(resourceManager);

        logger.info("Initializing inputs");
        SourceSnapshot sources = new SourceEnumerator(options.packageGraph(), options.reader(), executor, logger).snapshot();

        CachedGraph cached = new CachedGraphLoader(
            options.reader(), options.rootPackage(), buildActions, generatedOutputDirectory, logger).load();
        if (cached.outcome() == CachedGraph.Outcome.ACTIONS_CHANGED) {
            generatedOutputDirectory.delete();
        }

        AssetGraph assetGraph = cached.graph().orElse(null);
        BuildScriptUpdates buildScriptUpdates = null;
        Map<AssetId, ChangeType> updates = Map.of();
        if (assetGraph != null) {
            AssetGraph cachedGraph = assetGraph;
            updates = Logging.logTimed(logger, "Checking for updates since last build",
                () -> updateAssetGraph(cachedGraph, sources, executor));

            buildScriptUpdates = BuildScriptUpdates.create(options, assetGraph);
            if (!options.skipBuildScriptCheck() && buildScriptUpdates.hasBeenUpdated(updates.keySet())) {
                logger.warn("Invalidating asset graph due to build script update");
                generatedOutputDirectory.delete();
                assetGraph = null;
                buildScriptUpdates = null;
                updates = Map.of();
            }
        }

        boolean fromCache = assetGraph != null;
        if (assetGraph == null) {
            FreshGraph fresh = Logging.logTimed(logger, "Building new asset graph", () -> buildFreshGraph(sources));
            assetGraph = fresh.graph();
            buildScriptUpdates = BuildScriptUpdates.create(options, assetGraph);

            AssetWriter cleanupWriter = wrapWriter(assetGraph);
            Logging.runTimed(logger, "Checking for unexpected pre-existing outputs.",
                () -> new ExistingOutputsResolver(cleanupWriter, options.terminal(), onDelete, logger)
                    .resolve(fresh.conflictingOutputs(), options.deleteFilesByDefault(), options.assumeTty()));
        }

        return new BuildDefinition(
            assetGraph,
            wrapReader(assetGraph),
            wrapWriter(assetGraph),
            options.packageGraph(),
            options.deleteFilesByDefault(),
            resourceManager,
            buildScriptUpdates,
            options.enableLowResourcesMode(),
            onDelete,
            updates,
            fromCache
        );
    }

    /**
     * Only the root package may run builders whose outputs land next to the sources.
     */
    private void checkBuildActions() {
        String root = options.rootPackage();
        for (BuildAction action : buildActions) {
            if (!action.hideOutput() && !action.packageName().equals(root)) {
                throw InvalidBuildActionException.nonRootPackage(action, root);
            }
        }
    }

    private Map<AssetId, ChangeType> updateAssetGraph(AssetGraph assetGraph, SourceSnapshot sources, Executor executor)
        throws IOException {
        Map<AssetId, ChangeType> updates = new ChangeDetector(options.reader(), executor)
            .detectChanges(assetGraph, buildActions, sources);
        AssetWriter writer = wrapWriter(assetGraph);
        assetGraph.updateAndInvalidate(
            buildActions,
            updates,
            options.rootPackage(),
            id -> delete(id, writer),
            wrapReader(assetGraph)
        );
        return updates;
    }

    private FreshGraph buildFreshGraph(SourceSnapshot sources) throws IOException {
        AssetGraph assetGraph = AssetGraph.build(
            buildActions,
            sources.inputSources(),
            sources.internalSources(),
            options.packageGraph(),
            options.reader()
        );
        String root = options.rootPackage();
        Set<AssetId> conflictingOutputs = new LinkedHashSet<>();
        Set<AssetId> conflictsInDeps = new LinkedHashSet<>();
        for (AssetId output : assetGraph.outputs()) {
            if (!sources.inputSources().contains(output)) {
                continue;
            }
            if (output.packageName().equals(root)) {
                conflictingOutputs.add(output);
            } else {
                conflictsInDeps.add(output);
            }
        }
        if (!conflictsInDeps.isEmpty()) {
            throw UnexpectedExistingOutputsException.inDependencies(conflictsInDeps);
        }
        return new FreshGraph(assetGraph, conflictingOutputs);
    }

    private void delete(AssetId id, AssetWriter writer) throws IOException {
        onDelete.onDelete(id);
        writer.delete(id);
    }

    private AssetReader wrapReader(AssetGraph assetGraph) {
        return new BuildCacheReader(options.reader(), assetGraph, options.rootPackage());
    }

    private AssetWriter wrapWriter(AssetGraph assetGraph) {
        return new BuildCacheWriter(options.writer(), assetGraph, options.rootPackage());
    }

    private Executor resolveExecutor(ResourceManager resourceManager) {
        if (options.executor().isPresent()) {
            return options.executor().get();
        }
        int threads = options.enableLowResourcesMode() ? 1 : Math.max(2, Runtime.getRuntime().availableProcessors());
        var counter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "lcod-build-prepare-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        AutoCloseable shutdown = pool::shutdown;
        resourceManager.register(shutdown);
        return pool;
    }

    private record FreshGraph(AssetGraph graph, Set<AssetId> conflictingOutputs) {}
}
