package work.lcod.build.generate;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.build.asset.AssetId;
import work.lcod.build.asset.AssetReader;
import work.lcod.build.asset.Digest;
import work.lcod.build.config.BuildAction;
import work.lcod.build.config.BuildActionsDigest;
import work.lcod.build.graph.AssetGraph;
import work.lcod.build.graph.AssetGraphVersionException;
import work.lcod.build.shared.BuildPaths;
import work.lcod.build.shared.Logging;

/**
 * Reads the graph persisted by the previous build. A missing or unusable graph is never an error, the build simply
 * starts from scratch.
 */
public final class CachedGraphLoader {
    private final AssetReader reader;
    private final String rootPackage;
    private final List<BuildAction> buildActions;
    private final GeneratedOutputDirectory generatedOutputDirectory;
    private final Logger logger;

    CachedGraphLoader(
        AssetReader reader,
        String rootPackage,
        List<BuildAction> buildActions,
        GeneratedOutputDirectory generatedOutputDirectory,
        Logger logger
    ) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.rootPackage = Objects.requireNonNull(rootPackage, "rootPackage");
        this.buildActions = List.copyOf(buildActions);
        this.generatedOutputDirectory = Objects.requireNonNull(generatedOutputDirectory, "generatedOutputDirectory");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public CachedGraphLoader(BuildOptions options, List<BuildAction> buildActions) {
        this(
            options.reader(),
            options.rootPackage(),
            buildActions,
            new GeneratedOutputDirectory(options.packageGraph()),
            LoggerFactory.getLogger(CachedGraphLoader.class)
        );
    }

    public CachedGraph load() {
        AssetId graphId = BuildPaths.assetGraphId(rootPackage);
        if (!reader.canRead(graphId)) {
            return CachedGraph.none(CachedGraph.Outcome.MISSING);
        }
        return Logging.logTimed(logger, "Reading cached asset graph", () -> read(graphId));
    }

    private CachedGraph read(AssetId graphId) {
        try {
            AssetGraph cachedGraph = AssetGraph.deserialize(reader.readAsBytes(graphId));
            Digest current = BuildActionsDigest.compute(buildActions);
            if (!current.equals(cachedGraph.buildActionsDigest())) {
                logger.warn("Throwing away cached asset graph because the build actions have changed. This could "
                    + "happen as a result of adding a new dependency, or if the build configuration changes the "
                    + "build structure based on command line flags or other configuration.");
                return CachedGraph.none(CachedGraph.Outcome.ACTIONS_CHANGED);
            }
            return CachedGraph.loaded(cachedGraph);
        } catch (AssetGraphVersionException ex) {
            logger.warn("Throwing away cached asset graph due to version mismatch ({}).", ex.getMessage());
            generatedOutputDirectory.delete();
            return CachedGraph.none(CachedGraph.Outcome.VERSION_MISMATCH);
        } catch (IOException | RuntimeException ex) {
            logger.warn("Failed to read cached asset graph {}, starting a fresh build: {}", graphId, ex.getMessage());
            logger.debug("Cached asset graph read failure", ex);
            return CachedGraph.none(CachedGraph.Outcome.UNREADABLE);
        }
    }
}
