package work.lcod.build.generate;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.lcod.build.asset.AssetId;
import work.lcod.build.asset.AssetReader;
import work.lcod.build.asset.AssetWriter;
import work.lcod.build.changes.BuildScriptUpdates;
import work.lcod.build.config.BuildAction;
import work.lcod.build.graph.AssetGraph;
import work.lcod.build.graph.ChangeType;
import work.lcod.build.packages.PackageGraph;
import work.lcod.build.shared.BuildPaths;

/**
 * Everything a build needs once the workspace is prepared: an up to date asset graph and the cache aware reader
 * and writer to run build actions against.
 */
public final class BuildDefinition {
    private final AssetGraph assetGraph;
    private final AssetReader reader;
    private final AssetWriter writer;
    private final PackageGraph packageGraph;
    private final boolean deleteFilesByDefault;
    private final ResourceManager resourceManager;
    private final BuildScriptUpdates buildScriptUpdates;
    private final boolean enableLowResourcesMode;
    private final OnDelete onDelete;
    private final Map<AssetId, ChangeType> updates;
    private final boolean fromCache;

    BuildDefinition(
        AssetGraph assetGraph,
        AssetReader reader,
        AssetWriter writer,
        PackageGraph packageGraph,
        boolean deleteFilesByDefault,
        ResourceManager resourceManager,
        BuildScriptUpdates buildScriptUpdates,
        boolean enableLowResourcesMode,
        OnDelete onDelete,
        Map<AssetId, ChangeType> updates,
        boolean fromCache
    ) {
        this.assetGraph = assetGraph;
        this.reader = reader;
        this.writer = writer;
        this.packageGraph = packageGraph;
        this.deleteFilesByDefault = deleteFilesByDefault;
        this.resourceManager = resourceManager;
        this.buildScriptUpdates = buildScriptUpdates;
        this.enableLowResourcesMode = enableLowResourcesMode;
        this.onDelete = onDelete;
        this.updates = Collections.unmodifiableMap(new LinkedHashMap<>(updates));
        this.fromCache = fromCache;
    }

    public static BuildDefinition prepareWorkspace(BuildOptions options, List<BuildAction> buildActions) {
        return prepareWorkspace(options, buildActions, OnDelete.NONE);
    }

    public static BuildDefinition prepareWorkspace(BuildOptions options, List<BuildAction> buildActions, OnDelete onDelete) {
        return new WorkspaceLoader(options, buildActions, Optional.ofNullable(onDelete).orElse(OnDelete.NONE))
            .prepareWorkspace();
    }

    public AssetGraph assetGraph() {
        return assetGraph;
    }

    public AssetReader reader() {
        return reader;
    }

    public AssetWriter writer() {
        return writer;
    }

    public PackageGraph packageGraph() {
        return packageGraph;
    }

    public boolean deleteFilesByDefault() {
        return deleteFilesByDefault;
    }

    public ResourceManager resourceManager() {
        return resourceManager;
    }

    public BuildScriptUpdates buildScriptUpdates() {
        return buildScriptUpdates;
    }

    /** Whether to conserve memory at the cost of build speed. */
    public boolean enableLowResourcesMode() {
        return enableLowResourcesMode;
    }

    public OnDelete onDelete() {
        return onDelete;
    }

    /** Changes applied to a cached graph; empty when the graph was built from scratch. */
    public Map<AssetId, ChangeType> updates() {
        return updates;
    }

    /** Whether the graph came from the previous build rather than being built fresh. */
    public boolean fromCache() {
        return fromCache;
    }

    /**
     * Persists the graph where the next preparation pass looks for it.
     */
    public void saveAssetGraph() throws IOException {
        writer.writeAsBytes(BuildPaths.assetGraphId(packageGraph.root().name()), assetGraph.serialize());
    }
}
