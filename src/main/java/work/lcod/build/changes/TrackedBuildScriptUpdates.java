package work.lcod.build.changes;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import work.lcod.build.asset.AssetId;
import work.lcod.build.graph.AssetGraph;
import work.lcod.build.graph.AssetNode;
import work.lcod.build.graph.InternalAssetNode;
import work.lcod.build.shared.BuildPaths;

/**
 * Tracks the assets that make up the build script: the root {@code build.yaml} and {@code packages.toml} plus every
 * internal asset under the entry-point directory.
 *
 * <p>Ids are matched by location as well, so build script inputs that were just added or already removed from the
 * graph still count.
 */
final class TrackedBuildScriptUpdates implements BuildScriptUpdates {
    private final String rootPackage;
    private final Set<AssetId> buildScriptInputs;

    private TrackedBuildScriptUpdates(String rootPackage, Set<AssetId> buildScriptInputs) {
        this.rootPackage = rootPackage;
        this.buildScriptInputs = Collections.unmodifiableSet(buildScriptInputs);
    }

    static TrackedBuildScriptUpdates create(String rootPackage, AssetGraph graph) {
        Set<AssetId> inputs = new LinkedHashSet<>();
        for (AssetNode node : graph.allNodes()) {
            if (node instanceof InternalAssetNode || BuildPaths.isBuildScriptInput(node.id(), rootPackage)) {
                inputs.add(node.id());
            }
        }
        return new TrackedBuildScriptUpdates(rootPackage, inputs);
    }

    Set<AssetId> buildScriptInputs() {
        return buildScriptInputs;
    }

    @Override
    public boolean hasBeenUpdated(Set<AssetId> updatedIds) {
        for (AssetId id : updatedIds) {
            if (buildScriptInputs.contains(id) || isBuildScriptLocation(id)) {
                return true;
            }
        }
        return false;
    }

    private boolean isBuildScriptLocation(AssetId id) {
        return BuildPaths.isBuildScriptInput(id, rootPackage)
            || (id.packageName().equals(rootPackage) && id.path().startsWith(BuildPaths.ENTRY_POINT_DIR + "/"));
    }
}
