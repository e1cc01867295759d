package work.lcod.build.changes;

import java.util.Set;
import work.lcod.build.asset.AssetId;
import work.lcod.build.generate.BuildOptions;
import work.lcod.build.graph.AssetGraph;

/**
 * Tells whether the build configuration itself changed, in which case nothing cached can be trusted.
 */
public interface BuildScriptUpdates {
    boolean hasBeenUpdated(Set<AssetId> updatedIds);

    static BuildScriptUpdates create(BuildOptions options, AssetGraph graph) {
        if (options.skipBuildScriptCheck()) {
            return updatedIds -> false;
        }
        return TrackedBuildScriptUpdates.create(options.packageGraph().root().name(), graph);
    }
}
