package work.lcod.build.cache;

import work.lcod.build.asset.AssetId;
import work.lcod.build.graph.AssetGraph;
import work.lcod.build.graph.GeneratedAssetNode;
import work.lcod.build.shared.BuildPaths;

final class BuildCacheLocations {
    private BuildCacheLocations() {}

    /**
     * Where {@code id} actually lives: hidden outputs are shadowed into the root package's generated directory.
     */
    static AssetId cacheLocation(AssetId id, AssetGraph graph, String rootPackage) {
        return graph.get(id)
            .filter(node -> node instanceof GeneratedAssetNode generated && generated.isHidden())
            .map(node -> BuildPaths.generatedLocation(id, rootPackage))
            .orElse(id);
    }
}
