package work.lcod.build.cache;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import work.lcod.build.asset.AssetGlob;
import work.lcod.build.asset.AssetId;
import work.lcod.build.asset.AssetReader;
import work.lcod.build.asset.Digest;
import work.lcod.build.graph.AssetGraph;

/**
 * Reads hidden generated outputs from the build cache and everything else from the wrapped reader.
 */
public final class BuildCacheReader implements AssetReader {
    private final AssetReader delegate;
    private final AssetGraph graph;
    private final String rootPackage;

    public BuildCacheReader(AssetReader delegate, AssetGraph graph, String rootPackage) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.graph = Objects.requireNonNull(graph, "graph");
        this.rootPackage = Objects.requireNonNull(rootPackage, "rootPackage");
    }

    @Override
    public boolean canRead(AssetId id) {
        return delegate.canRead(BuildCacheLocations.cacheLocation(id, graph, rootPackage));
    }

    @Override
    public byte[] readAsBytes(AssetId id) throws IOException {
        return delegate.readAsBytes(BuildCacheLocations.cacheLocation(id, graph, rootPackage));
    }

    @Override
    public Digest digest(AssetId id) throws IOException {
        return delegate.digest(BuildCacheLocations.cacheLocation(id, graph, rootPackage));
    }

    @Override
    public Set<AssetId> findAssets(AssetGlob glob, Optional<String> packageName) throws IOException {
        return delegate.findAssets(glob, packageName);
    }
}
