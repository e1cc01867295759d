package work.lcod.build.cache;

import java.io.IOException;
import java.util.Objects;
import work.lcod.build.asset.AssetId;
import work.lcod.build.asset.AssetWriter;
import work.lcod.build.graph.AssetGraph;

/**
 * Writes hidden generated outputs into the build cache and everything else through the wrapped writer.
 */
public final class BuildCacheWriter implements AssetWriter {
    private final AssetWriter delegate;
    private final AssetGraph graph;
    private final String rootPackage;

    public BuildCacheWriter(AssetWriter delegate, AssetGraph graph, String rootPackage) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.graph = Objects.requireNonNull(graph, "graph");
        this.rootPackage = Objects.requireNonNull(rootPackage, "rootPackage");
    }

    @Override
    public void writeAsBytes(AssetId id, byte[] bytes) throws IOException {
        delegate.writeAsBytes(BuildCacheLocations.cacheLocation(id, graph, rootPackage), bytes);
    }

    @Override
    public void delete(AssetId id) throws IOException {
        delegate.delete(BuildCacheLocations.cacheLocation(id, graph, rootPackage));
    }
}
