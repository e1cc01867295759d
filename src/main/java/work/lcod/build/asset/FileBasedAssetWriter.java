package work.lcod.build.asset;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import work.lcod.build.packages.PackageGraph;

/**
 * Writes assets into the package directories described by a {@link PackageGraph}.
 */
public final class FileBasedAssetWriter implements AssetWriter {
    private final PackageGraph packageGraph;

    public FileBasedAssetWriter(PackageGraph packageGraph) {
        this.packageGraph = Objects.requireNonNull(packageGraph, "packageGraph");
    }

    @Override
    public void writeAsBytes(AssetId id, byte[] bytes) throws IOException {
        Path target = FileBasedAssetReader.resolve(packageGraph.require(id.packageName()), id);
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(target, bytes);
    }

    @Override
    public void delete(AssetId id) throws IOException {
        Files.deleteIfExists(FileBasedAssetReader.resolve(packageGraph.require(id.packageName()), id));
    }
}
