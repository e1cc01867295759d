package work.lcod.build.asset;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import work.lcod.build.packages.PackageGraph;
import work.lcod.build.packages.PackageNode;

/**
 * Reads assets straight from the package directories described by a {@link PackageGraph}.
 */
public final class FileBasedAssetReader implements AssetReader {
    private final PackageGraph packageGraph;

    public FileBasedAssetReader(PackageGraph packageGraph) {
        this.packageGraph = Objects.requireNonNull(packageGraph, "packageGraph");
    }

    @Override
    public boolean canRead(AssetId id) {
        return packageGraph.get(id.packageName())
            .map(node -> Files.isRegularFile(resolve(node, id)))
            .orElse(false);
    }

    @Override
    public byte[] readAsBytes(AssetId id) throws IOException {
        return Files.readAllBytes(resolve(packageGraph.require(id.packageName()), id));
    }

    @Override
    public Set<AssetId> findAssets(AssetGlob glob, Optional<String> packageName) throws IOException {
        PackageNode node = packageName.map(packageGraph::require).orElse(packageGraph.root());
        Path packageDir = node.path();
        String prefix = glob.literalPrefix();
        Path start = prefix.isEmpty() ? packageDir : packageDir.resolve(prefix);
        Set<AssetId> found = new LinkedHashSet<>();
        if (glob.isLiteral()) {
            if (Files.isRegularFile(packageDir.resolve(glob.pattern()))) {
                found.add(new AssetId(node.name(), glob.pattern()));
            }
            return found;
        }
        if (!Files.isDirectory(start)) {
            return found;
        }
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    String relative = toAssetPath(packageDir.relativize(file));
                    if (glob.matches(relative)) {
                        found.add(new AssetId(node.name(), relative));
                    }
                }
                return FileVisitResult.CONTINUE;
            }
        });
        return found;
    }

    static Path resolve(PackageNode node, AssetId id) {
        Path resolved = node.path().resolve(id.path()).normalize();
        if (!resolved.startsWith(node.path())) {
            throw new IllegalArgumentException("Asset " + id + " escapes its package directory");
        }
        return resolved;
    }

    private static String toAssetPath(Path relative) {
        return relative.toString().replace(relative.getFileSystem().getSeparator(), "/");
    }
}
