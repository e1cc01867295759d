package work.lcod.build.generate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.build.asset.AssetGlob;
import work.lcod.build.asset.AssetId;
import work.lcod.build.asset.AssetReader;
import work.lcod.build.packages.PackageGraph;
import work.lcod.build.packages.PackageNode;
import work.lcod.build.shared.BuildPaths;
import work.lcod.build.shared.Futures;

/**
 * Lists the assets currently on disk: package inputs, previously generated outputs in the cache directory and
 * internal bookkeeping assets. Read-only; any failure aborts the pass.
 */
public final class SourceEnumerator {
    private final PackageGraph packageGraph;
    private final AssetReader reader;
    private final Executor executor;
    private final Logger logger;

    public SourceEnumerator(PackageGraph packageGraph, AssetReader reader, Executor executor) {
        this(packageGraph, reader, executor, LoggerFactory.getLogger(SourceEnumerator.class));
    }

    public SourceEnumerator(PackageGraph packageGraph, AssetReader reader, Executor executor, Logger logger) {
        this.packageGraph = Objects.requireNonNull(packageGraph, "packageGraph");
        this.reader = Objects.requireNonNull(reader, "reader");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public SourceSnapshot snapshot() {
        return new SourceSnapshot(findInputSources(), findCacheDirSources(), findInternalSources());
    }

    /**
     * Original package inputs; packages are listed concurrently.
     */
    public Set<AssetId> findInputSources() {
        List<CompletableFuture<Set<AssetId>>> tasks = new ArrayList<>();
        for (PackageNode node : packageGraph.allPackages().values()) {
            tasks.add(CompletableFuture.supplyAsync(() -> listAssetIds(node), executor));
        }
        Set<AssetId> sources = new LinkedHashSet<>();
        Futures.joinAll(tasks).forEach(sources::addAll);
        return sources;
    }

    /**
     * Generated outputs found in the cache directory, mapped back from {@code <package>/<path>} to their ids.
     */
    public Set<AssetId> findCacheDirSources() {
        String prefix = BuildPaths.GENERATED_OUTPUT_DIRECTORY + "/";
        Set<AssetId> sources = new LinkedHashSet<>();
        for (AssetId id : find(new AssetGlob(BuildPaths.GENERATED_OUTPUT_DIRECTORY + "/**"), Optional.empty())) {
            String packagePath = id.path().substring(prefix.length());
            int firstSlash = packagePath.indexOf('/');
            if (firstSlash <= 0 || firstSlash == packagePath.length() - 1) {
                logger.debug("Ignoring {} which is not under a package directory", id);
                continue;
            }
            sources.add(new AssetId(packagePath.substring(0, firstSlash), packagePath.substring(firstSlash + 1)));
        }
        return sources;
    }

    /**
     * Internal assets such as those under the entry-point directory.
     */
    public Set<AssetId> findInternalSources() {
        return find(new AssetGlob(BuildPaths.ENTRY_POINT_DIR + "/**"), Optional.empty());
    }

    static List<String> packageIncludes(PackageNode node) {
        if (node.isRoot()) {
            return BuildPaths.ROOT_PACKAGE_FILES_WHITELIST;
        }
        return node.isSdk() ? BuildPaths.SDK_PACKAGE_INCLUDES : BuildPaths.DEPENDENCY_PACKAGE_INCLUDES;
    }

    private Set<AssetId> listAssetIds(PackageNode node) {
        Set<AssetId> ids = new LinkedHashSet<>();
        for (String pattern : packageIncludes(node)) {
            ids.addAll(find(new AssetGlob(pattern), Optional.of(node.name())));
        }
        return ids;
    }

    private Set<AssetId> find(AssetGlob glob, Optional<String> packageName) {
        try {
            return reader.findAssets(glob, packageName);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list assets matching " + glob
                + packageName.map(name -> " in package " + name).orElse(""), ex);
        }
    }
}
