package work.lcod.build.generate;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import work.lcod.build.asset.AssetReader;
import work.lcod.build.asset.AssetWriter;
import work.lcod.build.asset.FileBasedAssetReader;
import work.lcod.build.asset.FileBasedAssetWriter;
import work.lcod.build.packages.PackageGraph;

/**
 * Immutable settings for one build preparation pass.
 *
 * <p>Without an explicit executor the pass creates its own pool, single threaded in low resources mode.
 */
public record BuildOptions(
    PackageGraph packageGraph,
    AssetReader reader,
    AssetWriter writer,
    boolean deleteFilesByDefault,
    boolean assumeTty,
    boolean skipBuildScriptCheck,
    boolean enableLowResourcesMode,
    Terminal terminal,
    Optional<Executor> executor
) {
    public BuildOptions {
        Objects.requireNonNull(packageGraph, "packageGraph");
        Objects.requireNonNull(reader, "reader");
        Objects.requireNonNull(writer, "writer");
        Objects.requireNonNull(terminal, "terminal");
        Objects.requireNonNull(executor, "executor");
    }

    public String rootPackage() {
        return packageGraph.root().name();
    }

    public static Builder builder(PackageGraph packageGraph) {
        return new Builder(packageGraph);
    }

    public static final class Builder {
        private final PackageGraph packageGraph;
        private AssetReader reader;
        private AssetWriter writer;
        private boolean deleteFilesByDefault;
        private boolean assumeTty;
        private boolean skipBuildScriptCheck;
        private boolean enableLowResourcesMode;
        private Terminal terminal;
        private Optional<Executor> executor = Optional.empty();

        private Builder(PackageGraph packageGraph) {
            this.packageGraph = Objects.requireNonNull(packageGraph, "packageGraph");
        }

        public Builder reader(AssetReader reader) {
            this.reader = reader;
            return this;
        }

        public Builder writer(AssetWriter writer) {
            this.writer = writer;
            return this;
        }

        public Builder deleteFilesByDefault(boolean deleteFilesByDefault) {
            this.deleteFilesByDefault = deleteFilesByDefault;
            return this;
        }

        public Builder assumeTty(boolean assumeTty) {
            this.assumeTty = assumeTty;
            return this;
        }

        public Builder skipBuildScriptCheck(boolean skipBuildScriptCheck) {
            this.skipBuildScriptCheck = skipBuildScriptCheck;
            return this;
        }

        public Builder enableLowResourcesMode(boolean enableLowResourcesMode) {
            this.enableLowResourcesMode = enableLowResourcesMode;
            return this;
        }

        public Builder terminal(Terminal terminal) {
            this.terminal = terminal;
            return this;
        }

        public Builder executor(Executor executor) {
            this.executor = Optional.ofNullable(executor);
            return this;
        }

        public BuildOptions build() {
            return new BuildOptions(
                packageGraph,
                reader != null ? reader : new FileBasedAssetReader(packageGraph),
                writer != null ? writer : new FileBasedAssetWriter(packageGraph),
                deleteFilesByDefault,
                assumeTty,
                skipBuildScriptCheck,
                enableLowResourcesMode,
                terminal != null ? terminal : new ConsoleTerminal(),
                executor
            );
        }
    }
}
