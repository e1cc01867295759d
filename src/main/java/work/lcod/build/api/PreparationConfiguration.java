package work.lcod.build.api;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable configuration for preparing the workspace rooted at {@code rootDirectory}.
 */
public record PreparationConfiguration(
    Path rootDirectory,
    boolean deleteConflictingOutputs,
    boolean assumeTty,
    boolean skipBuildScriptCheck,
    boolean lowResourcesMode,
    boolean saveGraph,
    LogLevel logLevel
) {
    public PreparationConfiguration {
        Objects.requireNonNull(rootDirectory, "rootDirectory");
        Objects.requireNonNull(logLevel, "logLevel");
        rootDirectory = rootDirectory.toAbsolutePath().normalize();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path rootDirectory;
        private boolean deleteConflictingOutputs;
        private boolean assumeTty;
        private boolean skipBuildScriptCheck;
        private boolean lowResourcesMode;
        private boolean saveGraph = true;
        private LogLevel logLevel = LogLevel.INFO;

        public Builder rootDirectory(Path rootDirectory) {
            this.rootDirectory = rootDirectory;
            return this;
        }

        public Builder deleteConflictingOutputs(boolean deleteConflictingOutputs) {
            this.deleteConflictingOutputs = deleteConflictingOutputs;
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

        public Builder lowResourcesMode(boolean lowResourcesMode) {
            this.lowResourcesMode = lowResourcesMode;
            return this;
        }

        public Builder saveGraph(boolean saveGraph) {
            this.saveGraph = saveGraph;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public PreparationConfiguration build() {
            return new PreparationConfiguration(
                rootDirectory,
                deleteConflictingOutputs,
                assumeTty,
                skipBuildScriptCheck,
                lowResourcesMode,
                saveGraph,
                logLevel
            );
        }
    }
}
