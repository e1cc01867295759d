package work.lcod.build.graph;

import java.io.IOException;

/**
 * Raised when a persisted graph was written by an incompatible format version.
 */
public final class AssetGraphVersionException extends IOException {
    private final int foundVersion;
    private final int expectedVersion;

    public AssetGraphVersionException(int foundVersion, int expectedVersion) {
        super("Asset graph version " + foundVersion + " does not match expected version " + expectedVersion);
        this.foundVersion = foundVersion;
        this.expectedVersion = expectedVersion;
    }

    public int foundVersion() {
        return foundVersion;
    }

    public int expectedVersion() {
        return expectedVersion;
    }
}
