package work.lcod.build.graph;

import java.util.Optional;
import work.lcod.build.asset.AssetId;
import work.lcod.build.asset.Digest;

/**
 * Tracks the digest of the builder options used by one phase.
 */
public final class BuilderOptionsAssetNode extends AssetNode {
    private final int phaseNumber;

    public BuilderOptionsAssetNode(AssetId id, Optional<Digest> lastKnownDigest, int phaseNumber) {
        super(id, lastKnownDigest);
        this.phaseNumber = phaseNumber;
    }

    public int phaseNumber() {
        return phaseNumber;
    }

    @Override
    public boolean isReadable() {
        return false;
    }

    @Override
    public boolean isValidInput() {
        return false;
    }
}
