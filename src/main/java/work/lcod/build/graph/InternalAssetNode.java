package work.lcod.build.graph;

import java.util.Optional;
import work.lcod.build.asset.AssetId;
import work.lcod.build.asset.Digest;

/**
 * Bookkeeping file owned by the build system itself, e.g. under the entry-point directory.
 */
public final class InternalAssetNode extends AssetNode {
    public InternalAssetNode(AssetId id, Optional<Digest> lastKnownDigest) {
        super(id, lastKnownDigest);
    }

    @Override
    public boolean isReadable() {
        return true;
    }

    @Override
    public boolean isValidInput() {
        return false;
    }
}
