package work.lcod.build.graph;

import java.util.Optional;
import work.lcod.build.asset.AssetId;
import work.lcod.build.asset.Digest;

/**
 * A file supplied by a package author.
 */
public final class SourceAssetNode extends AssetNode {
    public SourceAssetNode(AssetId id, Optional<Digest> lastKnownDigest) {
        super(id, lastKnownDigest);
    }

    @Override
    public boolean isReadable() {
        return true;
    }

    @Override
    public boolean isValidInput() {
        return true;
    }
}
