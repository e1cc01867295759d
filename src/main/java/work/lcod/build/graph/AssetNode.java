package work.lcod.build.graph;

import java.util.Objects;
import java.util.Optional;
import work.lcod.build.asset.AssetId;
import work.lcod.build.asset.Digest;

/**
 * A node of the {@link AssetGraph}. Each kind only carries the state meaningful for it.
 *
 * <p>The last known digest is empty when the content was never hashed.
 */
public abstract sealed class AssetNode
    permits SourceAssetNode, InternalAssetNode, GeneratedAssetNode, BuilderOptionsAssetNode {

    private final AssetId id;
    private Optional<Digest> lastKnownDigest;

    AssetNode(AssetId id, Optional<Digest> lastKnownDigest) {
        this.id = Objects.requireNonNull(id, "id");
        this.lastKnownDigest = Objects.requireNonNull(lastKnownDigest, "lastKnownDigest");
    }

    public AssetId id() {
        return id;
    }

    public Optional<Digest> lastKnownDigest() {
        return lastKnownDigest;
    }

    public void setLastKnownDigest(Optional<Digest> digest) {
        this.lastKnownDigest = Objects.requireNonNull(digest, "digest");
    }

    /** Whether a builder may read this node's content. */
    public abstract boolean isReadable();

    /** Whether this node may act as the primary input of a build phase. */
    public abstract boolean isValidInput();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + id + ")";
    }
}
