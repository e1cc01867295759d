package work.lcod.build.generate;

import work.lcod.build.asset.AssetId;

/**
 * Observer notified once for every asset deleted during preparation.
 */
@FunctionalInterface
public interface OnDelete {
    OnDelete NONE = id -> {};

    void onDelete(AssetId id);
}
