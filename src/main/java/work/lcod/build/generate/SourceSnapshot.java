package work.lcod.build.generate;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import work.lcod.build.asset.AssetId;

/**
 * The three populations of assets found on disk at the start of a pass.
 */
public record SourceSnapshot(Set<AssetId> inputSources, Set<AssetId> cacheDirSources, Set<AssetId> internalSources) {
    public SourceSnapshot {
        inputSources = Collections.unmodifiableSet(new LinkedHashSet<>(inputSources));
        cacheDirSources = Collections.unmodifiableSet(new LinkedHashSet<>(cacheDirSources));
        internalSources = Collections.unmodifiableSet(new LinkedHashSet<>(internalSources));
    }

    public Set<AssetId> allSources() {
        Set<AssetId> all = new LinkedHashSet<>(inputSources);
        all.addAll(cacheDirSources);
        all.addAll(internalSources);
        return all;
    }
}
