package work.lcod.build.asset;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.Set;

/**
 * Content-addressable read access to assets.
 */
public interface AssetReader {
    boolean canRead(AssetId id);

    byte[] readAsBytes(AssetId id) throws IOException;

    default String readAsString(AssetId id) throws IOException {
        return new String(readAsBytes(id), StandardCharsets.UTF_8);
    }

    default Digest digest(AssetId id) throws IOException {
        return Digest.of(readAsBytes(id));
    }

    /**
     * Lists the assets matching {@code glob}, either inside {@code packageName} or, when empty, inside the root package.
     */
    Set<AssetId> findAssets(AssetGlob glob, Optional<String> packageName) throws IOException;

    default Set<AssetId> findAssets(AssetGlob glob) throws IOException {
        return findAssets(glob, Optional.empty());
    }
}
