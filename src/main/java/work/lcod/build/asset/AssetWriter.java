package work.lcod.build.asset;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Write access to assets. Deleting an asset that does not exist is not an error.
 */
public interface AssetWriter {
    void writeAsBytes(AssetId id, byte[] bytes) throws IOException;

    default void writeAsString(AssetId id, String contents) throws IOException {
        writeAsBytes(id, contents.getBytes(StandardCharsets.UTF_8));
    }

    void delete(AssetId id) throws IOException;
}
