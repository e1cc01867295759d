package work.lcod.build.asset;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.build.packages.PackageGraph;
import work.lcod.build.packages.PackageNode;
import work.lcod.build.support.Workspaces;

class FileBasedAssetReaderTest {
    @TempDir
    Path tempDir;

    private PackageGraph graph() {
        var root = new PackageNode("app", tempDir.resolve("app"), true);
        var dep = new PackageNode("dep", tempDir.resolve("dep"), false);
        return new PackageGraph(root, Map.of("dep", dep));
    }

    @Test
    void findsAssetsInRequestedPackage() throws Exception {
        Workspaces.write(tempDir, "app/lib/a.dart", "a");
        Workspaces.write(tempDir, "app/lib/src/b.dart", "b");
        Workspaces.write(tempDir, "app/test/a_test.dart", "t");
        Workspaces.write(tempDir, "dep/lib/d.dart", "d");
        var reader = new FileBasedAssetReader(graph());

        assertEquals(
            Set.of(new AssetId("app", "lib/a.dart"), new AssetId("app", "lib/src/b.dart")),
            reader.findAssets(new AssetGlob("lib/**"))
        );
        assertEquals(
            Set.of(new AssetId("dep", "lib/d.dart")),
            reader.findAssets(new AssetGlob("lib/**"), Optional.of("dep"))
        );
    }

    @Test
    void literalGlobOnlyMatchesExistingFile() throws Exception {
        Workspaces.write(tempDir, "app/build.yaml", "phases: []");
        var reader = new FileBasedAssetReader(graph());
        assertEquals(Set.of(new AssetId("app", "build.yaml")), reader.findAssets(new AssetGlob("build.yaml")));
        assertTrue(reader.findAssets(new AssetGlob("packages.toml")).isEmpty());
    }

    @Test
    void missingDirectoryYieldsNothing() throws Exception {
        Files.createDirectories(tempDir.resolve("app"));
        assertTrue(new FileBasedAssetReader(graph()).findAssets(new AssetGlob("web/**")).isEmpty());
    }

    @Test
    void readsAndDigestsContent() throws Exception {
        Workspaces.write(tempDir, "app/lib/a.dart", "hello");
        var reader = new FileBasedAssetReader(graph());
        var id = new AssetId("app", "lib/a.dart");
        assertTrue(reader.canRead(id));
        assertArrayEquals("hello".getBytes(StandardCharsets.UTF_8), reader.readAsBytes(id));
        assertEquals(Digest.of("hello"), reader.digest(id));
        assertFalse(reader.canRead(new AssetId("app", "lib/missing.dart")));
        assertFalse(reader.canRead(new AssetId("unknown", "lib/a.dart")));
    }

    @Test
    void rejectsPathsEscapingThePackage() {
        var reader = new FileBasedAssetReader(graph());
        assertThrows(IllegalArgumentException.class, () -> reader.readAsBytes(new AssetId("app", "../dep/lib/d.dart")));
    }

    @Test
    void writerCreatesParentsAndDeletesQuietly() throws Exception {
        var writer = new FileBasedAssetWriter(graph());
        var id = new AssetId("app", ".lcod_build/generated/dep/lib/d.g.dart");
        writer.writeAsString(id, "generated");
        assertEquals("generated", Files.readString(tempDir.resolve("app").resolve(id.path())));

        writer.delete(id);
        writer.delete(id);
        assertFalse(Files.exists(tempDir.resolve("app").resolve(id.path())));
    }
}
