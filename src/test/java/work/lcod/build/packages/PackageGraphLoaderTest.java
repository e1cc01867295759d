package work.lcod.build.packages;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.build.support.Workspaces;

class PackageGraphLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void loadsRootDependenciesAndSdk() {
        Path root = tempDir.resolve("app");
        Workspaces.write(root, "packages.toml", String.join("\n",
            "[package]",
            "name = \"app\"",
            "",
            "[dependencies]",
            "dep = \"../dep\"",
            "",
            "[sdk]",
            "path = \"../sdk\"",
            ""
        ));

        PackageGraph graph = PackageGraphLoader.load(root);

        assertEquals("app", graph.root().name());
        assertTrue(graph.root().isRoot());
        assertEquals(tempDir.resolve("dep").toAbsolutePath().normalize(), graph.require("dep").path());
        assertFalse(graph.require("dep").isRoot());
        assertTrue(graph.require(PackageNode.SDK_PACKAGE).isSdk());
        assertEquals(3, graph.allPackages().size());
    }

    @Test
    void failsWithoutManifest() {
        var ex = assertThrows(IllegalStateException.class, () -> PackageGraphLoader.load(tempDir));
        assertTrue(ex.getMessage().contains("Missing package manifest"));
    }

    @Test
    void failsWithoutPackageName() {
        Workspaces.write(tempDir, "packages.toml", "[dependencies]\ndep = \"../dep\"\n");
        assertThrows(IllegalStateException.class, () -> PackageGraphLoader.load(tempDir));
    }

    @Test
    void reportsTomlSyntaxErrors() {
        Workspaces.write(tempDir, "packages.toml", "[package\nname = ");
        var ex = assertThrows(IllegalStateException.class, () -> PackageGraphLoader.load(tempDir));
        assertTrue(ex.getMessage().contains("Invalid package manifest"));
    }

    @Test
    void graphRejectsDuplicateRoots() {
        var root = new PackageNode("app", tempDir, true);
        var other = new PackageNode("other", tempDir, true);
        assertThrows(IllegalArgumentException.class, () -> new PackageGraph(root, Map.of("other", other)));
        assertThrows(IllegalArgumentException.class, () -> new PackageGraph(root, Map.of()).require("missing"));
    }
}
