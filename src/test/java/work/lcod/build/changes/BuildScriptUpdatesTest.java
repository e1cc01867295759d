package work.lcod.build.changes;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.lcod.build.asset.AssetId;
import work.lcod.build.graph.AssetGraph;
import work.lcod.build.packages.PackageGraph;
import work.lcod.build.packages.PackageNode;
import work.lcod.build.support.InMemoryAssets;
import work.lcod.build.support.Workspaces;

class BuildScriptUpdatesTest {
    private static final AssetId SOURCE = new AssetId("app", "lib/a.dart");
    private static final AssetId BUILD_YAML = new AssetId("app", "build.yaml");
    private static final AssetId ENTRYPOINT = new AssetId("app", ".lcod_build/entrypoint/build.dart");

    private final PackageGraph packageGraph = new PackageGraph(new PackageNode("app", Path.of("app"), true), Map.of());
    private AssetGraph graph;

    @BeforeEach
    void setUp() throws Exception {
        var assets = new InMemoryAssets("app")
            .put(SOURCE, "a")
            .put(BUILD_YAML, Workspaces.CODEGEN_BUILD_YAML)
            .put(ENTRYPOINT, "main() {}");
        graph = AssetGraph.build(Workspaces.codegenActions(), Set.of(SOURCE, BUILD_YAML), Set.of(ENTRYPOINT), packageGraph, assets);
    }

    @Test
    void tracksBuildConfigurationAndInternalAssets() {
        var updates = TrackedBuildScriptUpdates.create("app", graph);
        assertTrue(updates.buildScriptInputs().containsAll(Set.of(BUILD_YAML, ENTRYPOINT)));
        assertTrue(updates.hasBeenUpdated(Set.of(BUILD_YAML)));
        assertTrue(updates.hasBeenUpdated(Set.of(SOURCE, ENTRYPOINT)));
        assertFalse(updates.hasBeenUpdated(Set.of(SOURCE)));
        assertFalse(updates.hasBeenUpdated(Set.of()));
    }

    @Test
    void newBuildScriptFilesCountByLocation() {
        var updates = TrackedBuildScriptUpdates.create("app", graph);
        assertTrue(updates.hasBeenUpdated(Set.of(new AssetId("app", "packages.toml"))));
        assertTrue(updates.hasBeenUpdated(Set.of(new AssetId("app", ".lcod_build/entrypoint/extra.dart"))));
        assertFalse(updates.hasBeenUpdated(Set.of(new AssetId("dep", "build.yaml"))));
    }

    @Test
    void skippingTheCheckNeverReportsUpdates() {
        var options = Workspaces.options(packageGraph).skipBuildScriptCheck(true).build();
        assertFalse(BuildScriptUpdates.create(options, graph).hasBeenUpdated(Set.of(BUILD_YAML)));

        var checked = Workspaces.options(packageGraph).build();
        assertTrue(BuildScriptUpdates.create(checked, graph).hasBeenUpdated(Set.of(BUILD_YAML)));
    }
}
