package work.lcod.build.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.build.asset.AssetId;
import work.lcod.build.support.Workspaces;

class PreparationRunnerTest {
    @TempDir
    Path tempDir;

    private final PreparationRunner runner = new PreparationRunner(
        Workspaces.scriptedTerminal("", false, new ByteArrayOutputStream()));

    private PreparationConfiguration.Builder configuration() {
        return PreparationConfiguration.builder().rootDirectory(tempDir).logLevel(LogLevel.WARN);
    }

    @Test
    void preparesAndPersistsTheGraph() {
        Workspaces.codegenWorkspace(tempDir);

        var first = runner.run(configuration().build());
        var second = runner.run(configuration().build());

        assertEquals(PreparationReport.Status.SUCCESS, first.status());
        var firstSummary = first.summary().orElseThrow();
        assertFalse(firstSummary.fromCache());
        assertEquals("app", firstSummary.rootPackage());
        assertEquals(1, firstSummary.buildActions());
        assertEquals(1, firstSummary.outputs());
        var secondSummary = second.summary().orElseThrow();
        assertTrue(secondSummary.fromCache());
        assertEquals(new PreparationReport.ChangeCounts(0, 0, 0), secondSummary.changes());
        assertTrue(Files.isRegularFile(tempDir.resolve(".lcod_build/asset_graph.json")));
    }

    @Test
    void skipsSavingWhenAsked() {
        Workspaces.codegenWorkspace(tempDir);
        var report = runner.run(configuration().saveGraph(false).build());
        assertEquals(PreparationReport.Status.SUCCESS, report.status());
        assertTrue(Files.notExists(tempDir.resolve(".lcod_build/asset_graph.json")));
    }

    @Test
    void reportsDeletedConflicts() {
        Workspaces.codegenWorkspace(tempDir);
        Workspaces.write(tempDir, "lib/a.g.dart", "// stale");

        var report = runner.run(configuration().deleteConflictingOutputs(true).build());

        assertEquals(PreparationReport.Status.SUCCESS, report.status());
        assertEquals(List.of(new AssetId("app", "lib/a.g.dart")), report.summary().orElseThrow().deleted());
        assertTrue(report.toPrettyJson().contains("\"app|lib/a.g.dart\""));
    }

    @Test
    void conflictsWithoutPermissionFail() {
        Workspaces.codegenWorkspace(tempDir);
        Workspaces.write(tempDir, "lib/a.g.dart", "// stale");

        var report = runner.run(configuration().build());

        assertEquals(PreparationReport.Status.FAILURE, report.status());
        assertEquals(1, report.status().exitCode());
        var failure = report.failure().orElseThrow();
        assertEquals(PreparationReport.Reason.CONFLICTING_OUTPUTS, failure.reason());
        assertEquals(List.of(new AssetId("app", "lib/a.g.dart")), failure.conflictingOutputs());
        assertTrue(failure.deletable());
    }

    @Test
    void missingManifestIsAFailureReport() {
        var report = runner.run(configuration().build());
        assertEquals(PreparationReport.Status.FAILURE, report.status());
        var failure = report.failure().orElseThrow();
        assertEquals(PreparationReport.Reason.WORKSPACE, failure.reason());
        assertTrue(failure.message().contains("Missing package manifest"));
        assertTrue(report.summary().isEmpty());
        assertTrue(report.toPrettyJson().contains("\"status\" : \"failure\""));
    }

    @Test
    void countsEditsSinceTheLastRun() {
        Workspaces.codegenWorkspace(tempDir);
        runner.run(configuration().build());
        Workspaces.write(tempDir, "lib/a.dart", "class A { int edited = 1; }");
        Workspaces.write(tempDir, "lib/b.dart", "class B {}");

        var report = runner.run(configuration().build());

        assertEquals(new PreparationReport.ChangeCounts(1, 0, 1), report.summary().orElseThrow().changes());
    }

    @Test
    void rejectedBuildActionIsNamedInTheFailure() {
        Path root = tempDir.resolve("app");
        Workspaces.writeManifest(root, Map.of("dep", "../dep"));
        Workspaces.write(tempDir, "dep/lib/d.dart", "class D {}");
        Workspaces.write(root, "build.yaml", Workspaces.CODEGEN_BUILD_YAML + "    target: dep\n");

        var report = runner.run(PreparationConfiguration.builder().rootDirectory(root).build());

        var failure = report.failure().orElseThrow();
        assertEquals(PreparationReport.Reason.INVALID_BUILD_ACTION, failure.reason());
        assertEquals(Optional.of("app|codegen on dep"), failure.buildAction());
    }

    @Test
    void parsesLogLevels() {
        assertEquals(LogLevel.DEBUG, LogLevel.from("debug"));
        assertEquals(LogLevel.INFO, LogLevel.from(null));
        assertEquals(LogLevel.OFF, LogLevel.from(" OFF "));
    }
}
