package work.lcod.build.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import work.lcod.build.api.LogLevel;
import work.lcod.build.graph.AssetGraph;
import work.lcod.build.support.Workspaces;

class PrepareCommandTest {
    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    @Test
    void printsSuccessReport() {
        Workspaces.codegenWorkspace(tempDir);

        int exitCode = run("--root", tempDir.toString(), "--log-level", "warn");

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("\"status\" : \"success\""));
        assertTrue(Files.isRegularFile(tempDir.resolve(".lcod_build/asset_graph.json")));
    }

    @Test
    void noSaveGraphLeavesNoGraphBehind() {
        Workspaces.codegenWorkspace(tempDir);

        assertEquals(0, run("--root", tempDir.toString(), "--no-save-graph", "--log-level", "warn"));
        assertTrue(Files.notExists(tempDir.resolve(".lcod_build/asset_graph.json")));
    }

    @Test
    void conflictsFailWithAHint() {
        Workspaces.codegenWorkspace(tempDir);
        Workspaces.write(tempDir, "lib/a.g.dart", "// stale");

        int exitCode = run("--root", tempDir.toString(), "--log-level", "warn");

        assertEquals(1, exitCode);
        assertTrue(out.toString().contains("\"status\" : \"failure\""));
        assertTrue(err.toString().contains("app|lib/a.g.dart"));
        assertTrue(err.toString().contains(ShortErrorHandler.DELETE_HINT));
    }

    @Test
    void dependencyConflictsGetNoDeleteHint() {
        Path root = tempDir.resolve("app");
        Workspaces.writeManifest(root, Map.of("dep", "../dep"));
        Workspaces.write(tempDir, "dep/lib/d.dart", "class D {}");
        Workspaces.write(tempDir, "dep/lib/d.g.dart", "// checked in");
        Workspaces.write(root, "build.yaml", Workspaces.CODEGEN_BUILD_YAML + "    target: dep\n    hide_output: true\n");

        int exitCode = run("--root", root.toString(), "--delete-conflicting-outputs", "--log-level", "warn");

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("dep|lib/d.g.dart"));
        assertFalse(err.toString().contains("--delete-conflicting-outputs"));
        assertTrue(Files.exists(tempDir.resolve("dep/lib/d.g.dart")));
    }

    @Test
    void invalidBuildActionIsExplained() {
        Path root = tempDir.resolve("app");
        Workspaces.writeManifest(root, Map.of("dep", "../dep"));
        Workspaces.write(tempDir, "dep/lib/d.dart", "class D {}");
        Workspaces.write(root, "build.yaml", Workspaces.CODEGEN_BUILD_YAML + "    target: dep\n");

        assertEquals(1, run("--root", root.toString(), "--log-level", "warn"));
        assertTrue(err.toString().contains("Invalid build action app|codegen on dep"));
    }

    @Test
    void versionNamesTheGraphFormat() {
        assertEquals(0, run("--version"));
        assertTrue(out.toString().contains("asset graph format v" + AssetGraph.VERSION));
    }

    @Test
    void deleteConflictingOutputsFlagRemovesThem() {
        Workspaces.codegenWorkspace(tempDir);
        Path stale = Workspaces.write(tempDir, "lib/a.g.dart", "// stale");

        assertEquals(0, run("--root", tempDir.toString(), "--delete-conflicting-outputs", "--log-level", "warn"));
        assertTrue(Files.notExists(stale));
    }

    @Test
    void rejectsUnknownLogLevel() {
        Workspaces.codegenWorkspace(tempDir);
        assertEquals(CommandLine.ExitCode.USAGE, run("--root", tempDir.toString(), "--log-level", "loud"));
        assertTrue(err.toString().contains("Unsupported log level"));
    }

    @Test
    void mapsLogLevelsToLogback() {
        assertEquals(ch.qos.logback.classic.Level.OFF, LogLevels.toLogback(LogLevel.OFF));
        assertEquals(ch.qos.logback.classic.Level.DEBUG, LogLevels.toLogback(LogLevel.DEBUG));
    }
}
