package work.lcod.build.support;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import work.lcod.build.config.BuildAction;
import work.lcod.build.generate.BuildOptions;
import work.lcod.build.generate.StreamTerminal;
import work.lcod.build.packages.PackageGraph;
import work.lcod.build.packages.PackageGraphLoader;

/**
 * Helpers to lay out small workspaces on disk for preparation tests.
 */
public final class Workspaces {
    public static final String ROOT = "app";

    /** Runs tasks on the calling thread so tests stay deterministic. */
    public static final Executor DIRECT = Runnable::run;

    public static final String CODEGEN_BUILD_YAML = String.join("\n",
        "builders:",
        "  codegen:",
        "    build_extensions:",
        "      .dart: [.g.dart]",
        "phases:",
        "  - builder: \"|codegen\"",
        ""
    );

    private Workspaces() {}

    public static Path write(Path root, String relativePath, String contents) {
        Path target = root.resolve(relativePath);
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, contents);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return target;
    }

    /**
     * Writes a {@code packages.toml} for {@link #ROOT} with the given dependency name to relative path mapping.
     */
    public static void writeManifest(Path root, Map<String, String> dependencies) {
        var toml = new StringBuilder("[package]\nname = \"" + ROOT + "\"\n");
        if (!dependencies.isEmpty()) {
            toml.append("\n[dependencies]\n");
            dependencies.forEach((name, path) -> toml.append(name).append(" = \"").append(path).append("\"\n"));
        }
        write(root, "packages.toml", toml.toString());
    }

    /**
     * Root package with one codegen phase and a single {@code lib/a.dart} source.
     */
    public static PackageGraph codegenWorkspace(Path root) {
        writeManifest(root, Map.of());
        write(root, "build.yaml", CODEGEN_BUILD_YAML);
        write(root, "lib/a.dart", "class A {}");
        return PackageGraphLoader.load(root);
    }

    public static BuildAction codegenAction(String packageName) {
        return BuildAction.builder()
            .packageName(packageName)
            .builderKey(ROOT + "|codegen")
            .buildExtension(".dart", ".g.dart")
            .build();
    }

    public static List<BuildAction> codegenActions() {
        return List.of(codegenAction(ROOT));
    }

    public static BuildOptions.Builder options(PackageGraph packageGraph) {
        return BuildOptions.builder(packageGraph)
            .executor(DIRECT)
            .terminal(scriptedTerminal("", false, new ByteArrayOutputStream()));
    }

    public static StreamTerminal scriptedTerminal(String input, boolean interactive, ByteArrayOutputStream output) {
        return new StreamTerminal(
            new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
            new PrintStream(output, true, StandardCharsets.UTF_8),
            interactive
        );
    }
}
