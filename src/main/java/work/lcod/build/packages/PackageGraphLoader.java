package work.lcod.build.packages;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Derives a {@link PackageGraph} from the root package's {@code packages.toml} manifest.
 *
 * <pre>
 * [package]
 * name = "app"
 *
 * [dependencies]
 * dep = "../dep"
 *
 * [sdk]
 * path = "/opt/sdk"
 * </pre>
 *
 * Dependency and sdk paths are resolved against the directory holding the manifest.
 */
public final class PackageGraphLoader {
    public static final String MANIFEST_FILE = "packages.toml";

    private PackageGraphLoader() {}

    public static PackageGraph load(Path rootDirectory) {
        Path manifestPath = rootDirectory.resolve(MANIFEST_FILE);
        if (!Files.isRegularFile(manifestPath)) {
            throw new IllegalStateException("Missing package manifest: " + manifestPath);
        }
        TomlParseResult result;
        try {
            result = Toml.parse(Files.readString(manifestPath));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read package manifest: " + manifestPath, ex);
        }
        if (result.hasErrors()) {
            String errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalStateException("Invalid package manifest " + manifestPath + ": " + errors);
        }
        return fromToml(rootDirectory, result);
    }

    public static PackageGraph fromToml(Path rootDirectory, TomlParseResult manifest) {
        String rootName = Optional.ofNullable(manifest.getString("package.name"))
            .filter(name -> !name.isBlank())
            .orElseThrow(() -> new IllegalStateException("packages.toml must declare [package] name"));
        var root = new PackageNode(rootName, rootDirectory, true);

        Map<String, PackageNode> dependencies = new LinkedHashMap<>();
        TomlTable table = manifest.getTable("dependencies");
        if (table != null) {
            for (String name : table.keySet()) {
                String location = table.getString(name);
                if (location == null || location.isBlank()) {
                    throw new IllegalStateException("Dependency " + name + " must map to a directory path");
                }
                dependencies.put(name, new PackageNode(name, rootDirectory.resolve(location), false));
            }
        }
        String sdkPath = manifest.getString("sdk.path");
        if (sdkPath != null && !sdkPath.isBlank()) {
            dependencies.put(PackageNode.SDK_PACKAGE, new PackageNode(PackageNode.SDK_PACKAGE, rootDirectory.resolve(sdkPath), false));
        }
        return new PackageGraph(root, dependencies);
    }
}
