package work.lcod.build.shared;

import java.util.List;
import work.lcod.build.asset.AssetId;

/**
 * Reserved locations inside the root package. All paths are package-relative.
 */
public final class BuildPaths {
    private BuildPaths() {}

    public static final String CACHE_DIR = ".lcod_build";

    /** Flat namespace of hidden generated outputs, laid out as {@code <package>/<path>}. */
    public static final String GENERATED_OUTPUT_DIRECTORY = CACHE_DIR + "/generated";

    public static final String ENTRY_POINT_DIR = CACHE_DIR + "/entrypoint";

    public static final String ASSET_GRAPH_PATH = CACHE_DIR + "/asset_graph.json";

    public static final String BUILD_CONFIG_FILE = "build.yaml";

    public static final String PACKAGE_MANIFEST_FILE = "packages.toml";

    public static final List<String> ROOT_PACKAGE_FILES_WHITELIST = List.of(
        "benchmark/**",
        "bin/**",
        "example/**",
        "lib/**",
        "src/**",
        "test/**",
        "tool/**",
        "web/**",
        BUILD_CONFIG_FILE,
        PACKAGE_MANIFEST_FILE
    );

    public static final List<String> SDK_PACKAGE_INCLUDES = List.of("lib/dev_compiler/**.js");

    public static final List<String> DEPENDENCY_PACKAGE_INCLUDES = List.of("lib/**");

    public static AssetId assetGraphId(String rootPackage) {
        return new AssetId(rootPackage, ASSET_GRAPH_PATH);
    }

    /**
     * Root package files whose edits change how the build itself is configured.
     */
    public static boolean isBuildScriptInput(AssetId id, String rootPackage) {
        return id.packageName().equals(rootPackage)
            && (BUILD_CONFIG_FILE.equals(id.path()) || PACKAGE_MANIFEST_FILE.equals(id.path()));
    }

    /**
     * Location of a hidden output inside the root package's generated directory.
     */
    public static AssetId generatedLocation(AssetId output, String rootPackage) {
        return new AssetId(rootPackage, GENERATED_OUTPUT_DIRECTORY + "/" + output.packageName() + "/" + output.path());
    }
}
