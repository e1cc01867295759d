package work.lcod.build.packages;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One package of the workspace: its name, the directory holding its files, and whether it is the root package.
 */
public record PackageNode(String name, Path path, boolean isRoot) {
    /** Name of the virtual platform package. */
    public static final String SDK_PACKAGE = "$sdk";

    public PackageNode {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(path, "path");
        path = path.toAbsolutePath().normalize();
    }

    public boolean isSdk() {
        return SDK_PACKAGE.equals(name);
    }
}
