package work.lcod.build.packages;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * All packages visible to a build, keyed by name, with exactly one root.
 */
public final class PackageGraph {
    private final PackageNode root;
    private final Map<String, PackageNode> allPackages;

    public PackageGraph(PackageNode root, Map<String, PackageNode> dependencies) {
        this.root = Objects.requireNonNull(root, "root");
        if (!root.isRoot()) {
            throw new IllegalArgumentException("Package " + root.name() + " is not marked as root");
        }
        var packages = new LinkedHashMap<String, PackageNode>();
        packages.put(root.name(), root);
        for (var dependency : dependencies.values()) {
            if (dependency.isRoot()) {
                throw new IllegalArgumentException("Dependency " + dependency.name() + " cannot be a root package");
            }
            if (packages.putIfAbsent(dependency.name(), dependency) != null) {
                throw new IllegalArgumentException("Duplicate package name: " + dependency.name());
            }
        }
        this.allPackages = Collections.unmodifiableMap(packages);
    }

    public PackageNode root() {
        return root;
    }

    public Map<String, PackageNode> allPackages() {
        return allPackages;
    }

    public Optional<PackageNode> get(String name) {
        return Optional.ofNullable(allPackages.get(name));
    }

    public PackageNode require(String name) {
        return get(name).orElseThrow(() -> new IllegalArgumentException("Unknown package: " + name));
    }
}
