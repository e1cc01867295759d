package work.lcod.build.asset;

import java.util.Objects;

/**
 * Globally unique name of one file-like unit: the owning package plus a {@code /}-separated path within it.
 */
public record AssetId(String packageName, String path) implements Comparable<AssetId> {
    private static final String SEPARATOR = "|";

    public AssetId {
        Objects.requireNonNull(packageName, "packageName");
        Objects.requireNonNull(path, "path");
        if (packageName.isBlank()) {
            throw new IllegalArgumentException("Asset package name must not be blank");
        }
        path = path.replace('\\', '/');
        while (path.startsWith("./")) {
            path = path.substring(2);
        }
        if (path.isBlank()) {
            throw new IllegalArgumentException("Asset path must not be blank for package " + packageName);
        }
    }

    /**
     * Parses the {@code package|path} form produced by {@link #toString()}.
     */
    public static AssetId parse(String serialized) {
        if (serialized == null) {
            throw new IllegalArgumentException("Asset id must not be null");
        }
        int separator = serialized.indexOf(SEPARATOR);
        if (separator <= 0 || separator == serialized.length() - 1) {
            throw new IllegalArgumentException("Invalid asset id (expected package|path): " + serialized);
        }
        return new AssetId(serialized.substring(0, separator), serialized.substring(separator + 1));
    }

    public String extension() {
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        return dot > slash ? path.substring(dot) : "";
    }

    public AssetId changeExtension(String oldExtension, String newExtension) {
        if (!path.endsWith(oldExtension)) {
            throw new IllegalArgumentException(this + " does not end with " + oldExtension);
        }
        return new AssetId(packageName, path.substring(0, path.length() - oldExtension.length()) + newExtension);
    }

    @Override
    public int compareTo(AssetId other) {
        int byPackage = packageName.compareTo(other.packageName);
        return byPackage != 0 ? byPackage : path.compareTo(other.path);
    }

    @Override
    public String toString() {
        return packageName + SEPARATOR + path;
    }
}
