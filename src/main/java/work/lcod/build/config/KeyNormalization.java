package work.lcod.build.config;

/**
 * Turns the short builder and target names used in {@code build.yaml} into globally unique keys.
 *
 * <p>Builder keys use {@code |} as separator ({@code my_package|my_builder}), target keys use {@code :}
 * ({@code my_package:my_target}).
 */
public final class KeyNormalization {
    private static final String BUILDER_SEPARATOR = "|";
    private static final String TARGET_SEPARATOR = ":";

    private KeyNormalization() {}

    public static String normalizeBuilderKeyDefinition(String builderKey, String packageName) {
        return normalizeDefinition(builderKey, packageName, BUILDER_SEPARATOR);
    }

    public static String normalizeBuilderKeyUsage(String builderKey, String packageName) {
        return normalizeUsage(builderKey, packageName, BUILDER_SEPARATOR);
    }

    public static String normalizeTargetKeyDefinition(String targetKey, String packageName) {
        return normalizeDefinition(targetKey, packageName, TARGET_SEPARATOR);
    }

    public static String normalizeTargetKeyUsage(String targetKey, String packageName) {
        return normalizeUsage(targetKey, packageName, TARGET_SEPARATOR);
    }

    /**
     * Full key for {@code name} referenced from {@code packageName}.
     *
     * <p>A name without separator refers to the builder or target named after a package, so a reference to
     * {@code codegen} means {@code codegen|codegen}. A name starting with the separator refers to something in the
     * referencing package.
     */
    private static String normalizeUsage(String name, String packageName, String separator) {
        if (name.startsWith(separator)) {
            return packageName + name;
        }
        if (!name.contains(separator)) {
            return name + separator + name;
        }
        return name;
    }

    /**
     * Full key for {@code name} defined inside {@code packageName}; always {@code packageName + separator + name}.
     */
    private static String normalizeDefinition(String name, String packageName, String separator) {
        if (name.startsWith(separator)) {
            return packageName + name;
        }
        if (!name.contains(separator)) {
            return packageName + separator + name;
        }
        return name;
    }
}
