package work.lcod.build.asset;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Objects;

/**
 * A package-relative glob such as {@code lib/**} or {@code lib/dev_compiler/**.js}.
 */
public final class AssetGlob {
    private final String pattern;
    private final PathMatcher matcher;

    public AssetGlob(String pattern) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
    }

    public String pattern() {
        return pattern;
    }

    public boolean matches(String relativePath) {
        return matcher.matches(Path.of(relativePath));
    }

    public boolean isLiteral() {
        return firstWildcard(pattern) < 0;
    }

    /**
     * The leading directory portion without wildcards, used to avoid walking whole packages.
     */
    public String literalPrefix() {
        int wildcard = firstWildcard(pattern);
        if (wildcard < 0) {
            int slash = pattern.lastIndexOf('/');
            return slash < 0 ? "" : pattern.substring(0, slash);
        }
        int slash = pattern.lastIndexOf('/', wildcard);
        return slash < 0 ? "" : pattern.substring(0, slash);
    }

    private static int firstWildcard(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '*' || c == '?' || c == '[' || c == '{') {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return pattern;
    }
}
