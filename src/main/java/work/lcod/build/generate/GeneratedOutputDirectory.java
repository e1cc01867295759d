package work.lcod.build.generate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import work.lcod.build.packages.PackageGraph;
import work.lcod.build.shared.BuildPaths;

/**
 * The root package's generated output directory. Whenever a graph is thrown away its outputs go with it.
 */
final class GeneratedOutputDirectory {
    private final Path directory;

    GeneratedOutputDirectory(PackageGraph packageGraph) {
        this.directory = packageGraph.root().path().resolve(BuildPaths.GENERATED_OUTPUT_DIRECTORY);
    }

    Path path() {
        return directory;
    }

    /**
     * Deletes the directory recursively; returns whether anything was there.
     */
    boolean delete() {
        if (!Files.exists(directory)) {
            return false;
        }
        List<Path> entries;
        try (Stream<Path> walk = Files.walk(directory)) {
            entries = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list generated output directory " + directory, ex);
        }
        for (Path entry : entries) {
            try {
                Files.deleteIfExists(entry);
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to delete " + entry, ex);
            }
        }
        return true;
    }
}
