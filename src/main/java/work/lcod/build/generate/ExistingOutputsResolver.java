package work.lcod.build.generate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.build.asset.AssetId;
import work.lcod.build.asset.AssetWriter;
import work.lcod.build.shared.BuildPaths;

/**
 * Decides what happens to declared outputs that already exist before the first build: delete them by policy, ask
 * the user, or refuse to continue.
 */
public final class ExistingOutputsResolver {
    static final String PROMPT = "Delete these files (y/n) (or list them (l))?: ";

    enum State {
        PROMPTING,
        RESOLVED_DELETE,
        RESOLVED_ABORT
    }

    private final AssetWriter writer;
    private final Terminal terminal;
    private final OnDelete onDelete;
    private final Logger logger;

    public ExistingOutputsResolver(AssetWriter writer, Terminal terminal, OnDelete onDelete) {
        this(writer, terminal, onDelete, LoggerFactory.getLogger(ExistingOutputsResolver.class));
    }

    public ExistingOutputsResolver(AssetWriter writer, Terminal terminal, OnDelete onDelete, Logger logger) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.terminal = Objects.requireNonNull(terminal, "terminal");
        this.onDelete = Objects.requireNonNull(onDelete, "onDelete");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /**
     * Resolves {@code conflictingOutputs}; returns normally only once they were deleted.
     *
     * @throws UnexpectedExistingOutputsException when the outputs must stay and the build cannot proceed
     */
    public void resolve(Set<AssetId> conflictingOutputs, boolean deleteFilesByDefault, boolean assumeTty) {
        if (conflictingOutputs.isEmpty()) {
            return;
        }
        if (deleteFilesByDefault) {
            logger.info("Deleting {} declared outputs which already existed on disk.", conflictingOutputs.size());
            deleteAll(conflictingOutputs);
            return;
        }

        logger.info("Found {} declared outputs which already exist on disk. This is likely because the `{}` folder "
            + "was deleted, or you are submitting generated files to your source repository.",
            conflictingOutputs.size(), BuildPaths.CACHE_DIR);

        if (!assumeTty && !terminal.isInteractive()) {
            throw UnexpectedExistingOutputsException.inRootPackage(conflictingOutputs);
        }

        terminal.println();
        State state = State.PROMPTING;
        while (state == State.PROMPTING) {
            terminal.print(System.lineSeparator() + PROMPT);
            state = next(terminal.readLine(), conflictingOutputs);
        }
        if (state == State.RESOLVED_ABORT) {
            throw UnexpectedExistingOutputsException.inRootPackage(conflictingOutputs);
        }
        terminal.println("Deleting files...");
        deleteAll(conflictingOutputs);
    }

    private State next(String input, Set<AssetId> conflictingOutputs) {
        if (input == null) {
            return State.RESOLVED_ABORT;
        }
        switch (input.trim().toLowerCase(Locale.ROOT)) {
            case "y":
                return State.RESOLVED_DELETE;
            case "n":
                return State.RESOLVED_ABORT;
            case "l":
                for (AssetId output : new TreeSet<>(conflictingOutputs)) {
                    terminal.println(output.toString());
                }
                return State.PROMPTING;
            default:
                terminal.println("Unrecognized option " + input + ", (y/n/l) expected.");
                return State.PROMPTING;
        }
    }

    private void deleteAll(Set<AssetId> ids) {
        for (AssetId id : ids) {
            onDelete.onDelete(id);
            try {
                writer.delete(id);
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to delete existing output " + id, ex);
            }
        }
    }
}
