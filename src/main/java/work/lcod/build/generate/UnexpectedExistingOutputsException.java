package work.lcod.build.generate;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import work.lcod.build.asset.AssetId;

/**
 * Declared outputs already exist on disk and may not be overwritten.
 *
 * <p>Only conflicts inside the root package can be cleared by deleting the files; outputs that collide in a dependency
 * package are never deleted by the build.
 */
public final class UnexpectedExistingOutputsException extends BuildPreparationException {
    private final Set<AssetId> conflictingOutputs;
    private final boolean deletable;

    private UnexpectedExistingOutputsException(Set<AssetId> conflictingOutputs, boolean deletable) {
        super(describe(conflictingOutputs, deletable));
        this.conflictingOutputs = Collections.unmodifiableSet(new TreeSet<>(conflictingOutputs));
        this.deletable = deletable;
    }

    /** Conflicts in the root package, which a delete policy or a prompt may clear. */
    public static UnexpectedExistingOutputsException inRootPackage(Set<AssetId> conflictingOutputs) {
        return new UnexpectedExistingOutputsException(conflictingOutputs, true);
    }

    /** Conflicts in dependency packages; no policy resolves these. */
    public static UnexpectedExistingOutputsException inDependencies(Set<AssetId> conflictingOutputs) {
        return new UnexpectedExistingOutputsException(conflictingOutputs, false);
    }

    public Set<AssetId> conflictingOutputs() {
        return conflictingOutputs;
    }

    /** Whether rerunning with conflicting outputs deleted would get past this failure. */
    public boolean deletable() {
        return deletable;
    }

    private static String describe(Set<AssetId> ids, boolean deletable) {
        String listing = new TreeSet<>(ids).stream().map(id -> "  " + id).collect(Collectors.joining("\n"));
        String advice = deletable
            ? "Delete them, or rerun with --delete-conflicting-outputs."
            : "They belong to dependency packages and are never deleted by the build; remove them from those packages.";
        return "Found " + ids.size() + " declared outputs which already exist on disk:\n" + listing + "\n" + advice;
    }
}
