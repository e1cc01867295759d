package work.lcod.build.graph;

import java.util.Objects;
import java.util.Optional;
import work.lcod.build.asset.AssetId;
import work.lcod.build.asset.Digest;

/**
 * A declared output of one build phase.
 *
 * <p>{@code wasOutput} is only true once the phase actually emitted the file; declared outputs that were never
 * written do not exist on disk.
 */
public final class GeneratedAssetNode extends AssetNode {
    private final int phaseNumber;
    private final AssetId primaryInput;
    private final boolean hidden;
    private boolean wasOutput;
    private boolean needsUpdate;

    public GeneratedAssetNode(
        AssetId id,
        Optional<Digest> lastKnownDigest,
        int phaseNumber,
        AssetId primaryInput,
        boolean hidden,
        boolean wasOutput,
        boolean needsUpdate
    ) {
        super(id, lastKnownDigest);
        if (phaseNumber < 0) {
            throw new IllegalArgumentException("Negative phase for " + id);
        }
        this.phaseNumber = phaseNumber;
        this.primaryInput = Objects.requireNonNull(primaryInput, "primaryInput");
        this.hidden = hidden;
        this.wasOutput = wasOutput;
        this.needsUpdate = needsUpdate;
    }

    public int phaseNumber() {
        return phaseNumber;
    }

    public AssetId primaryInput() {
        return primaryInput;
    }

    public boolean isHidden() {
        return hidden;
    }

    public boolean wasOutput() {
        return wasOutput;
    }

    public void setWasOutput(boolean wasOutput) {
        this.wasOutput = wasOutput;
    }

    public boolean needsUpdate() {
        return needsUpdate;
    }

    public void setNeedsUpdate(boolean needsUpdate) {
        this.needsUpdate = needsUpdate;
    }

    @Override
    public boolean isReadable() {
        return wasOutput;
    }

    @Override
    public boolean isValidInput() {
        return true;
    }
}
