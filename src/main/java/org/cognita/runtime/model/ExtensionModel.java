package org.cognita.runtime.model;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A behavior model that replaces the default flow of one continuation point of a parent model.
 * <p>
 * The extension is evaluated into the parent's output vector; it is attached to at most one
 * pending continuation and consumed once.
 */
public class ExtensionModel extends BehaviorModel {

    private final UUID parentModelId;
    private final int attachPointHash;

    public ExtensionModel(UUID id, int version, byte[] code, StateSchema schema, double[] constants,
                          List<String> strings, int maxStackDepth, int localCount, int maxCallDepth,
                          List<ContinuationPoint> continuationPoints, UUID parentModelId, int attachPointHash) {
        super(id, version, code, schema, constants, strings, maxStackDepth, localCount, maxCallDepth, continuationPoints);
        this.parentModelId = Objects.requireNonNull(parentModelId, "parentModelId");
        this.attachPointHash = attachPointHash;
    }

    public UUID getParentModelId() {
        return parentModelId;
    }

    public int getAttachPointHash() {
        return attachPointHash;
    }

    /**
     * Checks whether this extension targets the given continuation point of the given model.
     * @param parent The parent model.
     * @param point The continuation point.
     * @return true if the parent id and the attach hash match and every output this extension
     * writes exists in the parent's output vector.
     */
    public boolean targets(BehaviorModel parent, ContinuationPoint point) {
        return parentModelId.equals(parent.getId())
                && attachPointHash == point.nameHash()
                && getSchema().outputCount() <= parent.getSchema().outputCount();
    }

    @Override
    public boolean isExtension() {
        return true;
    }

    @Override
    public boolean contentEquals(BehaviorModel other) {
        return super.contentEquals(other)
                && other instanceof ExtensionModel ext
                && parentModelId.equals(ext.parentModelId)
                && attachPointHash == ext.attachPointHash;
    }
}
