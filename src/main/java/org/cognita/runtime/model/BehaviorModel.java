package org.cognita.runtime.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * An immutable, compiled behavior model evaluated by the {@code VirtualMachine}.
 * <p>
 * Holds the bytecode together with everything it indexes: the state schema, the constant
 * pool, the string table and the continuation-point table, plus the resource limits the
 * VM pre-sizes its scratch space from. Array accessors return copies; a model instance
 * can be shared freely between threads.
 */
public class BehaviorModel {

    private final UUID id;
    private final int version;
    private final byte[] code;
    private final StateSchema schema;
    private final double[] constants;
    private final List<String> strings;
    private final int maxStackDepth;
    private final int localCount;
    private final int maxCallDepth;
    private final List<ContinuationPoint> continuationPoints;

    /**
     * Creates a model. Callers normally obtain models from the reader or the builder,
     * both of which verify the result.
     *
     * @param id The model id.
     * @param version The model version.
     * @param code The bytecode.
     * @param schema The input/output slot schema.
     * @param constants The constant pool.
     * @param strings The string table.
     * @param maxStackDepth The declared maximum operand-stack depth.
     * @param localCount The number of local slots.
     * @param maxCallDepth The declared maximum call-stack depth.
     * @param continuationPoints The continuation-point table.
     */
    public BehaviorModel(UUID id, int version, byte[] code, StateSchema schema, double[] constants,
                         List<String> strings, int maxStackDepth, int localCount, int maxCallDepth,
                         List<ContinuationPoint> continuationPoints) {
        this.id = Objects.requireNonNull(id, "id");
        this.version = version;
        this.code = code.clone();
        this.schema = Objects.requireNonNull(schema, "schema");
        this.constants = constants.clone();
        this.strings = List.copyOf(strings);
        this.maxStackDepth = maxStackDepth;
        this.localCount = localCount;
        this.maxCallDepth = maxCallDepth;
        this.continuationPoints = List.copyOf(continuationPoints);
    }

    public UUID getId() {
        return id;
    }

    public int getVersion() {
        return version;
    }

    /**
     * @return A copy of the bytecode.
     */
    public byte[] getCode() {
        return code.clone();
    }

    public int getCodeLength() {
        return code.length;
    }

    /**
     * Reads one unsigned byte of the bytecode without copying.
     * @param offset The offset.
     * @return The byte value (0-255).
     */
    public int codeAt(int offset) {
        return code[offset] & 0xFF;
    }

    public StateSchema getSchema() {
        return schema;
    }

    /**
     * @return A copy of the constant pool.
     */
    public double[] getConstants() {
        return constants.clone();
    }

    public int getConstantCount() {
        return constants.length;
    }

    public List<String> getStrings() {
        return strings;
    }

    public int getMaxStackDepth() {
        return maxStackDepth;
    }

    public int getLocalCount() {
        return localCount;
    }

    public int getMaxCallDepth() {
        return maxCallDepth;
    }

    public List<ContinuationPoint> getContinuationPoints() {
        return continuationPoints;
    }

    /**
     * Looks up a continuation point by name.
     * @param name The continuation point name.
     * @return The index in the continuation-point table, or -1.
     */
    public int continuationPointIndexOf(String name) {
        for (int i = 0; i < continuationPoints.size(); i++) {
            if (continuationPoints.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @return true if this model is an extension of another model.
     */
    public boolean isExtension() {
        return false;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id + ", version=" + version + ", code=" + code.length
                + " bytes, consts=" + constants.length + ", strings=" + strings.size()
                + ", continuationPoints=" + continuationPoints.size() + "}";
    }

    /**
     * Compares the full content of two models, including the bytecode.
     * @param other The other model.
     * @return true if both models have identical content.
     */
    public boolean contentEquals(BehaviorModel other) {
        return other != null
                && id.equals(other.id)
                && version == other.version
                && Arrays.equals(code, other.code)
                && schema.equals(other.schema)
                && Arrays.equals(constants, other.constants)
                && strings.equals(other.strings)
                && maxStackDepth == other.maxStackDepth
                && localCount == other.localCount
                && maxCallDepth == other.maxCallDepth
                && continuationPoints.equals(other.continuationPoints)
                && isExtension() == other.isExtension();
    }
}
