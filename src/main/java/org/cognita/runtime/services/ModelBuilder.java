package org.cognita.runtime.services;

import org.cognita.runtime.isa.Instruction;
import org.cognita.runtime.isa.InstructionSignature;
import org.cognita.runtime.isa.OperandType;
import org.cognita.runtime.model.BehaviorModel;
import org.cognita.runtime.model.ContinuationPoint;
import org.cognita.runtime.model.ExtensionModel;
import org.cognita.runtime.model.StateSchema;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A label-aware programmatic assembler for behavior models.
 * <p>
 * Constants and strings are pooled, jump targets and continuation-point default flows are
 * referenced by label and patched in {@link #build()}. The result is verified before it is
 * returned.
 * <pre>{@code
 * BehaviorModel model = new ModelBuilder()
 *     .input("hunger", 0.0).output("eat")
 *     .pushInput("hunger").pushConst(0.7).op(Instruction.GT)
 *     .setOutput("eat")
 *     .build();
 * }</pre>
 */
public class ModelBuilder {

    private UUID id = UUID.randomUUID();
    private int version = 1;
    private int maxStackDepth = 64;
    private int maxCallDepth = 16;
    private int localCount = -1;

    private final List<StateSchema.InputSlot> inputs = new ArrayList<>();
    private final List<String> outputs = new ArrayList<>();
    private final List<Double> constants = new ArrayList<>();
    private final List<String> strings = new ArrayList<>();
    private final Map<String, PendingPoint> points = new LinkedHashMap<>();
    private final Map<String, Integer> labels = new HashMap<>();
    private final List<Fixup> fixups = new ArrayList<>();
    private final ByteArrayOutputStream code = new ByteArrayOutputStream();
    private int highestLocal = -1;

    private record Fixup(int offset, String label) {}

    private record PendingPoint(int index, int timeoutMs, String defaultLabel) {}

    public ModelBuilder id(UUID id) {
        this.id = id;
        return this;
    }

    public ModelBuilder version(int version) {
        this.version = version;
        return this;
    }

    public ModelBuilder maxStackDepth(int maxStackDepth) {
        this.maxStackDepth = maxStackDepth;
        return this;
    }

    public ModelBuilder maxCallDepth(int maxCallDepth) {
        this.maxCallDepth = maxCallDepth;
        return this;
    }

    /**
     * Declares the number of local slots; by default it is derived from the highest local used.
     */
    public ModelBuilder localCount(int localCount) {
        this.localCount = localCount;
        return this;
    }

    public ModelBuilder input(String name, double defaultValue) {
        inputs.add(new StateSchema.InputSlot(name, defaultValue));
        return this;
    }

    public ModelBuilder output(String name) {
        outputs.add(name);
        return this;
    }

    /**
     * Declares a continuation point whose default flow starts at the given label.
     * @param name The continuation point name.
     * @param timeoutMs The timeout in milliseconds.
     * @param defaultLabel The label of the default flow.
     * @return this builder.
     */
    public ModelBuilder continuationPoint(String name, int timeoutMs, String defaultLabel) {
        if (points.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate continuation point: " + name);
        }
        points.put(name, new PendingPoint(points.size(), timeoutMs, defaultLabel));
        return this;
    }

    /**
     * Binds a label to the current code offset.
     */
    public ModelBuilder label(String name) {
        if (labels.putIfAbsent(name, code.size()) != null) {
            throw new IllegalArgumentException("Duplicate label: " + name);
        }
        return this;
    }

    /**
     * Emits an instruction without operands.
     * @param opcode The opcode constant from {@link Instruction}.
     */
    public ModelBuilder op(int opcode) {
        InstructionSignature signature = signatureOf(opcode);
        if (signature.getArity() != 0) {
            throw new IllegalArgumentException(Instruction.getInstructionNameById(opcode) + " requires operands");
        }
        code.write(opcode);
        return this;
    }

    /**
     * Emits an instruction with raw operand values.
     * @param opcode The opcode constant.
     * @param operands The operand values, one per declared operand.
     */
    public ModelBuilder op(int opcode, int... operands) {
        InstructionSignature signature = signatureOf(opcode);
        if (signature.getArity() != operands.length) {
            throw new IllegalArgumentException(Instruction.getInstructionNameById(opcode) + " expects "
                    + signature.getArity() + " operands, got " + operands.length);
        }
        code.write(opcode);
        for (int i = 0; i < operands.length; i++) {
            OperandType type = signature.operandTypes().get(i);
            if (type == OperandType.LOCAL) {
                highestLocal = Math.max(highestLocal, operands[i]);
            }
            writeOperand(type, operands[i]);
        }
        return this;
    }

    public ModelBuilder pushConst(double value) {
        int index = constants.indexOf(value);
        if (index < 0) {
            constants.add(value);
            index = constants.size() - 1;
        }
        return op(Instruction.PUSH_CONST, index);
    }

    public ModelBuilder pushInput(String name) {
        return op(Instruction.PUSH_INPUT, requireSlot(inputIndexOf(name), "input", name));
    }

    public ModelBuilder pushLocal(int index) {
        return op(Instruction.PUSH_LOCAL, index);
    }

    public ModelBuilder storeLocal(int index) {
        return op(Instruction.STORE_LOCAL, index);
    }

    public ModelBuilder pushString(String value) {
        return op(Instruction.PUSH_STRING, stringIndex(value));
    }

    public ModelBuilder setOutput(String name) {
        return op(Instruction.SET_OUTPUT, requireSlot(outputs.indexOf(name), "output", name));
    }

    /**
     * Emits EMIT_INTENT, which pops urgency and the action string index.
     */
    public ModelBuilder emitIntent(int channel) {
        return op(Instruction.EMIT_INTENT, channel);
    }

    public ModelBuilder trace(String message) {
        return op(Instruction.TRACE, stringIndex(message));
    }

    /**
     * Emits a jump, branch or call to a label that may be bound later.
     * @param opcode JMP, JMP_IF, JMP_UNLESS or CALL.
     * @param label The target label.
     */
    public ModelBuilder jump(int opcode, String label) {
        InstructionSignature signature = signatureOf(opcode);
        if (signature.operandTypes().size() != 1 || signature.operandTypes().get(0) != OperandType.TARGET) {
            throw new IllegalArgumentException(Instruction.getInstructionNameById(opcode) + " is not a jump");
        }
        code.write(opcode);
        fixups.add(new Fixup(code.size(), label));
        writeOperand(OperandType.TARGET, 0);
        return this;
    }

    /**
     * Emits CONTINUATION_POINT, EXTENSION_AVAILABLE or YIELD_TO_EXTENSION for a declared point.
     */
    public ModelBuilder atContinuationPoint(int opcode, String name) {
        PendingPoint point = points.get(name);
        if (point == null) {
            throw new IllegalArgumentException("Undeclared continuation point: " + name);
        }
        return op(opcode, point.index());
    }

    /**
     * Assembles and verifies a base model.
     * @return The verified model.
     */
    public BehaviorModel build() {
        byte[] bytes = patch();
        BehaviorModel model = new BehaviorModel(id, version, bytes, schema(), constantArray(), strings,
                maxStackDepth, effectiveLocalCount(), maxCallDepth, resolvePoints());
        new ModelVerifier().verify(model);
        return model;
    }

    /**
     * Assembles and verifies an extension model for a continuation point of a parent model.
     * @param parentModelId The parent model id.
     * @param attachPointName The name of the parent's continuation point.
     * @return The verified extension model.
     */
    public ExtensionModel buildExtension(UUID parentModelId, String attachPointName) {
        byte[] bytes = patch();
        ExtensionModel model = new ExtensionModel(id, version, bytes, schema(), constantArray(), strings,
                maxStackDepth, effectiveLocalCount(), maxCallDepth, resolvePoints(),
                parentModelId, ContinuationPoint.hashName(attachPointName));
        new ModelVerifier().verify(model);
        return model;
    }

    private byte[] patch() {
        byte[] bytes = code.toByteArray();
        for (Fixup fixup : fixups) {
            int target = resolveLabel(fixup.label());
            bytes[fixup.offset()] = (byte) target;
            bytes[fixup.offset() + 1] = (byte) (target >>> 8);
        }
        return bytes;
    }

    private List<ContinuationPoint> resolvePoints() {
        List<ContinuationPoint> resolved = new ArrayList<>(points.size());
        points.forEach((name, point) -> resolved.add(
                ContinuationPoint.of(name, point.timeoutMs(), resolveLabel(point.defaultLabel()))));
        return resolved;
    }

    private int resolveLabel(String label) {
        Integer target = labels.get(label);
        if (target == null) {
            throw new IllegalStateException("Unbound label: " + label);
        }
        return target;
    }

    private StateSchema schema() {
        return new StateSchema(inputs, outputs);
    }

    private double[] constantArray() {
        double[] result = new double[constants.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = constants.get(i);
        }
        return result;
    }

    private int effectiveLocalCount() {
        return localCount >= 0 ? localCount : highestLocal + 1;
    }

    private int inputIndexOf(String name) {
        for (int i = 0; i < inputs.size(); i++) {
            if (inputs.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    private int stringIndex(String value) {
        int index = strings.indexOf(value);
        if (index < 0) {
            strings.add(value);
            index = strings.size() - 1;
        }
        return index;
    }

    private static int requireSlot(int index, String kind, String name) {
        if (index < 0) {
            throw new IllegalArgumentException("Undeclared " + kind + " slot: " + name);
        }
        return index;
    }

    private static InstructionSignature signatureOf(int opcode) {
        return Instruction.getSignatureById(opcode)
                .orElseThrow(() -> new IllegalArgumentException("Unknown opcode: " + opcode));
    }

    private void writeOperand(OperandType type, int value) {
        code.write(value & 0xFF);
        if (type.width() == 2) {
            code.write((value >>> 8) & 0xFF);
        }
    }
}
