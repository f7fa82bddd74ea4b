package org.cognita.runtime;

import org.cognita.runtime.isa.Instruction;
import org.cognita.runtime.model.BehaviorModel;
import org.cognita.runtime.model.ContinuationPoint;
import org.cognita.runtime.model.EvaluationStatus;
import org.cognita.runtime.model.ExtensionModel;
import org.cognita.runtime.model.ModelCorruptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * The stack-machine interpreter for verified behavior models.
 * <p>
 * All scratch space (operand stack, locals, call stack) is sized from the model's declared
 * limits at construction; evaluation itself does not allocate. Given the same model, input
 * vector and seed, {@link #evaluate(double[], double[], long)} always produces the same output
 * vector.
 * <p>
 * A {@code CONTINUATION_POINT} suspends evaluation and returns {@link EvaluationStatus#PAUSED};
 * stack, locals and instruction pointer are kept until the caller resumes with
 * {@link #resumeWithDefault(double[], double[])} or
 * {@link #resumeWithExtension(ExtensionModel, double[], double[])}.
 * <p>
 * An instance is not thread-safe; it belongs to the single loop that drives it.
 */
public class VirtualMachine {

    private static final Logger LOG = LoggerFactory.getLogger(VirtualMachine.class);

    private final BehaviorModel model;
    private final byte[] code;
    private final double[] constants;
    private final double[] inputDefaults;
    private final int outputCount;
    private final List<ContinuationPoint> continuationPoints;
    private final String[] strings;

    private final double[] stack;
    private final double[] locals;
    private final int[] callStack;
    private final ExtensionModel[] stagedExtensions;
    private final Random random = new Random();

    private int sp;
    private int csp;
    private int ip;
    private int pausedAt = -1;
    private long seed;
    private boolean extensionMode;
    private VirtualMachine extensionVm;
    private DebugListener debugListener;

    /**
     * Creates a VM for a verified model.
     * @param model The model; must have passed {@code ModelVerifier}.
     */
    public VirtualMachine(BehaviorModel model) {
        this.model = model;
        this.code = model.getCode();
        this.constants = model.getConstants();
        this.inputDefaults = model.getSchema().defaultInputs();
        this.outputCount = model.getSchema().outputCount();
        this.continuationPoints = model.getContinuationPoints();
        this.strings = model.getStrings().toArray(new String[0]);
        this.stack = new double[model.getMaxStackDepth()];
        this.locals = new double[model.getLocalCount()];
        this.callStack = new int[model.getMaxCallDepth()];
        this.stagedExtensions = new ExtensionModel[continuationPoints.size()];
    }

    public BehaviorModel getModel() {
        return model;
    }

    public void setDebugListener(DebugListener debugListener) {
        this.debugListener = debugListener;
    }

    /**
     * Evaluates the model from the start.
     * <p>
     * Resets stack, locals and the first {@code outputCount} output slots, and discards any
     * previous pause.
     *
     * @param input The input vector; slots beyond its length use the schema defaults.
     * @param output The output vector; must hold at least the schema's output slots.
     * @param seed The seed for RAND and RAND_INT.
     * @return {@link EvaluationStatus#COMPLETED} or {@link EvaluationStatus#PAUSED}.
     * @throws ModelCorruptionException if a runtime stack or call-depth bound is violated.
     */
    public EvaluationStatus evaluate(double[] input, double[] output, long seed) {
        checkOutput(output);
        Arrays.fill(output, 0, outputCount, 0.0);
        Arrays.fill(locals, 0.0);
        this.seed = seed;
        random.setSeed(seed);
        sp = 0;
        csp = 0;
        ip = 0;
        pausedAt = -1;
        return run(input, output);
    }

    /**
     * Continues a paused evaluation at the pending continuation point's default flow.
     * @param input The input vector.
     * @param output The output vector; its contents are kept.
     * @return The status of the resumed evaluation.
     * @throws IllegalStateException if the VM is not paused.
     */
    public EvaluationStatus resumeWithDefault(double[] input, double[] output) {
        ContinuationPoint cp = requirePaused();
        checkOutput(output);
        pausedAt = -1;
        ip = cp.defaultFlowOffset();
        return run(input, output);
    }

    /**
     * Replaces the remainder of a paused evaluation with an extension model.
     * <p>
     * The extension is evaluated into the same output vector without clearing it; the base
     * evaluation then counts as completed. Continuation points inside the extension fall
     * through to their default flow.
     *
     * @param extension The extension targeting the pending continuation point.
     * @param input The input vector.
     * @param output The output vector.
     * @return {@link EvaluationStatus#COMPLETED}.
     * @throws IllegalStateException if the VM is not paused.
     * @throws IllegalArgumentException if the extension targets another model or point.
     * @throws ModelCorruptionException if the extension writes more outputs than the vector holds.
     */
    public EvaluationStatus resumeWithExtension(ExtensionModel extension, double[] input, double[] output) {
        ContinuationPoint cp = requirePaused();
        int extensionOutputs = extension.getSchema().outputCount();
        if (extensionOutputs > output.length) {
            throw new ModelCorruptionException("Extension " + extension.getId() + " declares " + extensionOutputs
                    + " outputs, output vector has " + output.length);
        }
        if (!extension.targets(model, cp)) {
            throw new IllegalArgumentException("Extension " + extension.getId() + " does not target continuation point '"
                    + cp.name() + "' of model " + model.getId());
        }
        checkOutput(output);
        pausedAt = -1;
        runExtension(extension, input, output);
        sp = 0;
        csp = 0;
        ip = code.length;
        return EvaluationStatus.COMPLETED;
    }

    /**
     * Stages an extension so that EXTENSION_AVAILABLE reports it and YIELD_TO_EXTENSION runs it
     * when evaluation reaches the matching continuation point index.
     * @param extension The extension; must target one of this model's continuation points.
     * @return true if a matching continuation point was found.
     */
    public boolean stageExtension(ExtensionModel extension) {
        for (int i = 0; i < continuationPoints.size(); i++) {
            if (extension.targets(model, continuationPoints.get(i))) {
                stagedExtensions[i] = extension;
                return true;
            }
        }
        return false;
    }

    /**
     * Drops all staged extensions.
     */
    public void clearStagedExtensions() {
        Arrays.fill(stagedExtensions, null);
    }

    public boolean isPaused() {
        return pausedAt >= 0;
    }

    /**
     * @return The index of the continuation point the VM is paused at, or -1.
     */
    public int getPausedAtIndex() {
        return pausedAt;
    }

    /**
     * @return The continuation point the VM is paused at, or null.
     */
    public ContinuationPoint getPendingContinuationPoint() {
        return pausedAt >= 0 ? continuationPoints.get(pausedAt) : null;
    }

    public int getStackDepth() {
        return sp;
    }

    private ContinuationPoint requirePaused() {
        if (pausedAt < 0) {
            throw new IllegalStateException("VM for model " + model.getId() + " is not paused");
        }
        return continuationPoints.get(pausedAt);
    }

    private void checkOutput(double[] output) {
        if (output.length < outputCount) {
            throw new IllegalArgumentException("Output vector has " + output.length + " slots, model declares " + outputCount);
        }
    }

    private void runExtension(ExtensionModel extension, double[] input, double[] output) {
        if (extensionVm == null || extensionVm.model != extension) {
            extensionVm = new VirtualMachine(extension);
        }
        extensionVm.extensionMode = true;
        extensionVm.debugListener = debugListener;
        Arrays.fill(extensionVm.locals, 0.0);
        extensionVm.random.setSeed(seed);
        extensionVm.sp = 0;
        extensionVm.csp = 0;
        extensionVm.ip = 0;
        extensionVm.pausedAt = -1;
        extensionVm.run(input, output);
    }

    private EvaluationStatus run(double[] input, double[] output) {
        final int length = code.length;
        while (ip < length) {
            final int at = ip;
            final int opcode = code[ip++] & 0xFF;
            switch (opcode) {
                case Instruction.NOP, Instruction.BREAKPOINT -> {
                    if (opcode == Instruction.BREAKPOINT && debugListener != null) {
                        debugListener.onBreakpoint(at, sp);
                    }
                }
                case Instruction.PUSH_CONST -> push(constants[readU8()], at);
                case Instruction.PUSH_INPUT -> {
                    int idx = readU8();
                    push(idx < input.length ? input[idx] : inputDefaults[idx], at);
                }
                case Instruction.PUSH_LOCAL -> push(locals[readU8()], at);
                case Instruction.STORE_LOCAL -> {
                    int idx = readU8();
                    locals[idx] = pop(at);
                }
                case Instruction.POP -> pop(at);
                case Instruction.DUP -> {
                    double v = peek(at);
                    push(v, at);
                }
                case Instruction.SWAP -> {
                    double b = pop(at);
                    double a = pop(at);
                    push(b, at);
                    push(a, at);
                }
                case Instruction.PUSH_STRING -> push(readU16(), at);

                case Instruction.ADD -> { double b = pop(at); double a = pop(at); push(a + b, at); }
                case Instruction.SUB -> { double b = pop(at); double a = pop(at); push(a - b, at); }
                case Instruction.MUL -> { double b = pop(at); double a = pop(at); push(a * b, at); }
                case Instruction.DIV -> { double b = pop(at); double a = pop(at); push(b == 0.0 ? 0.0 : a / b, at); }
                case Instruction.MOD -> { double b = pop(at); double a = pop(at); push(b == 0.0 ? 0.0 : a % b, at); }
                case Instruction.NEG -> push(-pop(at), at);

                case Instruction.EQ -> { double b = pop(at); double a = pop(at); push(bool(Math.abs(a - b) < Config.EQUALITY_EPSILON), at); }
                case Instruction.NE -> { double b = pop(at); double a = pop(at); push(bool(Math.abs(a - b) >= Config.EQUALITY_EPSILON), at); }
                case Instruction.LT -> { double b = pop(at); double a = pop(at); push(bool(a < b), at); }
                case Instruction.LE -> { double b = pop(at); double a = pop(at); push(bool(a <= b), at); }
                case Instruction.GT -> { double b = pop(at); double a = pop(at); push(bool(a > b), at); }
                case Instruction.GE -> { double b = pop(at); double a = pop(at); push(bool(a >= b), at); }

                case Instruction.AND -> { boolean b = pop(at) != 0.0; boolean a = pop(at) != 0.0; push(bool(a && b), at); }
                case Instruction.OR -> { boolean b = pop(at) != 0.0; boolean a = pop(at) != 0.0; push(bool(a || b), at); }
                case Instruction.NOT -> push(bool(pop(at) == 0.0), at);

                case Instruction.JMP -> ip = readU16();
                case Instruction.JMP_IF -> {
                    int target = readU16();
                    if (pop(at) != 0.0) {
                        ip = target;
                    }
                }
                case Instruction.JMP_UNLESS -> {
                    int target = readU16();
                    if (pop(at) == 0.0) {
                        ip = target;
                    }
                }
                case Instruction.CALL -> {
                    int target = readU16();
                    if (csp >= callStack.length) {
                        throw fatal("Call stack overflow (max " + callStack.length + ")", at);
                    }
                    callStack[csp++] = ip;
                    ip = target;
                }
                case Instruction.RET -> {
                    if (csp == 0) {
                        return EvaluationStatus.COMPLETED;
                    }
                    ip = callStack[--csp];
                }
                case Instruction.HALT -> {
                    return EvaluationStatus.COMPLETED;
                }

                case Instruction.SET_OUTPUT -> {
                    int idx = readU8();
                    output[idx] = pop(at);
                }
                case Instruction.EMIT_INTENT -> {
                    int channel = readU8();
                    double urgency = pop(at);
                    double action = pop(at);
                    output[channel * Config.SLOTS_PER_INTENT_CHANNEL] = action;
                    output[channel * Config.SLOTS_PER_INTENT_CHANNEL + 1] = urgency;
                }

                case Instruction.RAND -> push(random.nextDouble(), at);
                case Instruction.RAND_INT -> {
                    long max = (long) pop(at);
                    long min = (long) pop(at);
                    push(max < min ? min : min + random.nextLong(max - min + 1), at);
                }
                case Instruction.LERP -> {
                    double t = pop(at);
                    double b = pop(at);
                    double a = pop(at);
                    push(a + (b - a) * t, at);
                }
                case Instruction.CLAMP -> {
                    double max = pop(at);
                    double min = pop(at);
                    double value = pop(at);
                    push(Math.max(min, Math.min(max, value)), at);
                }
                case Instruction.ABS -> push(Math.abs(pop(at)), at);
                case Instruction.FLOOR -> push(Math.floor(pop(at)), at);
                case Instruction.CEIL -> push(Math.ceil(pop(at)), at);
                case Instruction.MIN -> { double b = pop(at); double a = pop(at); push(Math.min(a, b), at); }
                case Instruction.MAX -> { double b = pop(at); double a = pop(at); push(Math.max(a, b), at); }

                case Instruction.CONTINUATION_POINT -> {
                    int cpIndex = readU16();
                    if (extensionMode) {
                        ip = continuationPoints.get(cpIndex).defaultFlowOffset();
                    } else {
                        pausedAt = cpIndex;
                        return EvaluationStatus.PAUSED;
                    }
                }
                case Instruction.EXTENSION_AVAILABLE -> push(bool(stagedExtensions[readU16()] != null), at);
                case Instruction.YIELD_TO_EXTENSION -> {
                    ExtensionModel staged = stagedExtensions[readU16()];
                    if (staged != null) {
                        runExtension(staged, input, output);
                        return EvaluationStatus.COMPLETED;
                    }
                }
                case Instruction.TRACE -> {
                    int idx = readU16();
                    if (debugListener != null) {
                        debugListener.onTrace(at, strings[idx]);
                    } else if (LOG.isTraceEnabled()) {
                        LOG.trace("model {} @{}: {}", model.getId(), at, strings[idx]);
                    }
                }
                default -> throw fatal(String.format("Unknown opcode 0x%02X", opcode), at);
            }
        }
        return EvaluationStatus.COMPLETED;
    }

    private int readU8() {
        return code[ip++] & 0xFF;
    }

    private int readU16() {
        int value = (code[ip] & 0xFF) | ((code[ip + 1] & 0xFF) << 8);
        ip += 2;
        return value;
    }

    private void push(double value, int at) {
        if (sp >= stack.length) {
            throw fatal("Stack overflow (max " + stack.length + ")", at);
        }
        stack[sp++] = value;
    }

    private double pop(int at) {
        if (sp == 0) {
            throw fatal("Stack underflow", at);
        }
        return stack[--sp];
    }

    private double peek(int at) {
        if (sp == 0) {
            throw fatal("Stack underflow", at);
        }
        return stack[sp - 1];
    }

    private static double bool(boolean value) {
        return value ? 1.0 : 0.0;
    }

    private ModelCorruptionException fatal(String message, int at) {
        LOG.error("Model {} corrupted at offset {}: {}", model.getId(), at, message);
        return new ModelCorruptionException(message, at);
    }
}
