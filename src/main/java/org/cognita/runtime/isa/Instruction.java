package org.cognita.runtime.isa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The instruction registry of the behavior VM.
 * <p>
 * Opcodes are single bytes. Each registered opcode has a name, an {@link InstructionSignature}
 * (encoded operands and stack effect) and a {@link ControlFlow} kind. The registry is shared by
 * the verifier, the disassembler and the model builder; the interpreter itself dispatches on the
 * opcode constants declared here.
 */
public final class Instruction {

    /**
     * Describes how an instruction transfers control, used by the verifier's flow analysis.
     */
    public enum ControlFlow {
        /** Continues with the next instruction. */
        NEXT,
        /** Unconditionally transfers to the encoded target. */
        JUMP,
        /** Either continues with the next instruction or transfers to the encoded target. */
        BRANCH,
        /** Transfers to the encoded target and later returns to the next instruction. */
        CALL,
        /** Returns to the most recent call site. */
        RETURN,
        /** Ends evaluation. */
        HALT,
        /** Suspends evaluation; resumption continues at the continuation point's default flow. */
        SUSPEND
    }

    // Stack
    public static final int NOP = 0x00;
    public static final int PUSH_CONST = 0x01;
    public static final int PUSH_INPUT = 0x02;
    public static final int PUSH_LOCAL = 0x03;
    public static final int STORE_LOCAL = 0x04;
    public static final int POP = 0x05;
    public static final int DUP = 0x06;
    public static final int SWAP = 0x07;
    public static final int PUSH_STRING = 0x08;

    // Arithmetic
    public static final int ADD = 0x10;
    public static final int SUB = 0x11;
    public static final int MUL = 0x12;
    public static final int DIV = 0x13;
    public static final int MOD = 0x14;
    public static final int NEG = 0x15;

    // Comparison
    public static final int EQ = 0x20;
    public static final int NE = 0x21;
    public static final int LT = 0x22;
    public static final int LE = 0x23;
    public static final int GT = 0x24;
    public static final int GE = 0x25;

    // Logic
    public static final int AND = 0x30;
    public static final int OR = 0x31;
    public static final int NOT = 0x32;

    // Control flow
    public static final int JMP = 0x40;
    public static final int JMP_IF = 0x41;
    public static final int JMP_UNLESS = 0x42;
    public static final int CALL = 0x43;
    public static final int RET = 0x44;
    public static final int HALT = 0x45;

    // Output
    public static final int SET_OUTPUT = 0x50;
    public static final int EMIT_INTENT = 0x51;

    // Math
    public static final int RAND = 0x60;
    public static final int RAND_INT = 0x61;
    public static final int LERP = 0x62;
    public static final int CLAMP = 0x63;
    public static final int ABS = 0x64;
    public static final int FLOOR = 0x65;
    public static final int CEIL = 0x66;
    public static final int MIN = 0x67;
    public static final int MAX = 0x68;

    // Streaming composition
    public static final int CONTINUATION_POINT = 0x70;
    public static final int EXTENSION_AVAILABLE = 0x71;
    public static final int YIELD_TO_EXTENSION = 0x72;

    // Debug
    public static final int BREAKPOINT = 0xF0;
    public static final int TRACE = 0xF1;

    private static final InstructionSignature[] SIGNATURES_BY_ID = new InstructionSignature[256];
    private static final ControlFlow[] CONTROL_FLOW_BY_ID = new ControlFlow[256];
    private static final Map<Integer, String> ID_TO_NAME = new HashMap<>();
    private static final Map<String, Integer> NAME_TO_ID = new HashMap<>();

    static {
        init();
    }

    private Instruction() {}

    private static void init() {
        // Stack-Family
        registerFamily(Map.of(NOP, "NOP"), List.of(), 0, 0, ControlFlow.NEXT);
        registerFamily(Map.of(PUSH_CONST, "PUSH_CONST"), List.of(OperandType.CONSTANT), 0, 1, ControlFlow.NEXT);
        registerFamily(Map.of(PUSH_INPUT, "PUSH_INPUT"), List.of(OperandType.INPUT), 0, 1, ControlFlow.NEXT);
        registerFamily(Map.of(PUSH_LOCAL, "PUSH_LOCAL"), List.of(OperandType.LOCAL), 0, 1, ControlFlow.NEXT);
        registerFamily(Map.of(STORE_LOCAL, "STORE_LOCAL"), List.of(OperandType.LOCAL), 1, 0, ControlFlow.NEXT);
        registerFamily(Map.of(POP, "POP"), List.of(), 1, 0, ControlFlow.NEXT);
        registerFamily(Map.of(DUP, "DUP"), List.of(), 1, 2, ControlFlow.NEXT);
        registerFamily(Map.of(SWAP, "SWAP"), List.of(), 2, 2, ControlFlow.NEXT);
        registerFamily(Map.of(PUSH_STRING, "PUSH_STRING"), List.of(OperandType.STRING), 0, 1, ControlFlow.NEXT);

        // Arithmetic-Family
        registerFamily(Map.of(ADD, "ADD", SUB, "SUB", MUL, "MUL", DIV, "DIV", MOD, "MOD"), List.of(), 2, 1, ControlFlow.NEXT);
        registerFamily(Map.of(NEG, "NEG"), List.of(), 1, 1, ControlFlow.NEXT);

        // Comparison-Family
        registerFamily(Map.of(EQ, "EQ", NE, "NE", LT, "LT", LE, "LE", GT, "GT", GE, "GE"), List.of(), 2, 1, ControlFlow.NEXT);

        // Logic-Family
        registerFamily(Map.of(AND, "AND", OR, "OR"), List.of(), 2, 1, ControlFlow.NEXT);
        registerFamily(Map.of(NOT, "NOT"), List.of(), 1, 1, ControlFlow.NEXT);

        // ControlFlow-Family
        registerFamily(Map.of(JMP, "JMP"), List.of(OperandType.TARGET), 0, 0, ControlFlow.JUMP);
        registerFamily(Map.of(JMP_IF, "JMP_IF", JMP_UNLESS, "JMP_UNLESS"), List.of(OperandType.TARGET), 1, 0, ControlFlow.BRANCH);
        registerFamily(Map.of(CALL, "CALL"), List.of(OperandType.TARGET), 0, 0, ControlFlow.CALL);
        registerFamily(Map.of(RET, "RET"), List.of(), 0, 0, ControlFlow.RETURN);
        registerFamily(Map.of(HALT, "HALT"), List.of(), 0, 0, ControlFlow.HALT);

        // Output-Family
        registerFamily(Map.of(SET_OUTPUT, "SET_OUTPUT"), List.of(OperandType.OUTPUT), 1, 0, ControlFlow.NEXT);
        registerFamily(Map.of(EMIT_INTENT, "EMIT_INTENT"), List.of(OperandType.CHANNEL), 2, 0, ControlFlow.NEXT);

        // Math-Family
        registerFamily(Map.of(RAND, "RAND"), List.of(), 0, 1, ControlFlow.NEXT);
        registerFamily(Map.of(RAND_INT, "RAND_INT", MIN, "MIN", MAX, "MAX"), List.of(), 2, 1, ControlFlow.NEXT);
        registerFamily(Map.of(LERP, "LERP", CLAMP, "CLAMP"), List.of(), 3, 1, ControlFlow.NEXT);
        registerFamily(Map.of(ABS, "ABS", FLOOR, "FLOOR", CEIL, "CEIL"), List.of(), 1, 1, ControlFlow.NEXT);

        // Streaming composition
        registerFamily(Map.of(CONTINUATION_POINT, "CONTINUATION_POINT"), List.of(OperandType.CONTINUATION), 0, 0, ControlFlow.SUSPEND);
        registerFamily(Map.of(EXTENSION_AVAILABLE, "EXTENSION_AVAILABLE"), List.of(OperandType.CONTINUATION), 0, 1, ControlFlow.NEXT);
        registerFamily(Map.of(YIELD_TO_EXTENSION, "YIELD_TO_EXTENSION"), List.of(OperandType.CONTINUATION), 0, 0, ControlFlow.NEXT);

        // Debug
        registerFamily(Map.of(BREAKPOINT, "BREAKPOINT"), List.of(), 0, 0, ControlFlow.NEXT);
        registerFamily(Map.of(TRACE, "TRACE"), List.of(OperandType.STRING), 0, 0, ControlFlow.NEXT);
    }

    private static void registerFamily(Map<Integer, String> variants, List<OperandType> operands,
                                       int pops, int pushes, ControlFlow flow) {
        InstructionSignature signature = new InstructionSignature(new ArrayList<>(operands), pops, pushes);
        for (Map.Entry<Integer, String> entry : variants.entrySet()) {
            int id = entry.getKey();
            String name = entry.getValue();
            if (SIGNATURES_BY_ID[id] != null) {
                throw new IllegalStateException("Opcode 0x" + Integer.toHexString(id) + " registered twice (" + name + ")");
            }
            SIGNATURES_BY_ID[id] = signature;
            CONTROL_FLOW_BY_ID[id] = flow;
            ID_TO_NAME.put(id, name);
            NAME_TO_ID.put(name.toUpperCase(), id);
        }
    }

    // --- Static Getters for Runtime Information ---

    /**
     * Checks whether an opcode is part of the instruction set.
     * @param id The opcode byte (0-255).
     * @return true if the opcode is registered.
     */
    public static boolean isKnown(int id) {
        return id >= 0 && id < SIGNATURES_BY_ID.length && SIGNATURES_BY_ID[id] != null;
    }

    /**
     * Gets the signature of an instruction by its ID.
     * @param id The opcode byte.
     * @return An Optional containing the instruction signature.
     */
    public static Optional<InstructionSignature> getSignatureById(int id) {
        return isKnown(id) ? Optional.of(SIGNATURES_BY_ID[id]) : Optional.empty();
    }

    /**
     * Gets the control-flow kind of an instruction by its ID.
     * @param id The opcode byte.
     * @return The control-flow kind, or null for unknown opcodes.
     */
    public static ControlFlow getControlFlowById(int id) {
        return isKnown(id) ? CONTROL_FLOW_BY_ID[id] : null;
    }

    /**
     * Gets the encoded length of an instruction by its ID.
     * @param id The opcode byte.
     * @return The length including the opcode byte, or 1 for unknown opcodes.
     */
    public static int getInstructionLengthById(int id) {
        return isKnown(id) ? SIGNATURES_BY_ID[id].getLength() : 1;
    }

    /**
     * Gets the name of an instruction by its ID.
     * @param id The opcode byte.
     * @return The name of the instruction, or "UNKNOWN".
     */
    public static String getInstructionNameById(int id) {
        return ID_TO_NAME.getOrDefault(id, "UNKNOWN");
    }

    /**
     * Gets the ID of an instruction by its name.
     * @param name The name of the instruction (case-insensitive).
     * @return The opcode byte, or null if no such instruction exists.
     */
    public static Integer getInstructionIdByName(String name) {
        return NAME_TO_ID.get(name.toUpperCase());
    }

    /**
     * Returns all registered opcode IDs in ascending order.
     * @return An unmodifiable sorted list of opcode bytes.
     */
    public static List<Integer> getRegisteredIds() {
        List<Integer> ids = new ArrayList<>(ID_TO_NAME.keySet());
        Collections.sort(ids);
        return Collections.unmodifiableList(ids);
    }
}
