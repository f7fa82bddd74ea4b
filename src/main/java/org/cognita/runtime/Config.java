package org.cognita.runtime;

/**
 * Provides centralized constants for the behavior model format and the virtual machine.
 * This final class contains static constants that define binary-format markers, hard
 * limits enforced by the verifier, and evaluation parameters. It is not meant to be instantiated.
 */
public final class Config {

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private Config() {}

    /**
     * Magic number at the start of every serialized model ("CGBM" in little-endian byte order).
     */
    public static final int MODEL_MAGIC = 0x4D424743;

    /**
     * The binary container version written by {@code BehaviorModelWriter}.
     */
    public static final int MODEL_FORMAT_VERSION = 1;

    /**
     * Flag bit set in the header of extension models.
     */
    public static final int FLAG_EXTENSION = 0x01;

    /**
     * The maximum operand-stack depth a model may declare.
     */
    public static final int MAX_STACK_DEPTH = 1024;

    /**
     * The maximum number of local slots a model may declare.
     */
    public static final int MAX_LOCALS = 256;

    /**
     * The maximum call-stack depth a model may declare, preventing unbounded recursion.
     */
    public static final int MAX_CALL_DEPTH = 256;

    /**
     * The maximum bytecode length addressable by 16-bit jump operands.
     */
    public static final int MAX_CODE_LENGTH = 0xFFFF;

    /**
     * Tolerance used by the EQ and NE comparison opcodes.
     */
    public static final double EQUALITY_EPSILON = 1e-10;

    /**
     * Number of output slots reserved per intent channel by EMIT_INTENT (intent, urgency).
     */
    public static final int SLOTS_PER_INTENT_CHANNEL = 2;
}
