package org.cognita.runtime.isa;

/**
 * Defines the encoded operand kinds of the instruction set.
 * Each kind knows its width in the bytecode stream and the table it indexes,
 * which is used by the verifier to range-check operands at load time.
 */
public enum OperandType {
    /** An index into the constant pool (u8). */
    CONSTANT(1),
    /** An index into the input slots of the state schema (u8). */
    INPUT(1),
    /** An index into the local slots (u8). */
    LOCAL(1),
    /** An index into the output slots of the state schema (u8). */
    OUTPUT(1),
    /** An intent channel number (u8). */
    CHANNEL(1),
    /** An index into the string table (u16). */
    STRING(2),
    /** An absolute bytecode offset used by jumps and calls (u16). */
    TARGET(2),
    /** An index into the continuation-point table (u16). */
    CONTINUATION(2);

    private final int width;

    OperandType(int width) {
        this.width = width;
    }

    /**
     * Gets the number of bytes this operand occupies in the bytecode.
     * @return The operand width in bytes.
     */
    public int width() {
        return width;
    }
}
