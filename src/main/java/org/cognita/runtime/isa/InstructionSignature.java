package org.cognita.runtime.isa;

import java.util.Collections;
import java.util.List;

/**
 * Describes the expected signature of an instruction, i.e. its encoded operands and
 * its effect on the operand stack.
 *
 * @param operandTypes An unmodifiable list of the encoded operand types.
 * @param pops         The number of stack values the instruction consumes.
 * @param pushes       The number of stack values the instruction produces.
 */
public record InstructionSignature(List<OperandType> operandTypes, int pops, int pushes) {

    /**
     * Creates a signature and ensures that the list is unmodifiable.
     * @param operandTypes The list of operand types.
     * @param pops The number of consumed stack values.
     * @param pushes The number of produced stack values.
     */
    public InstructionSignature(List<OperandType> operandTypes, int pops, int pushes) {
        this.operandTypes = Collections.unmodifiableList(operandTypes);
        this.pops = pops;
        this.pushes = pushes;
    }

    /**
     * Returns the number of encoded operands.
     * @return The number of operands.
     */
    public int getArity() {
        return operandTypes.size();
    }

    /**
     * Returns the total encoded length of the instruction including the opcode byte.
     * @return The instruction length in bytes.
     */
    public int getLength() {
        int length = 1;
        for (OperandType type : operandTypes) {
            length += type.width();
        }
        return length;
    }

    /**
     * Returns the net change of the stack depth caused by this instruction.
     * @return pushes minus pops.
     */
    public int getStackDelta() {
        return pushes - pops;
    }
}
