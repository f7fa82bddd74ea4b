package org.cognita.runtime.services;

import java.util.List;

/**
 * One decoded instruction of a behavior model.
 * @param offset The bytecode offset of the opcode.
 * @param opcodeId The opcode byte.
 * @param opcodeName The mnemonic.
 * @param operands The decoded operand values in encoding order.
 */
public record DisassembledInstruction(int offset, int opcodeId, String opcodeName, List<Integer> operands) {

    public DisassembledInstruction {
        operands = List.copyOf(operands);
    }
}
