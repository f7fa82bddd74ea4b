package org.cognita.runtime.services;

import org.cognita.runtime.isa.Instruction;
import org.cognita.runtime.isa.InstructionSignature;
import org.cognita.runtime.isa.OperandType;
import org.cognita.runtime.model.BehaviorModel;
import org.cognita.runtime.model.ContinuationPoint;
import org.cognita.runtime.model.ExtensionModel;
import org.cognita.runtime.model.StateSchema;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decodes behavior model bytecode into instructions and renders a readable listing.
 * Unknown opcodes are reported as {@code UNKNOWN_OP} instead of failing, so the listing
 * can be used on models that did not pass verification.
 */
public class Disassembler {

    /**
     * Decodes all instructions of a model.
     * @param model The model.
     * @return The instructions in code order.
     */
    public List<DisassembledInstruction> disassemble(BehaviorModel model) {
        List<DisassembledInstruction> result = new ArrayList<>();
        int length = model.getCodeLength();
        int ip = 0;
        while (ip < length) {
            int opcodeId = model.codeAt(ip);
            Optional<InstructionSignature> signatureOpt = Instruction.getSignatureById(opcodeId);
            if (signatureOpt.isEmpty()) {
                result.add(new DisassembledInstruction(ip, opcodeId, "UNKNOWN_OP (" + opcodeId + ")", List.of()));
                ip++;
                continue;
            }
            InstructionSignature signature = signatureOpt.get();
            List<Integer> operands = new ArrayList<>(signature.getArity());
            int operandOffset = ip + 1;
            for (OperandType type : signature.operandTypes()) {
                if (operandOffset + type.width() > length) {
                    // Truncated instruction
                    break;
                }
                operands.add(ModelVerifier.readOperand(model, operandOffset, type));
                operandOffset += type.width();
            }
            result.add(new DisassembledInstruction(ip, opcodeId, Instruction.getInstructionNameById(opcodeId), operands));
            ip += signature.getLength();
        }
        return result;
    }

    /**
     * Renders a model header and its instruction listing, resolving operand indices to
     * constant values, slot names and strings.
     * @param model The model.
     * @return The multi-line listing.
     */
    public String render(BehaviorModel model) {
        StringBuilder sb = new StringBuilder();
        sb.append("; model ").append(model.getId()).append(" v").append(model.getVersion()).append('\n');
        if (model instanceof ExtensionModel ext) {
            sb.append(String.format("; extension of %s at 0x%08X%n", ext.getParentModelId(), ext.getAttachPointHash()));
        }
        sb.append("; stack=").append(model.getMaxStackDepth())
                .append(" locals=").append(model.getLocalCount())
                .append(" calls=").append(model.getMaxCallDepth()).append('\n');
        for (ContinuationPoint cp : model.getContinuationPoints()) {
            sb.append(String.format("; cp %s timeout=%dms default=%04d%n", cp.name(), cp.timeoutMs(), cp.defaultFlowOffset()));
        }
        for (DisassembledInstruction insn : disassemble(model)) {
            sb.append(String.format("%04d  %-20s", insn.offset(), insn.opcodeName()));
            Optional<InstructionSignature> signature = Instruction.getSignatureById(insn.opcodeId());
            for (int i = 0; i < insn.operands().size(); i++) {
                OperandType type = signature.orElseThrow().operandTypes().get(i);
                sb.append(i == 0 ? " " : ", ").append(describe(model, type, insn.operands().get(i)));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private String describe(BehaviorModel model, OperandType type, int value) {
        StateSchema schema = model.getSchema();
        return switch (type) {
            case CONSTANT -> value < model.getConstantCount()
                    ? String.format(Locale.ROOT, "#%d (%s)", value, model.getConstants()[value]) : "#" + value;
            case INPUT -> value < schema.inputCount() ? "in:" + schema.inputs().get(value).name() : "in:" + value;
            case OUTPUT -> value < schema.outputCount() ? "out:" + schema.outputs().get(value) : "out:" + value;
            case LOCAL -> "local:" + value;
            case CHANNEL -> "channel:" + value;
            case STRING -> value < model.getStrings().size() ? "\"" + model.getStrings().get(value) + "\"" : "str:" + value;
            case TARGET -> String.format("@%04d", value);
            case CONTINUATION -> value < model.getContinuationPoints().size()
                    ? "cp:" + model.getContinuationPoints().get(value).name() : "cp:" + value;
        };
    }
}
