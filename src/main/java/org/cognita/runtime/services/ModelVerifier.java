package org.cognita.runtime.services;

import org.cognita.runtime.Config;
import org.cognita.runtime.isa.Instruction;
import org.cognita.runtime.isa.InstructionSignature;
import org.cognita.runtime.isa.OperandType;
import org.cognita.runtime.model.BehaviorModel;
import org.cognita.runtime.model.ContinuationPoint;
import org.cognita.runtime.model.ModelCorruptionException;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Load-time verification of behavior models.
 * <p>
 * The verifier decodes the bytecode once to find the instruction boundaries and range-check
 * every operand against the tables it indexes, then runs an abstract interpretation of the
 * operand-stack depth over all reachable paths. Subroutines entered by {@code CALL} are assumed
 * to be stack-neutral; the VM still checks stack bounds at runtime.
 */
public class ModelVerifier {

    private static final int UNVISITED = -1;

    /**
     * Verifies a model.
     * @param model The model to verify.
     * @throws ModelCorruptionException if any structural or stack-depth rule is violated.
     */
    public void verify(BehaviorModel model) {
        verifyLimits(model);
        boolean[] boundaries = decodeBoundaries(model);
        verifyOperands(model, boundaries);
        verifyContinuationPoints(model, boundaries);
        verifyStackDepth(model, boundaries);
    }

    private void verifyLimits(BehaviorModel model) {
        if (model.getMaxStackDepth() < 0 || model.getMaxStackDepth() > Config.MAX_STACK_DEPTH) {
            throw new ModelCorruptionException("Declared stack depth " + model.getMaxStackDepth()
                    + " outside [0, " + Config.MAX_STACK_DEPTH + "]");
        }
        if (model.getLocalCount() < 0 || model.getLocalCount() > Config.MAX_LOCALS) {
            throw new ModelCorruptionException("Declared local count " + model.getLocalCount()
                    + " outside [0, " + Config.MAX_LOCALS + "]");
        }
        if (model.getMaxCallDepth() < 0 || model.getMaxCallDepth() > Config.MAX_CALL_DEPTH) {
            throw new ModelCorruptionException("Declared call depth " + model.getMaxCallDepth()
                    + " outside [0, " + Config.MAX_CALL_DEPTH + "]");
        }
        if (model.getCodeLength() > Config.MAX_CODE_LENGTH) {
            throw new ModelCorruptionException("Code length " + model.getCodeLength() + " exceeds " + Config.MAX_CODE_LENGTH);
        }
    }

    private boolean[] decodeBoundaries(BehaviorModel model) {
        int length = model.getCodeLength();
        boolean[] boundaries = new boolean[length + 1];
        int ip = 0;
        while (ip < length) {
            int opcode = model.codeAt(ip);
            if (!Instruction.isKnown(opcode)) {
                throw new ModelCorruptionException(String.format("Unknown opcode 0x%02X", opcode), ip);
            }
            int instructionLength = Instruction.getInstructionLengthById(opcode);
            if (ip + instructionLength > length) {
                throw new ModelCorruptionException("Truncated operands for " + Instruction.getInstructionNameById(opcode), ip);
            }
            boundaries[ip] = true;
            ip += instructionLength;
        }
        boundaries[length] = true;
        return boundaries;
    }

    private void verifyOperands(BehaviorModel model, boolean[] boundaries) {
        int length = model.getCodeLength();
        for (int ip = 0; ip < length; ip++) {
            if (!boundaries[ip]) {
                continue;
            }
            int opcode = model.codeAt(ip);
            InstructionSignature signature = Instruction.getSignatureById(opcode).orElseThrow();
            int operandOffset = ip + 1;
            for (OperandType type : signature.operandTypes()) {
                int value = readOperand(model, operandOffset, type);
                checkOperand(model, boundaries, opcode, type, value, ip);
                operandOffset += type.width();
            }
        }
    }

    private void checkOperand(BehaviorModel model, boolean[] boundaries, int opcode, OperandType type, int value, int ip) {
        String name = Instruction.getInstructionNameById(opcode);
        switch (type) {
            case CONSTANT -> requireIndex(value, model.getConstantCount(), name + " constant", ip);
            case INPUT -> requireIndex(value, model.getSchema().inputCount(), name + " input", ip);
            case LOCAL -> requireIndex(value, model.getLocalCount(), name + " local", ip);
            case OUTPUT -> requireIndex(value, model.getSchema().outputCount(), name + " output", ip);
            case CHANNEL -> requireIndex(value * Config.SLOTS_PER_INTENT_CHANNEL + 1,
                    model.getSchema().outputCount(), name + " channel slot", ip);
            case STRING -> requireIndex(value, model.getStrings().size(), name + " string", ip);
            case CONTINUATION -> requireIndex(value, model.getContinuationPoints().size(), name + " continuation point", ip);
            case TARGET -> {
                boolean endAllowed = opcode != Instruction.CALL;
                if (value > model.getCodeLength() || !boundaries[value] || (!endAllowed && value == model.getCodeLength())) {
                    throw new ModelCorruptionException(name + " target " + value + " is not an instruction boundary", ip);
                }
            }
        }
    }

    private void requireIndex(int index, int size, String what, int ip) {
        if (index < 0 || index >= size) {
            throw new ModelCorruptionException(what + " index " + index + " out of range [0, " + size + ")", ip);
        }
    }

    private void verifyContinuationPoints(BehaviorModel model, boolean[] boundaries) {
        List<ContinuationPoint> points = model.getContinuationPoints();
        for (int i = 0; i < points.size(); i++) {
            ContinuationPoint cp = points.get(i);
            int offset = cp.defaultFlowOffset();
            if (offset < 0 || offset > model.getCodeLength() || !boundaries[offset]) {
                throw new ModelCorruptionException("Continuation point '" + cp.name()
                        + "' default flow offset " + offset + " is not an instruction boundary");
            }
            if (cp.timeoutMs() < 0) {
                throw new ModelCorruptionException("Continuation point '" + cp.name() + "' has negative timeout");
            }
            if (cp.nameHash() != ContinuationPoint.hashName(cp.name())) {
                throw new ModelCorruptionException("Continuation point '" + cp.name() + "' name hash mismatch");
            }
        }
    }

    private void verifyStackDepth(BehaviorModel model, boolean[] boundaries) {
        int length = model.getCodeLength();
        int[] depthAt = new int[length + 1];
        Arrays.fill(depthAt, UNVISITED);
        Deque<Integer> worklist = new ArrayDeque<>();
        enqueue(depthAt, worklist, 0, 0, -1);

        while (!worklist.isEmpty()) {
            int ip = worklist.pop();
            if (ip == length) {
                continue;
            }
            int opcode = model.codeAt(ip);
            InstructionSignature signature = Instruction.getSignatureById(opcode).orElseThrow();
            int depth = depthAt[ip] - signature.pops();
            if (depth < 0) {
                throw new ModelCorruptionException("Stack underflow in " + Instruction.getInstructionNameById(opcode), ip);
            }
            depth += signature.pushes();
            if (depth > model.getMaxStackDepth()) {
                throw new ModelCorruptionException("Stack depth " + depth + " exceeds declared maximum "
                        + model.getMaxStackDepth(), ip);
            }
            int next = ip + signature.getLength();
            switch (Instruction.getControlFlowById(opcode)) {
                case NEXT -> enqueue(depthAt, worklist, next, depth, ip);
                case JUMP -> enqueue(depthAt, worklist, readOperand(model, ip + 1, OperandType.TARGET), depth, ip);
                case BRANCH, CALL -> {
                    enqueue(depthAt, worklist, readOperand(model, ip + 1, OperandType.TARGET), depth, ip);
                    enqueue(depthAt, worklist, next, depth, ip);
                }
                case SUSPEND -> {
                    int cpIndex = readOperand(model, ip + 1, OperandType.CONTINUATION);
                    enqueue(depthAt, worklist, model.getContinuationPoints().get(cpIndex).defaultFlowOffset(), depth, ip);
                }
                case RETURN, HALT -> {
                    // no successors
                }
            }
        }
    }

    private void enqueue(int[] depthAt, Deque<Integer> worklist, int target, int depth, int from) {
        if (depthAt[target] == UNVISITED) {
            depthAt[target] = depth;
            worklist.push(target);
        } else if (depthAt[target] != depth) {
            throw new ModelCorruptionException("Inconsistent stack depth at merge point " + target
                    + ": " + depthAt[target] + " vs " + depth + " from " + from, target);
        }
    }

    /**
     * Reads a little-endian operand of the given type.
     * @param model The model.
     * @param offset The operand offset.
     * @param type The operand type.
     * @return The unsigned operand value.
     */
    static int readOperand(BehaviorModel model, int offset, OperandType type) {
        if (type.width() == 1) {
            return model.codeAt(offset);
        }
        return model.codeAt(offset) | (model.codeAt(offset + 1) << 8);
    }
}
