package org.cognita.runtime.services;

import org.cognita.runtime.Config;
import org.cognita.runtime.isa.Instruction;
import org.cognita.runtime.model.BehaviorModel;
import org.cognita.runtime.model.ContinuationPoint;
import org.cognita.runtime.model.ModelCorruptionException;
import org.cognita.runtime.model.StateSchema;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Load-time rejection of malformed bytecode. Models are assembled by hand so the builder's
 * own verification does not get in the way.
 */
@Tag("unit")
class ModelVerifierTest {

    private final ModelVerifier verifier = new ModelVerifier();

    private static BehaviorModel model(byte[] code, double[] constants, int maxStack, List<ContinuationPoint> points) {
        return new BehaviorModel(UUID.randomUUID(), 1, code, new StateSchema(List.of(), List.of("out")), constants,
                List.of("s"), maxStack, 1, 4, points);
    }

    private static BehaviorModel model(byte[] code, double[] constants, int maxStack) {
        return model(code, constants, maxStack, List.of());
    }

    @Test
    void acceptsWellFormedCode() {
        byte[] code = {Instruction.PUSH_CONST, 0, Instruction.SET_OUTPUT, 0};

        assertThatCode(() -> verifier.verify(model(code, new double[]{1.0}, 1))).doesNotThrowAnyException();
    }

    @Test
    void rejectsConstantIndexOutOfRange() {
        byte[] code = {Instruction.PUSH_CONST, 3, Instruction.POP};

        assertThatThrownBy(() -> verifier.verify(model(code, new double[]{1.0}, 1)))
                .isInstanceOf(ModelCorruptionException.class)
                .hasMessageContaining("constant index 3");
    }

    @Test
    void rejectsJumpIntoOperandBytes() {
        byte[] code = {Instruction.PUSH_CONST, 0, Instruction.JMP, 1, 0};

        assertThatThrownBy(() -> verifier.verify(model(code, new double[]{1.0}, 2)))
                .isInstanceOf(ModelCorruptionException.class)
                .hasMessageContaining("not an instruction boundary");
    }

    @Test
    void rejectsStaticUnderflow() {
        byte[] code = {Instruction.ADD};

        assertThatThrownBy(() -> verifier.verify(model(code, new double[0], 4)))
                .isInstanceOf(ModelCorruptionException.class)
                .hasMessageContaining("underflow");
    }

    @Test
    void rejectsStackDeeperThanDeclared() {
        byte[] code = {Instruction.PUSH_CONST, 0, Instruction.PUSH_CONST, 0, Instruction.ADD, Instruction.POP};

        assertThatThrownBy(() -> verifier.verify(model(code, new double[]{1.0}, 1)))
                .isInstanceOf(ModelCorruptionException.class)
                .hasMessageContaining("exceeds declared maximum");
    }

    @Test
    void rejectsInconsistentDepthAtMergePoint() {
        // JMP_IF over a PUSH leaves depth 0 on one path and 1 on the other
        byte[] code = {
                Instruction.PUSH_CONST, 0,
                Instruction.JMP_IF, 7, 0,
                Instruction.PUSH_CONST, 0,
                Instruction.NOP
        };

        assertThatThrownBy(() -> verifier.verify(model(code, new double[]{1.0}, 4)))
                .isInstanceOf(ModelCorruptionException.class)
                .hasMessageContaining("Inconsistent stack depth");
    }

    @Test
    void rejectsTruncatedOperands() {
        byte[] code = {Instruction.JMP, 0};

        assertThatThrownBy(() -> verifier.verify(model(code, new double[0], 1)))
                .isInstanceOf(ModelCorruptionException.class)
                .hasMessageContaining("Truncated");
    }

    @Test
    void rejectsContinuationDefaultOutsideCode() {
        byte[] code = {Instruction.CONTINUATION_POINT, 0, 0};
        List<ContinuationPoint> points = List.of(ContinuationPoint.of("cp", 100, 99));

        assertThatThrownBy(() -> verifier.verify(model(code, new double[0], 1, points)))
                .isInstanceOf(ModelCorruptionException.class)
                .hasMessageContaining("default flow offset 99");
    }

    @Test
    void rejectsTamperedNameHash() {
        byte[] code = {Instruction.CONTINUATION_POINT, 0, 0};
        List<ContinuationPoint> points = List.of(new ContinuationPoint("cp", 12345, 100, 3));

        assertThatThrownBy(() -> verifier.verify(model(code, new double[0], 1, points)))
                .isInstanceOf(ModelCorruptionException.class)
                .hasMessageContaining("hash");
    }

    @Test
    void rejectsDeclaredLimitsAboveCaps() {
        BehaviorModel model = model(new byte[0], new double[0], Config.MAX_STACK_DEPTH + 1);

        assertThatThrownBy(() -> verifier.verify(model))
                .isInstanceOf(ModelCorruptionException.class)
                .hasMessageContaining("stack depth");
    }
}
