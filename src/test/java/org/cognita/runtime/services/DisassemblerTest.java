package org.cognita.runtime.services;

import org.cognita.runtime.isa.Instruction;
import org.cognita.runtime.model.BehaviorModel;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DisassemblerTest {

    private final Disassembler disassembler = new Disassembler();

    @Test
    void decodesOffsetsAndOperands() {
        BehaviorModel model = new ModelBuilder()
                .input("hunger", 0.0).output("eat")
                .pushInput("hunger").pushConst(0.7).op(Instruction.GT)
                .jump(Instruction.JMP_UNLESS, "end")
                .pushConst(1).setOutput("eat")
                .label("end")
                .build();

        List<DisassembledInstruction> listing = disassembler.disassemble(model);

        assertThat(listing).extracting(DisassembledInstruction::opcodeName)
                .containsExactly("PUSH_INPUT", "PUSH_CONST", "GT", "JMP_UNLESS", "PUSH_CONST", "SET_OUTPUT");
        assertThat(listing).extracting(DisassembledInstruction::offset)
                .containsExactly(0, 2, 4, 5, 8, 10);
        assertThat(listing.get(3).operands()).containsExactly(12);
    }

    @Test
    void renderResolvesSymbolicOperands() {
        BehaviorModel model = new ModelBuilder()
                .output("eat")
                .continuationPoint("choose", 2000, "end")
                .pushConst(0.5).setOutput("eat")
                .atContinuationPoint(Instruction.CONTINUATION_POINT, "choose")
                .label("end")
                .trace("done")
                .build();

        String text = disassembler.render(model);

        assertThat(text)
                .contains("#0 (0.5)")
                .contains("out:eat")
                .contains("cp:choose")
                .contains("\"done\"")
                .contains("; cp choose timeout=2000ms");
    }
}
