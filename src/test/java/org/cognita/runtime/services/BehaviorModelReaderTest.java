package org.cognita.runtime.services;

import org.cognita.runtime.Config;
import org.cognita.runtime.isa.Instruction;
import org.cognita.runtime.model.BehaviorModel;
import org.cognita.runtime.model.ExtensionModel;
import org.cognita.runtime.model.ModelCorruptionException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class BehaviorModelReaderTest {

    private final BehaviorModelReader reader = new BehaviorModelReader();
    private final BehaviorModelWriter writer = new BehaviorModelWriter();

    private static BehaviorModel sample() {
        return new ModelBuilder()
                .input("hunger", 0.25).output("eat")
                .continuationPoint("choose", 1500, "fallback")
                .pushInput("hunger").pushConst(0.7).op(Instruction.GT).setOutput("eat")
                .atContinuationPoint(Instruction.CONTINUATION_POINT, "choose")
                .label("fallback")
                .trace("fallback taken")
                .build();
    }

    @Test
    void readsWhatTheWriterProduced() {
        BehaviorModel original = sample();

        BehaviorModel decoded = reader.read(writer.write(original));

        assertThat(decoded.contentEquals(original)).isTrue();
        assertThat(decoded.isExtension()).isFalse();
        assertThat(decoded.getContinuationPoints()).containsExactlyElementsOf(original.getContinuationPoints());
        assertThat(decoded.getSchema().inputs().get(0).defaultValue()).isEqualTo(0.25);
    }

    @Test
    void extensionFlagProducesExtensionModel() {
        UUID parent = UUID.randomUUID();
        ExtensionModel extension = new ModelBuilder().output("eat").pushConst(1).setOutput("eat")
                .buildExtension(parent, "choose");

        BehaviorModel decoded = reader.read(writer.write(extension));

        assertThat(decoded).isInstanceOf(ExtensionModel.class);
        assertThat(((ExtensionModel) decoded).getParentModelId()).isEqualTo(parent);
        assertThat(((ExtensionModel) decoded).getAttachPointHash()).isEqualTo(extension.getAttachPointHash());
    }

    @Test
    void rejectsBadMagic() {
        byte[] bytes = writer.write(sample());
        bytes[0] ^= 0x7F;

        assertThatThrownBy(() -> reader.read(bytes))
                .isInstanceOf(ModelCorruptionException.class)
                .hasMessageContaining("magic");
    }

    @Test
    void rejectsUnsupportedFormatVersion() {
        byte[] bytes = writer.write(sample());
        ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).putShort(4, (short) (Config.MODEL_FORMAT_VERSION + 1));

        assertThatThrownBy(() -> reader.read(bytes))
                .isInstanceOf(ModelCorruptionException.class)
                .hasMessageContaining("format version");
    }

    @Test
    void rejectsTruncatedData() {
        byte[] bytes = writer.write(sample());

        assertThatThrownBy(() -> reader.read(Arrays.copyOf(bytes, bytes.length - 3)))
                .isInstanceOf(ModelCorruptionException.class);
        assertThatThrownBy(() -> reader.read(Arrays.copyOf(bytes, 10)))
                .isInstanceOf(ModelCorruptionException.class)
                .hasMessageContaining("Truncated");
    }

    @Test
    void rejectsTrailingBytes() {
        byte[] bytes = writer.write(sample());

        assertThatThrownBy(() -> reader.read(Arrays.copyOf(bytes, bytes.length + 2)))
                .isInstanceOf(ModelCorruptionException.class)
                .hasMessageContaining("trailing");
    }

    @Test
    void rejectsUnknownOpcodeInCode() {
        byte[] bytes = writer.write(sample());
        bytes[bytes.length - 3] = (byte) 0xEE;

        assertThatThrownBy(() -> reader.read(bytes))
                .isInstanceOf(ModelCorruptionException.class)
                .hasMessageContaining("Unknown opcode 0xEE");
    }

    @Test
    void rejectsNull() {
        assertThatThrownBy(() -> reader.read(null)).isInstanceOf(ModelCorruptionException.class);
    }
}
