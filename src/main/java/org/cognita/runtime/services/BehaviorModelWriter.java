package org.cognita.runtime.services;

import org.cognita.runtime.Config;
import org.cognita.runtime.model.BehaviorModel;
import org.cognita.runtime.model.ContinuationPoint;
import org.cognita.runtime.model.ExtensionModel;
import org.cognita.runtime.model.StateSchema;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Serializes behavior models into the binary container understood by {@link BehaviorModelReader}.
 */
public class BehaviorModelWriter {

    /**
     * Serializes a model.
     * @param model The model to write.
     * @return The encoded bytes.
     * @throws IllegalArgumentException if a table or string does not fit its length prefix.
     */
    public byte[] write(BehaviorModel model) {
        Sink out = new Sink();
        out.putInt(Config.MODEL_MAGIC);
        out.putShort(Config.MODEL_FORMAT_VERSION);
        out.putByte(model instanceof ExtensionModel ? Config.FLAG_EXTENSION : 0);
        if (model instanceof ExtensionModel ext) {
            out.putUuid(ext.getParentModelId());
            out.putInt(ext.getAttachPointHash());
        }
        out.putUuid(model.getId());
        out.putInt(model.getVersion());
        out.putShort(model.getMaxStackDepth());
        out.putShort(model.getLocalCount());
        out.putShort(model.getMaxCallDepth());

        StateSchema schema = model.getSchema();
        out.putCount(schema.inputCount(), "inputs");
        for (StateSchema.InputSlot slot : schema.inputs()) {
            out.putString(slot.name());
            out.putDouble(slot.defaultValue());
        }
        out.putCount(schema.outputCount(), "outputs");
        for (String name : schema.outputs()) {
            out.putString(name);
        }
        double[] constants = model.getConstants();
        out.putCount(constants.length, "constants");
        for (double constant : constants) {
            out.putDouble(constant);
        }
        out.putCount(model.getStrings().size(), "strings");
        for (String s : model.getStrings()) {
            out.putString(s);
        }
        out.putCount(model.getContinuationPoints().size(), "continuation points");
        for (ContinuationPoint cp : model.getContinuationPoints()) {
            out.putString(cp.name());
            out.putInt(cp.timeoutMs());
            out.putInt(cp.defaultFlowOffset());
        }
        byte[] code = model.getCode();
        out.putInt(code.length);
        out.putBytes(code);
        return out.toByteArray();
    }

    private static final class Sink {
        private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        private final ByteBuffer scratch = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN);

        void putByte(int value) {
            bytes.write(value & 0xFF);
        }

        void putShort(int value) {
            scratch.clear();
            scratch.putShort((short) value);
            bytes.write(scratch.array(), 0, 2);
        }

        void putInt(int value) {
            scratch.clear();
            scratch.putInt(value);
            bytes.write(scratch.array(), 0, 4);
        }

        void putLong(long value) {
            scratch.clear();
            scratch.putLong(value);
            bytes.write(scratch.array(), 0, 8);
        }

        void putDouble(double value) {
            putLong(Double.doubleToRawLongBits(value));
        }

        void putUuid(UUID uuid) {
            putLong(uuid.getMostSignificantBits());
            putLong(uuid.getLeastSignificantBits());
        }

        void putCount(int count, String what) {
            if (count > 0xFFFF) {
                throw new IllegalArgumentException("Too many " + what + ": " + count);
            }
            putShort(count);
        }

        void putString(String value) {
            byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
            if (utf8.length > 0xFFFF) {
                throw new IllegalArgumentException("String too long: " + utf8.length + " bytes");
            }
            putShort(utf8.length);
            bytes.write(utf8, 0, utf8.length);
        }

        void putBytes(byte[] data) {
            bytes.write(data, 0, data.length);
        }

        byte[] toByteArray() {
            return bytes.toByteArray();
        }
    }
}
