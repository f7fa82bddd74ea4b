package org.cognita.runtime.services;

import org.cognita.runtime.Config;
import org.cognita.runtime.model.BehaviorModel;
import org.cognita.runtime.model.ContinuationPoint;
import org.cognita.runtime.model.ExtensionModel;
import org.cognita.runtime.model.ModelCorruptionException;
import org.cognita.runtime.model.StateSchema;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Parses the little-endian binary model container and verifies the result.
 * <p>
 * Every structural problem (bad magic, unsupported version, truncated sections, invalid
 * UTF-8, trailing bytes) and every verification failure is reported as a
 * {@link ModelCorruptionException}; a model returned by {@link #read(byte[])} is safe to evaluate.
 */
public class BehaviorModelReader {

    private final ModelVerifier verifier;

    public BehaviorModelReader() {
        this(new ModelVerifier());
    }

    public BehaviorModelReader(ModelVerifier verifier) {
        this.verifier = verifier;
    }

    /**
     * Reads and verifies a model.
     * @param bytes The serialized model.
     * @return The model; an {@link ExtensionModel} if the extension flag is set.
     * @throws ModelCorruptionException if the data is malformed or fails verification.
     */
    public BehaviorModel read(byte[] bytes) {
        if (bytes == null) {
            throw new ModelCorruptionException("Model data is null");
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        BehaviorModel model;
        try {
            model = parse(buffer);
        } catch (BufferUnderflowException e) {
            throw new ModelCorruptionException("Truncated model data", buffer.position(), e);
        }
        if (buffer.hasRemaining()) {
            throw new ModelCorruptionException(buffer.remaining() + " trailing bytes after model", buffer.position());
        }
        verifier.verify(model);
        return model;
    }

    private BehaviorModel parse(ByteBuffer buffer) {
        int magic = buffer.getInt();
        if (magic != Config.MODEL_MAGIC) {
            throw new ModelCorruptionException(String.format("Bad magic 0x%08X", magic), 0);
        }
        int formatVersion = Short.toUnsignedInt(buffer.getShort());
        if (formatVersion != Config.MODEL_FORMAT_VERSION) {
            throw new ModelCorruptionException("Unsupported format version " + formatVersion, 4);
        }
        int flags = Byte.toUnsignedInt(buffer.get());
        boolean extension = (flags & Config.FLAG_EXTENSION) != 0;
        if ((flags & ~Config.FLAG_EXTENSION) != 0) {
            throw new ModelCorruptionException(String.format("Unknown header flags 0x%02X", flags), 6);
        }

        UUID parentId = null;
        int attachPointHash = 0;
        if (extension) {
            parentId = readUuid(buffer);
            attachPointHash = buffer.getInt();
        }
        UUID id = readUuid(buffer);
        int modelVersion = buffer.getInt();
        int maxStackDepth = Short.toUnsignedInt(buffer.getShort());
        int localCount = Short.toUnsignedInt(buffer.getShort());
        int maxCallDepth = Short.toUnsignedInt(buffer.getShort());

        int inputCount = Short.toUnsignedInt(buffer.getShort());
        List<StateSchema.InputSlot> inputs = new ArrayList<>(inputCount);
        for (int i = 0; i < inputCount; i++) {
            inputs.add(new StateSchema.InputSlot(readString(buffer), buffer.getDouble()));
        }
        int outputCount = Short.toUnsignedInt(buffer.getShort());
        List<String> outputs = new ArrayList<>(outputCount);
        for (int i = 0; i < outputCount; i++) {
            outputs.add(readString(buffer));
        }
        int constCount = Short.toUnsignedInt(buffer.getShort());
        double[] constants = new double[constCount];
        for (int i = 0; i < constCount; i++) {
            constants[i] = buffer.getDouble();
        }
        int stringCount = Short.toUnsignedInt(buffer.getShort());
        List<String> strings = new ArrayList<>(stringCount);
        for (int i = 0; i < stringCount; i++) {
            strings.add(readString(buffer));
        }
        int cpCount = Short.toUnsignedInt(buffer.getShort());
        List<ContinuationPoint> points = new ArrayList<>(cpCount);
        for (int i = 0; i < cpCount; i++) {
            String name = readString(buffer);
            int timeoutMs = buffer.getInt();
            int defaultFlowOffset = buffer.getInt();
            points.add(ContinuationPoint.of(name, timeoutMs, defaultFlowOffset));
        }
        int codeLength = buffer.getInt();
        if (codeLength < 0 || codeLength > buffer.remaining()) {
            throw new ModelCorruptionException("Invalid code length " + codeLength, buffer.position() - 4);
        }
        byte[] code = new byte[codeLength];
        buffer.get(code);

        StateSchema schema = new StateSchema(inputs, outputs);
        if (extension) {
            return new ExtensionModel(id, modelVersion, code, schema, constants, strings, maxStackDepth,
                    localCount, maxCallDepth, points, parentId, attachPointHash);
        }
        return new BehaviorModel(id, modelVersion, code, schema, constants, strings, maxStackDepth,
                localCount, maxCallDepth, points);
    }

    private static UUID readUuid(ByteBuffer buffer) {
        long most = buffer.getLong();
        long least = buffer.getLong();
        return new UUID(most, least);
    }

    private static String readString(ByteBuffer buffer) {
        int length = Short.toUnsignedInt(buffer.getShort());
        int start = buffer.position();
        if (length > buffer.remaining()) {
            throw new ModelCorruptionException("String of length " + length + " exceeds remaining data", start);
        }
        ByteBuffer slice = buffer.slice();
        slice.limit(length);
        buffer.position(start + length);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(slice)
                    .toString();
        } catch (CharacterCodingException e) {
            throw new ModelCorruptionException("Invalid UTF-8 string", start, e);
        }
    }
}
