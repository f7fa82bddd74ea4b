package org.cognita.runtime.model;

/**
 * Thrown when a behavior model is malformed or violates a runtime bound of the VM.
 * <p>
 * Raised at load time by the reader and verifier, and at evaluation time only when a
 * bound that the verifier cannot prove (stack or call depth) is exceeded. The error is
 * fatal for the model: callers must not retry the same model.
 */
public class ModelCorruptionException extends RuntimeException {

    private final int offset;

    /**
     * Creates an exception that is not tied to a bytecode offset.
     * @param message The error message.
     */
    public ModelCorruptionException(String message) {
        this(message, -1, null);
    }

    /**
     * Creates an exception for a specific bytecode offset.
     * @param message The error message.
     * @param offset The offending bytecode offset.
     */
    public ModelCorruptionException(String message, int offset) {
        this(message, offset, null);
    }

    /**
     * Creates an exception wrapping a lower-level cause.
     * @param message The error message.
     * @param offset The offending bytecode offset, or -1.
     * @param cause The underlying cause.
     */
    public ModelCorruptionException(String message, int offset, Throwable cause) {
        super(offset >= 0 ? message + " (at offset " + offset + ")" : message, cause);
        this.offset = offset;
    }

    /**
     * @return The bytecode offset the error refers to, or -1 if it is not offset-specific.
     */
    public int getOffset() {
        return offset;
    }
}
