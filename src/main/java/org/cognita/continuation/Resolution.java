package org.cognita.continuation;

/**
 * How a pending continuation was resolved.
 *
 * @param continuation The continuation in its final state before resolution.
 * @param extended true if an extension was attached in time.
 * @param extension The attached extension payload, or null when the default flow applies.
 */
public record Resolution(PendingContinuation continuation, boolean extended, Object extension) {

    /**
     * @return true if the default target applies.
     */
    public boolean usesDefault() {
        return !extended;
    }

    /**
     * Returns the extension payload as the expected type.
     * @throws IllegalStateException if the resolution uses the default flow or the payload has another type.
     */
    public <T> T extension(Class<T> type) {
        if (!extended || !type.isInstance(extension)) {
            throw new IllegalStateException("Continuation " + continuation.id() + " has no extension of type " + type.getSimpleName());
        }
        return type.cast(extension);
    }
}
