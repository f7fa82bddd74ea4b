package org.cognita.runtime.model;

import java.nio.charset.StandardCharsets;

/**
 * A named suspension point declared by a behavior model.
 *
 * @param name              The continuation point name.
 * @param nameHash          The 32-bit FNV-1a hash of the UTF-8 encoded name.
 * @param timeoutMs         How long a pause at this point waits for an extension.
 * @param defaultFlowOffset The bytecode offset execution continues at when no extension attaches.
 */
public record ContinuationPoint(String name, int nameHash, int timeoutMs, int defaultFlowOffset) {

    private static final int FNV_OFFSET_BASIS = 0x811C9DC5;
    private static final int FNV_PRIME = 0x01000193;

    /**
     * Creates a continuation point and derives its name hash.
     * @param name The name.
     * @param timeoutMs The timeout in milliseconds.
     * @param defaultFlowOffset The default-flow offset.
     * @return The new continuation point.
     */
    public static ContinuationPoint of(String name, int timeoutMs, int defaultFlowOffset) {
        return new ContinuationPoint(name, hashName(name), timeoutMs, defaultFlowOffset);
    }

    /**
     * Computes the 32-bit FNV-1a hash of a continuation point name.
     * @param name The name to hash.
     * @return The hash value.
     */
    public static int hashName(String name) {
        int hash = FNV_OFFSET_BASIS;
        for (byte b : name.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xFF);
            hash *= FNV_PRIME;
        }
        return hash;
    }
}
