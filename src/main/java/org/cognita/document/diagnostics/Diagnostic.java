package org.cognita.document.diagnostics;

/**
 * Represents a single diagnostic message (error, warning) reported while loading a behavior document.
 *
 * @param type The type of the diagnostic.
 * @param message The diagnostic message.
 * @param documentName The name of the document the issue occurred in.
 * @param path The location inside the document, e.g. {@code flows.main.actions[2]}.
 */
public record Diagnostic(
        Type type,
        String message,
        String documentName,
        String path
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents the document from loading. */
        ERROR,
        /** A warning that does not prevent loading. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%s: %s", type, documentName, path, message);
    }
}
