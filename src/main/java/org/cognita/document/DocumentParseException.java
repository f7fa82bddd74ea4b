package org.cognita.document;

import org.cognita.document.diagnostics.Diagnostic;

import java.util.List;

/**
 * Thrown when a behavior document cannot be loaded. Carries every diagnostic collected
 * during the load.
 */
public class DocumentParseException extends Exception {

    private final List<Diagnostic> diagnostics;

    public DocumentParseException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public DocumentParseException(String message, Throwable cause) {
        super(message, cause);
        this.diagnostics = List.of();
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
