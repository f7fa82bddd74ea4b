package org.cognita.document.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of one document load, so the parser can report every problem
 * in a single pass instead of stopping at the first one.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final String documentName;

    public DiagnosticsEngine(String documentName) {
        this.documentName = documentName;
    }

    public void reportError(String message, String path) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, documentName, path));
    }

    public void reportWarning(String message, String path) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, documentName, path));
    }

    /**
     * @return {@code true} if at least one error was reported.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return All diagnostics as one line each.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
