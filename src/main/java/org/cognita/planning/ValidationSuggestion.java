package org.cognita.planning;

public enum ValidationSuggestion {
    CONTINUE,
    REPLAN,
    ABORT
}
