package org.cognita.runtime.model;

/**
 * The outcome of a single evaluation or resumption of a behavior model.
 */
public enum EvaluationStatus {
    /** Evaluation ran to the end of the code or a HALT; the output vector is final. */
    COMPLETED,
    /** Evaluation stopped at a continuation point and waits for an extension or its default flow. */
    PAUSED
}
