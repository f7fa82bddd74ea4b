package org.cognita.document.execution;

/**
 * Aborts a whole execution; never recovered by error handlers.
 */
class ExecutionAbortedException extends RuntimeException {

    ExecutionAbortedException(String message) {
        super(message);
    }

    ExecutionAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
