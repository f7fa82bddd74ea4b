package org.cognita.runtime;

/**
 * Receives the debug instructions of a running model. Implementations must not allocate
 * heavily; they are called from inside the evaluation loop.
 */
public interface DebugListener {

    /**
     * Called when a BREAKPOINT instruction executes.
     * @param offset The bytecode offset of the breakpoint.
     * @param stackDepth The current operand-stack depth.
     */
    void onBreakpoint(int offset, int stackDepth);

    /**
     * Called when a TRACE instruction executes.
     * @param offset The bytecode offset of the trace instruction.
     * @param message The traced string-table entry.
     */
    void onTrace(int offset, String message);
}
