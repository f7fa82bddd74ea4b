package org.cognita.document.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a multi-channel execution.
 */
public sealed interface ChannelExecutionResult
        permits ChannelExecutionResult.Completed, ChannelExecutionResult.Failed {

    /**
     * @return The messages logged by all channels, in execution order.
     */
    List<String> logs();

    /**
     * Every channel ran to its end.
     * @param results Channel name to the value its flow returned (null if it returned nothing).
     */
    record Completed(Map<String, Object> results, List<String> logs) implements ChannelExecutionResult {
        public Completed {
            results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
            logs = List.copyOf(logs);
        }
    }

    /**
     * The run stopped.
     * @param failedChannel The channel that failed, or null when the run as a whole failed
     *                      (deadlock, global timeout, cycle limit).
     */
    record Failed(String error, String failedChannel, List<String> logs) implements ChannelExecutionResult {
        public Failed {
            logs = List.copyOf(logs);
        }
    }

    default boolean isCompleted() {
        return this instanceof Completed;
    }
}
