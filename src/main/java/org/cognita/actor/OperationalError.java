package org.cognita.actor;

import java.time.Instant;

/**
 * One recorded error of an actor, kept in a bounded history.
 *
 * @param timestamp When the error occurred.
 * @param errorType A stable code, e.g. {@code HANDLER_FAULT} or {@code PERSISTENCE_FAILURE}.
 * @param message A human-readable message.
 * @param details Additional context.
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
