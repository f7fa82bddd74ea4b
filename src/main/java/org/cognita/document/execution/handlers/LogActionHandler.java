package org.cognita.document.execution.handlers;

import org.cognita.document.ActionNode;
import org.cognita.document.execution.ActionOutcome;
import org.cognita.document.execution.ExecutionContext;
import org.cognita.document.execution.IActionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Handles {@code log}: records the interpolated message in the execution result and forwards it
 * to SLF4J at the requested level (default {@code info}).
 */
public class LogActionHandler implements IActionHandler {

    private static final Logger LOG = LoggerFactory.getLogger("org.cognita.document.log");

    @Override
    public ActionOutcome handle(ActionNode action, ExecutionContext context) {
        String message = context.resolveString(action.param("message"));
        String text = message == null ? "null" : message;
        context.log(text);
        String documentId = context.getDocument().getId();
        String level = String.valueOf(action.param("level", "info")).toLowerCase(Locale.ROOT);
        switch (level) {
            case "debug" -> LOG.debug("[{}] {}", documentId, text);
            case "trace" -> LOG.trace("[{}] {}", documentId, text);
            case "warn", "warning" -> LOG.warn("[{}] {}", documentId, text);
            case "error" -> LOG.error("[{}] {}", documentId, text);
            default -> LOG.info("[{}] {}", documentId, text);
        }
        return ActionOutcome.CONTINUE;
    }
}
