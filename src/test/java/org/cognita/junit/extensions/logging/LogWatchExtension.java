package org.cognita.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Fails a test on WARN or ERROR log events it did not declare.
 * <p>
 * Events are captured by a Logback {@link TurboFilter}, so logging from actor worker threads is
 * seen too. Declared events ({@link AllowLog}, {@link ExpectLog}) are suppressed from the console.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingFilter filter = new CapturingFilter(Rules.resolve(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get("filter", CapturingFilter.class);
        if (filter != null) {
            filter.reset(Rules.resolve(context));
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).get("filter", CapturingFilter.class);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<Event> events = filter.events();
        filter.reset(rules);

        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            for (Event event : events) {
                if (event.level.isGreaterOrEqual(rules.minLevel) && !rules.declares(event)) {
                    problems.add("Unexpected " + event);
                }
            }
        }
        for (Rule expected : rules.expects) {
            long count = events.stream().filter(expected::matches).count();
            if (count < expected.occurrences) {
                problems.add(String.format("Missing expected %s (wanted %d, found %d)", expected, expected.occurrences, count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingFilter filter = context.getStore(NAMESPACE).remove("filter", CapturingFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private static final class CapturingFilter extends TurboFilter {
        private final List<Event> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        CapturingFilter(Rules rules) {
            this.rules = rules;
        }

        void reset(Rules newRules) {
            events.clear();
            rules = newRules;
        }

        List<Event> events() {
            return new ArrayList<>(events);
        }

        @Override
        public FilterReply decide(Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
            // format is null for isXxxEnabled() checks
            if (format == null || level == null || !level.isGreaterOrEqual(Level.INFO)) {
                return FilterReply.NEUTRAL;
            }
            String message = MessageFormatter.arrayFormat(format, params).getMessage();
            Event event = new Event(logger.getName(), level, message);
            events.add(event);
            return rules.declares(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }

    private static final class Event {
        final String loggerName;
        final Level level;
        final String message;

        Event(String loggerName, Level level, String message) {
            this.loggerName = loggerName;
            this.level = level;
            this.message = message;
        }

        @Override
        public String toString() {
            return "[" + level + "] " + loggerName + " - " + message;
        }
    }

    private static final class Rule {
        final Level level;
        final Pattern logger;
        final Pattern message;
        final int occurrences;

        Rule(LogLevel level, String loggerPattern, String messagePattern, int occurrences) {
            this.level = toLogback(level);
            this.logger = Pattern.compile(loggerPattern);
            this.message = Pattern.compile(messagePattern, Pattern.DOTALL);
            this.occurrences = occurrences;
        }

        boolean matches(Event event) {
            return event.level.isGreaterOrEqual(level)
                    && logger.matcher(event.loggerName).matches()
                    && message.matcher(event.message).matches();
        }

        @Override
        public String toString() {
            return "[" + level + "] logger=\"" + logger + "\" message=\"" + message + "\"";
        }
    }

    private static final class Rules {
        final Level minLevel;
        final boolean disabled;
        final List<Rule> allows;
        final List<Rule> expects;

        private Rules(Level minLevel, boolean disabled, List<Rule> allows, List<Rule> expects) {
            this.minLevel = minLevel;
            this.disabled = disabled;
            this.allows = allows;
            this.expects = expects;
        }

        boolean declares(Event event) {
            return Stream.concat(allows.stream(), expects.stream()).anyMatch(rule -> rule.matches(event));
        }

        /**
         * Merges class-level and method-level declarations; a method-level {@link FailOnLog} wins.
         */
        static Rules resolve(ExtensionContext context) {
            Optional<Class<?>> testClass = context.getTestClass();
            Optional<AnnotatedElement> element = context.getElement();
            FailOnLog fail = element.map(e -> e.getAnnotation(FailOnLog.class))
                    .or(() -> testClass.map(c -> c.getAnnotation(FailOnLog.class)))
                    .orElse(null);

            List<Rule> allows = new ArrayList<>();
            List<Rule> expects = new ArrayList<>();
            List<AnnotatedElement> sources = new ArrayList<>();
            testClass.ifPresent(sources::add);
            element.filter(e -> !(e instanceof Class<?>)).ifPresent(sources::add);
            for (AnnotatedElement source : sources) {
                Arrays.stream(source.getAnnotationsByType(AllowLog.class))
                        .forEach(a -> allows.add(new Rule(a.level(), a.loggerPattern(), a.messagePattern(), 0)));
                Arrays.stream(source.getAnnotationsByType(ExpectLog.class))
                        .forEach(x -> expects.add(new Rule(x.level(), x.loggerPattern(), x.messagePattern(), x.occurrences())));
            }
            Level minLevel = fail != null ? toLogback(fail.level()) : Level.WARN;
            return new Rules(minLevel, fail != null && fail.disabled(), allows, expects);
        }
    }
}
