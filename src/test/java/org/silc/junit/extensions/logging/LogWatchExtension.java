package org.silc.junit.extensions.logging;

import ch.qos.logback.classic.Level;
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
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test on any WARN or ERROR log event that is neither declared with {@link ExpectLog}
 * nor tolerated with {@link AllowLog}, and on any {@link ExpectLog} that did not occur.
 * Matching events are kept away from the appenders so expected failures stay quiet.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterAllCallback, AfterEachCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final Level MIN_LEVEL = Level.WARN;

    @Override
    public void beforeAll(ExtensionContext context) {
        WatchFilter filter = new WatchFilter(resolveRules(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        WatchFilter filter = context.getStore(NAMESPACE).get("filter", WatchFilter.class);
        if (filter != null) {
            filter.rules = resolveRules(context);
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        WatchFilter filter = context.getStore(NAMESPACE).get("filter", WatchFilter.class);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<Event> events = new ArrayList<>(filter.events);
        filter.events.clear();

        List<String> problems = new ArrayList<>();
        for (Event e : events) {
            if (!rules.allows(e) && !rules.expects(e)) {
                problems.add("Unexpected log: " + e);
            }
        }
        for (ExpectLog exp : rules.expected) {
            long count = events.stream().filter(e -> matches(e, exp.level(), exp.loggerPattern(), exp.messagePattern())).count();
            if (count < exp.occurrences()) {
                problems.add(String.format("Expected %d x [%s] logger=\"%s\" message=\"%s\", but found %d.",
                        exp.occurrences(), exp.level(), exp.loggerPattern(), exp.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        WatchFilter filter = context.getStore(NAMESPACE).remove("filter", WatchFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules resolveRules(ExtensionContext context) {
        List<AllowLog> allowed = new ArrayList<>();
        List<ExpectLog> expected = new ArrayList<>();
        context.getTestClass().ifPresent(c -> collect(c, allowed, expected));
        context.getTestMethod().ifPresent(m -> collect(m, allowed, expected));
        return new Rules(allowed, expected);
    }

    private static void collect(AnnotatedElement element, List<AllowLog> allowed, List<ExpectLog> expected) {
        allowed.addAll(List.of(element.getAnnotationsByType(AllowLog.class)));
        expected.addAll(List.of(element.getAnnotationsByType(ExpectLog.class)));
    }

    private static boolean matches(Event e, LogLevel level, String loggerPattern, String messagePattern) {
        return e.level.isGreaterOrEqual(toLogback(level))
                && Pattern.matches(loggerPattern, e.loggerName)
                && Pattern.matches(messagePattern, e.message);
    }

    private static Level toLogback(LogLevel level) {
        switch (level) {
            case INFO:
                return Level.INFO;
            case WARN:
                return Level.WARN;
            default:
                return Level.ERROR;
        }
    }

    private static final class Rules {
        final List<AllowLog> allowed;
        final List<ExpectLog> expected;

        Rules(List<AllowLog> allowed, List<ExpectLog> expected) {
            this.allowed = allowed;
            this.expected = expected;
        }

        boolean allows(Event e) {
            return allowed.stream().anyMatch(a -> matches(e, a.level(), a.loggerPattern(), a.messagePattern()));
        }

        boolean expects(Event e) {
            return expected.stream().anyMatch(x -> matches(e, x.level(), x.loggerPattern(), x.messagePattern()));
        }
    }

    private static final class WatchFilter extends TurboFilter {
        final List<Event> events = new CopyOnWriteArrayList<>();
        volatile Rules rules;

        WatchFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format, Object[] params, Throwable t) {
            if (level == null || !level.isGreaterOrEqual(MIN_LEVEL)) {
                return FilterReply.NEUTRAL;
            }
            String message = format == null ? "" : MessageFormatter.arrayFormat(format, params).getMessage();
            Event event = new Event(logger.getName(), level, message == null ? "" : message);
            events.add(event);
            Rules current = rules;
            return current.allows(event) || current.expects(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
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
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }
}
