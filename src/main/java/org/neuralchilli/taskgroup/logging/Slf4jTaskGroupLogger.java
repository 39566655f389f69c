package org.neuralchilli.taskgroup.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Default {@link TaskGroupLogger} backed by SLF4J.
 * Context entries are rendered as {@code key=value} pairs after the message;
 * the stack of a fault is left to the logging backend.
 */
public class Slf4jTaskGroupLogger implements TaskGroupLogger {

    private final Logger log;

    public Slf4jTaskGroupLogger() {
        this(LoggerFactory.getLogger("org.neuralchilli.taskgroup"));
    }

    public Slf4jTaskGroupLogger(Logger log) {
        this.log = log;
    }

    @Override
    public void info(String message, Map<String, Object> context) {
        if (log.isInfoEnabled()) {
            log.info("{} {}", message, render(context));
        }
    }

    @Override
    public void error(String message, Throwable error, Map<String, Object> context) {
        log.error("{} {}", message, render(context), error);
    }

    static String render(Map<String, Object> context) {
        if (context == null || context.isEmpty()) {
            return "[]";
        }
        return context.entrySet().stream()
                .filter(e -> !"stack".equals(e.getKey()))
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
