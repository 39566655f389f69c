package org.neuralchilli.taskgroup.logging;

import java.util.Map;

/**
 * Reporting sink used by a task group.
 * The group only calls {@link #error} for faults thrown by a task; returned task
 * errors are not logged.
 */
public interface TaskGroupLogger {

    void info(String message, Map<String, Object> context);

    void error(String message, Throwable error, Map<String, Object> context);

    /**
     * Logger that discards everything.
     */
    TaskGroupLogger NOOP = new TaskGroupLogger() {
        @Override
        public void info(String message, Map<String, Object> context) {
        }

        @Override
        public void error(String message, Throwable error, Map<String, Object> context) {
        }
    };
}
