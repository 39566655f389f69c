package org.neuralchilli.taskgroup.monitoring;

import org.neuralchilli.taskgroup.core.GroupResult;
import org.neuralchilli.taskgroup.core.TaskGroupValidationException;

import java.time.Duration;

/**
 * Callbacks describing the progress of task group executions.
 * <p>
 * Worker callbacks run on the worker thread of the task concerned and must be
 * thread-safe. Exceptions thrown by an observer are logged and ignored.
 */
public interface ExecutionObserver {

    ExecutionObserver NOOP = new ExecutionObserver() {
    };

    default void onRunStarted(String group, int taskCount) {
    }

    default void onValidationFailed(String group, TaskGroupValidationException error) {
    }

    /**
     * Task result accepted before the deadline.
     */
    default void onDelivered(String group, int index) {
    }

    /**
     * Task finished after the deadline fired.
     */
    default void onTimedOut(String group, int index) {
    }

    /**
     * Task (or its timeout handler) threw.
     */
    default void onFault(String group, int index, Throwable fault) {
    }

    default void onRunCompleted(String group, GroupResult result, Duration elapsed) {
    }
}
