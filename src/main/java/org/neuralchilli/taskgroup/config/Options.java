package org.neuralchilli.taskgroup.config;

import org.neuralchilli.taskgroup.core.CancellationSignal;
import org.neuralchilli.taskgroup.logging.TaskGroupLogger;
import org.neuralchilli.taskgroup.monitoring.ExecutionObserver;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Factory methods for the recognised {@link Option}s.
 */
public final class Options {

    private Options() {
    }

    /**
     * Group deadline, measured from the moment execution starts.
     * {@link Duration#ZERO} disables the deadline.
     */
    public static Option withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        return builder -> builder.timeout(timeout);
    }

    public static Option withTimeoutMillis(long millis) {
        return withTimeout(Duration.ofMillis(millis));
    }

    /**
     * Collect the results of tasks finishing before the deadline.
     * Requires a positive timeout.
     */
    public static Option withCollectResults() {
        return builder -> builder.collectResults(true);
    }

    /**
     * External signal the group deadline is layered on.
     */
    public static Option withParent(CancellationSignal parent) {
        return builder -> builder.parent(parent);
    }

    public static Option withLogger(TaskGroupLogger logger) {
        Objects.requireNonNull(logger, "logger");
        return builder -> builder.logger(logger);
    }

    public static Option withObserver(ExecutionObserver observer) {
        Objects.requireNonNull(observer, "observer");
        return builder -> builder.observer(observer);
    }

    /**
     * Executor running the task workers. It must be able to run every task of a
     * group at once, otherwise queued tasks only start as earlier ones return.
     */
    public static Option withExecutor(Executor executor) {
        Objects.requireNonNull(executor, "executor");
        return builder -> builder.executor(executor);
    }
}
