package org.neuralchilli.taskgroup.config;

import org.neuralchilli.taskgroup.core.CancellationSignal;
import org.neuralchilli.taskgroup.logging.Slf4jTaskGroupLogger;
import org.neuralchilli.taskgroup.logging.TaskGroupLogger;
import org.neuralchilli.taskgroup.monitoring.ExecutionObserver;
import org.neuralchilli.taskgroup.worker.TaskWorkers;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Immutable configuration of a task group, resolved once when the group is created.
 * <p>
 * The collect/timeout coupling is deliberately not checked here; it is reported
 * when the group executes.
 */
public record TaskGroupOptions(
        Duration timeout,  // zero means no deadline
        boolean collectResults,
        CancellationSignal parent,  // nullable
        TaskGroupLogger logger,
        ExecutionObserver observer,
        Executor executor
) {
    public TaskGroupOptions {
        if (timeout == null) {
            timeout = Duration.ZERO;
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout cannot be negative, got: " + timeout);
        }
        if (logger == null) {
            logger = new Slf4jTaskGroupLogger();
        }
        if (observer == null) {
            observer = ExecutionObserver.NOOP;
        }
        if (executor == null) {
            executor = TaskWorkers.workers();
        }
    }

    public boolean hasTimeout() {
        return !timeout.isZero();
    }

    /**
     * Options with every field at its default.
     */
    public static TaskGroupOptions defaults() {
        return builder().build();
    }

    /**
     * Resolve options by applying each option in order on top of the defaults.
     */
    public static TaskGroupOptions of(Option... options) {
        Builder builder = builder();
        if (options != null) {
            for (Option option : options) {
                if (option != null) {
                    option.apply(builder);
                }
            }
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .timeout(timeout)
                .collectResults(collectResults)
                .parent(parent)
                .logger(logger)
                .observer(observer)
                .executor(executor);
    }

    public static class Builder {
        private Duration timeout = Duration.ZERO;
        private boolean collectResults = false;
        private CancellationSignal parent;
        private TaskGroupLogger logger;
        private ExecutionObserver observer;
        private Executor executor;

        Builder() {
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder collectResults(boolean collectResults) {
            this.collectResults = collectResults;
            return this;
        }

        public Builder parent(CancellationSignal parent) {
            this.parent = parent;
            return this;
        }

        public Builder logger(TaskGroupLogger logger) {
            this.logger = logger;
            return this;
        }

        public Builder observer(ExecutionObserver observer) {
            this.observer = observer;
            return this;
        }

        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public TaskGroupOptions build() {
            return new TaskGroupOptions(timeout, collectResults, parent, logger, observer, executor);
        }
    }
}
