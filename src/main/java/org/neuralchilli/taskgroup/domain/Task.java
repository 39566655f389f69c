package org.neuralchilli.taskgroup.domain;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * A unit of work executed concurrently within a task group.
 * <p>
 * Application failures are reported by returning {@link Result#failure(Throwable)}.
 * Anything thrown out of {@link #execute()} is treated as a runtime fault: it is
 * logged by the group and the task contributes no result.
 * <p>
 * A task may additionally implement {@link TimeoutAware} to be told when its
 * result arrived after the group deadline.
 */
@FunctionalInterface
public interface Task {

    Result execute();

    /**
     * Adapt a callable into a task.
     * A returned value becomes a successful result and a checked exception becomes
     * a failed result. Unchecked exceptions and errors escape as faults.
     */
    static Task of(Callable<?> callable) {
        Objects.requireNonNull(callable, "callable");
        return () -> {
            try {
                return Result.success(callable.call());
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                return Result.failure(e);
            }
        };
    }
}
