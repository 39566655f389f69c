package org.neuralchilli.taskgroup.core;

import org.neuralchilli.taskgroup.domain.Result;

import java.util.List;
import java.util.Optional;

/**
 * Terminal outcome of one task group execution.
 *
 * @param results results of tasks that finished before the deadline, in the order
 *                they were delivered (completion order, not submission order).
 *                Always empty when result collection is disabled.
 * @param error   set only when the pre-flight check failed
 */
public record GroupResult(
        List<Result> results,
        TaskGroupValidationException error
) {
    public GroupResult {
        results = results != null ? List.copyOf(results) : List.of();
    }

    /**
     * Check if the execution passed its pre-flight check
     */
    public boolean isSuccess() {
        return error == null;
    }

    public Optional<TaskGroupValidationException> failure() {
        return Optional.ofNullable(error);
    }

    public static GroupResult success(List<Result> results) {
        return new GroupResult(results, null);
    }

    public static GroupResult empty() {
        return new GroupResult(List.of(), null);
    }

    public static GroupResult failure(TaskGroupValidationException error) {
        return new GroupResult(List.of(), error);
    }
}
