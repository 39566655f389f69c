package org.neuralchilli.taskgroup.domain;

/**
 * Value/error pair produced by one task invocation.
 * A task's own failure travels here, never as a group-level error.
 */
public record Result(
        Object value,
        Throwable error
) {

    /**
     * Check if the task completed without an error
     */
    public boolean isSuccess() {
        return error == null;
    }

    public static Result success(Object value) {
        return new Result(value, null);
    }

    public static Result failure(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("Failure result requires an error");
        }
        return new Result(null, error);
    }

    /**
     * Failure that still carries a partial value.
     */
    public static Result failure(Object value, Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("Failure result requires an error");
        }
        return new Result(value, error);
    }
}
