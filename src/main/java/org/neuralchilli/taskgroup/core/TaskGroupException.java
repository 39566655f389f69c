package org.neuralchilli.taskgroup.core;

/**
 * Base type for errors raised by a task group as a whole.
 * Failures of individual tasks are never reported through this type.
 */
public class TaskGroupException extends RuntimeException {

    public TaskGroupException(String message) {
        super(message);
    }

    public TaskGroupException(String message, Throwable cause) {
        super(message, cause);
    }
}
