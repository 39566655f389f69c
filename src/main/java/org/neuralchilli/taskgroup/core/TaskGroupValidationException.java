package org.neuralchilli.taskgroup.core;

/**
 * Thrown (or delivered in a {@link GroupResult}) when a group fails its pre-flight
 * check. No task has been started when this is reported.
 */
public class TaskGroupValidationException extends TaskGroupException {

    public enum Reason {
        NO_TASKS("no tasks to execute"),
        COLLECT_WITHOUT_TIMEOUT("no timeout set for result collection");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    private final String groupName;
    private final Reason reason;

    public TaskGroupValidationException(String groupName, Reason reason) {
        super("Task group '" + groupName + "': " + reason.description());
        this.groupName = groupName;
        this.reason = reason;
    }

    public String groupName() {
        return groupName;
    }

    public Reason reason() {
        return reason;
    }
}
