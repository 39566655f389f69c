package org.neuralchilli.taskgroup.domain;

/**
 * Optional capability of a {@link Task}: called when the task finished after the
 * group deadline had already fired, so its result was not collected.
 * <p>
 * Runs on the task's own worker thread once the task returns. The result cannot be
 * put back into the group outcome from here.
 */
public interface TimeoutAware {

    /**
     * @param value value the task eventually produced, may be null
     * @param error error the task eventually produced, may be null
     */
    void onTimeout(Object value, Throwable error);
}
