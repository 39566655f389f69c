package org.neuralchilli.taskgroup.config;

/**
 * A single mutation of a task group's configuration.
 * Options are applied in the order given; later options override earlier ones.
 *
 * @see Options
 */
@FunctionalInterface
public interface Option {

    void apply(TaskGroupOptions.Builder builder);
}
