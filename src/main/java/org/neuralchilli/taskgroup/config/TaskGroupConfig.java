package org.neuralchilli.taskgroup.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;

/**
 * Defaults applied to groups created through {@link TaskGroupFactory}.
 */
@ConfigMapping(prefix = "taskgroup")
public interface TaskGroupConfig {

    /**
     * Group deadline; {@code 0s} disables it.
     */
    @WithName("default-timeout")
    @WithDefault("0s")
    Duration defaultTimeout();

    @WithName("collect-results")
    @WithDefault("false")
    boolean collectResults();
}
