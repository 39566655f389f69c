package org.neuralchilli.taskgroup.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.taskgroup.core.TaskGroup;
import org.neuralchilli.taskgroup.monitoring.TaskGroupMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Creates task groups seeded with the configured defaults and reporting to the
 * shared {@link TaskGroupMonitor}. Options passed by the caller are applied after
 * the defaults and win over them.
 */
@ApplicationScoped
public class TaskGroupFactory {

    private static final Logger log = LoggerFactory.getLogger(TaskGroupFactory.class);

    @Inject
    TaskGroupConfig config;

    @Inject
    TaskGroupMonitor monitor;

    public TaskGroup create(String name, Option... options) {
        List<Option> resolved = new ArrayList<>();
        resolved.add(Options.withTimeout(config.defaultTimeout()));
        if (config.collectResults()) {
            resolved.add(Options.withCollectResults());
        }
        resolved.add(Options.withObserver(monitor));
        if (options != null) {
            resolved.addAll(Arrays.asList(options));
        }

        TaskGroup group = TaskGroup.create(name, resolved.toArray(new Option[0]));
        log.debug("Created {}", group);
        return group;
    }
}
