package org.neuralchilli.taskgroup.worker;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * Process-wide executors shared by all task groups.
 * <p>
 * Workers run on an unbounded cached pool: every task gets its own thread as soon
 * as it is launched, with no admission control. Deadlines are armed on a single
 * scheduler thread whose timers are removed when cancelled.
 */
public final class TaskWorkers {

    private static final ExecutorService WORKERS =
            Executors.newCachedThreadPool(new WorkerThreadFactory("taskgroup-worker"));

    private static final ScheduledExecutorService DEADLINES = createDeadlineScheduler();

    private TaskWorkers() {
    }

    /**
     * Executor on which task workers run unless a group is given its own.
     */
    public static ExecutorService workers() {
        return WORKERS;
    }

    /**
     * Scheduler firing group deadlines.
     */
    public static ScheduledExecutorService deadlines() {
        return DEADLINES;
    }

    private static ScheduledExecutorService createDeadlineScheduler() {
        ScheduledThreadPoolExecutor scheduler =
                new ScheduledThreadPoolExecutor(1, new WorkerThreadFactory("taskgroup-deadline"));
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
