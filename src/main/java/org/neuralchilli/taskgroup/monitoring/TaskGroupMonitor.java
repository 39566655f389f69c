package org.neuralchilli.taskgroup.monitoring;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.taskgroup.core.GroupResult;
import org.neuralchilli.taskgroup.core.TaskGroupValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Aggregates task group activity across all groups it observes.
 *
 * Tracks:
 * - runs started, rejected by the pre-flight check and completed
 * - task results delivered in time, delivered late, and faults
 * - run durations
 */
@ApplicationScoped
public class TaskGroupMonitor implements ExecutionObserver {

    private static final Logger log = LoggerFactory.getLogger(TaskGroupMonitor.class);

    // Run metrics
    private final LongAdder runsStarted = new LongAdder();
    private final LongAdder runsRejected = new LongAdder();
    private final LongAdder runsCompleted = new LongAdder();
    private final LongAdder tasksLaunched = new LongAdder();

    // Task metrics
    private final LongAdder tasksDelivered = new LongAdder();
    private final LongAdder tasksTimedOut = new LongAdder();
    private final LongAdder taskFaults = new LongAdder();

    // Timing metrics
    private final LongAdder totalRunNanos = new LongAdder();
    private final AtomicLong maxRunNanos = new AtomicLong(0);

    @Override
    public void onRunStarted(String group, int taskCount) {
        runsStarted.increment();
        tasksLaunched.add(taskCount);
    }

    @Override
    public void onValidationFailed(String group, TaskGroupValidationException error) {
        runsRejected.increment();
    }

    @Override
    public void onDelivered(String group, int index) {
        tasksDelivered.increment();
    }

    @Override
    public void onTimedOut(String group, int index) {
        tasksTimedOut.increment();
    }

    @Override
    public void onFault(String group, int index, Throwable fault) {
        taskFaults.increment();
    }

    @Override
    public void onRunCompleted(String group, GroupResult result, Duration elapsed) {
        long nanos = elapsed.toNanos();
        runsCompleted.increment();
        totalRunNanos.add(nanos);
        maxRunNanos.updateAndGet(current -> Math.max(current, nanos));
    }

    /**
     * Share of finished tasks whose result arrived before the deadline.
     */
    public double getOnTimeRate() {
        long delivered = tasksDelivered.sum();
        long late = tasksTimedOut.sum();
        long total = delivered + late;
        return total > 0 ? (delivered * 100.0) / total : 0.0;
    }

    public Duration getAverageRunDuration() {
        long runs = runsCompleted.sum();
        return runs > 0 ? Duration.ofNanos(totalRunNanos.sum() / runs) : Duration.ZERO;
    }

    /**
     * Get a point-in-time snapshot of all counters.
     */
    public Snapshot snapshot() {
        return new Snapshot(
                runsStarted.sum(),
                runsRejected.sum(),
                runsCompleted.sum(),
                tasksLaunched.sum(),
                tasksDelivered.sum(),
                tasksTimedOut.sum(),
                taskFaults.sum(),
                getOnTimeRate(),
                getAverageRunDuration(),
                Duration.ofNanos(maxRunNanos.get())
        );
    }

    public record Snapshot(
            long runsStarted,
            long runsRejected,
            long runsCompleted,
            long tasksLaunched,
            long tasksDelivered,
            long tasksTimedOut,
            long taskFaults,
            double onTimeRate,
            Duration averageRun,
            Duration maxRun
    ) {
        /**
         * Tasks launched but not yet accounted for. Approximate: a late task whose
         * timeout handler throws is counted both as late and as a fault.
         */
        public long tasksInFlight() {
            return Math.max(0, tasksLaunched - tasksDelivered - tasksTimedOut - taskFaults);
        }

        @Override
        public String toString() {
            return String.format("""
                Task Group Report:
                ==================
                Runs:
                  Started: %d, Completed: %d, Rejected: %d
                  Avg Duration: %dms, Max Duration: %dms

                Tasks:
                  Launched: %d, In Flight: %d
                  On Time: %d, Late: %d, Faults: %d
                  On-Time Rate: %.1f%%
                """,
                    runsStarted, runsCompleted, runsRejected,
                    averageRun.toMillis(), maxRun.toMillis(),
                    tasksLaunched, tasksInFlight(),
                    tasksDelivered, tasksTimedOut, taskFaults,
                    onTimeRate
            );
        }
    }

    /**
     * Reset all metrics (useful for testing).
     */
    public void reset() {
        runsStarted.reset();
        runsRejected.reset();
        runsCompleted.reset();
        tasksLaunched.reset();
        tasksDelivered.reset();
        tasksTimedOut.reset();
        taskFaults.reset();
        totalRunNanos.reset();
        maxRunNanos.set(0);
        log.info("Task group metrics reset");
    }

    /**
     * Log current task group report.
     */
    public void logReport() {
        log.info("\n{}", snapshot());
    }
}
