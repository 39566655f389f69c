package org.neuralchilli.taskgroup.monitoring;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.taskgroup.core.GroupResult;
import org.neuralchilli.taskgroup.core.TaskGroupValidationException;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class TaskGroupMonitorTest {

    private TaskGroupMonitor monitor;

    @BeforeEach
    void setup() {
        monitor = new TaskGroupMonitor();
    }

    @Test
    void shouldStartEmpty() {
        TaskGroupMonitor.Snapshot snapshot = monitor.snapshot();

        assertThat(snapshot.runsStarted()).isZero();
        assertThat(snapshot.onTimeRate()).isZero();
        assertThat(snapshot.averageRun()).isEqualTo(Duration.ZERO);
        assertThat(snapshot.tasksInFlight()).isZero();
    }

    @Test
    void shouldCountTaskOutcomes() {
        monitor.onRunStarted("g", 4);
        monitor.onDelivered("g", 0);
        monitor.onDelivered("g", 1);
        monitor.onDelivered("g", 2);
        monitor.onTimedOut("g", 3);

        TaskGroupMonitor.Snapshot snapshot = monitor.snapshot();

        assertThat(snapshot.tasksLaunched()).isEqualTo(4);
        assertThat(snapshot.tasksDelivered()).isEqualTo(3);
        assertThat(snapshot.tasksTimedOut()).isEqualTo(1);
        assertThat(snapshot.onTimeRate()).isEqualTo(75.0);
        assertThat(snapshot.tasksInFlight()).isZero();
    }

    @Test
    void shouldTrackInFlightTasks() {
        monitor.onRunStarted("g", 3);
        monitor.onDelivered("g", 0);
        monitor.onFault("g", 1, new IllegalStateException("boom"));

        assertThat(monitor.snapshot().taskFaults()).isEqualTo(1);
        assertThat(monitor.snapshot().tasksInFlight()).isEqualTo(1);
    }

    @Test
    void shouldAverageRunDurations() {
        monitor.onRunCompleted("a", GroupResult.empty(), Duration.ofMillis(100));
        monitor.onRunCompleted("b", GroupResult.empty(), Duration.ofMillis(300));

        TaskGroupMonitor.Snapshot snapshot = monitor.snapshot();

        assertThat(snapshot.runsCompleted()).isEqualTo(2);
        assertThat(snapshot.averageRun()).isEqualTo(Duration.ofMillis(200));
        assertThat(snapshot.maxRun()).isEqualTo(Duration.ofMillis(300));
    }

    @Test
    void shouldCountRejectedRuns() {
        monitor.onValidationFailed("g", new TaskGroupValidationException(
                "g", TaskGroupValidationException.Reason.NO_TASKS));

        assertThat(monitor.snapshot().runsRejected()).isEqualTo(1);
        assertThat(monitor.snapshot().toString()).contains("Rejected: 1");
    }

    @Test
    void shouldResetCounters() {
        monitor.onRunStarted("g", 2);
        monitor.onDelivered("g", 0);
        monitor.onRunCompleted("g", GroupResult.empty(), Duration.ofMillis(10));

        monitor.reset();

        TaskGroupMonitor.Snapshot snapshot = monitor.snapshot();
        assertThat(snapshot.runsStarted()).isZero();
        assertThat(snapshot.tasksDelivered()).isZero();
        assertThat(snapshot.maxRun()).isEqualTo(Duration.ZERO);
    }
}
