package org.neuralchilli.taskgroup.config;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.taskgroup.core.GroupResult;
import org.neuralchilli.taskgroup.core.TaskGroup;
import org.neuralchilli.taskgroup.core.TaskGroupValidationException;
import org.neuralchilli.taskgroup.domain.Result;
import org.neuralchilli.taskgroup.monitoring.TaskGroupMonitor;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs against the test profile: 500ms default timeout with collection enabled.
 */
@QuarkusTest
class TaskGroupFactoryTest {

    @Inject
    TaskGroupFactory factory;

    @Inject
    TaskGroupMonitor monitor;

    @Inject
    TaskGroupConfig config;

    @BeforeEach
    void setup() {
        monitor.reset();
    }

    @Test
    void shouldExposeConfiguredDefaults() {
        assertThat(config.defaultTimeout()).isEqualTo(Duration.ofMillis(500));
        assertThat(config.collectResults()).isTrue();
    }

    @Test
    void shouldSeedGroupWithConfiguredDefaults() {
        TaskGroup group = factory.create("configured");

        assertThat(group.name()).isEqualTo("configured");
        assertThat(group.options().timeout()).isEqualTo(Duration.ofMillis(500));
        assertThat(group.options().collectResults()).isTrue();
        assertThat(group.options().observer()).isSameAs(monitor);
    }

    @Test
    void shouldLetCallerOptionsOverrideDefaults() {
        TaskGroup group = factory.create("override", Options.withTimeoutMillis(50));

        assertThat(group.options().timeout()).isEqualTo(Duration.ofMillis(50));
        assertThat(group.options().collectResults()).isTrue();
    }

    @Test
    void shouldReportRunsToMonitor() throws Exception {
        TaskGroup group = factory.create("monitored");
        group.addTask(() -> Result.success("a"));
        group.addTask(() -> Result.success("b"));
        group.addCallable(() -> "c");

        GroupResult outcome = group.executeAsync().get(5, TimeUnit.SECONDS);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.results()).extracting(Result::value)
                .containsExactlyInAnyOrder("a", "b", "c");

        TaskGroupMonitor.Snapshot snapshot = monitor.snapshot();
        assertThat(snapshot.runsStarted()).isEqualTo(1);
        assertThat(snapshot.runsCompleted()).isEqualTo(1);
        assertThat(snapshot.tasksLaunched()).isEqualTo(3);
        assertThat(snapshot.tasksDelivered()).isEqualTo(3);
        assertThat(snapshot.tasksTimedOut()).isZero();
        assertThat(snapshot.onTimeRate()).isEqualTo(100.0);
    }

    @Test
    void shouldReportRejectedRunToMonitor() {
        TaskGroup group = factory.create("empty");

        assertThatThrownBy(group::execute)
                .isInstanceOf(TaskGroupValidationException.class);

        assertThat(monitor.snapshot().runsRejected()).isEqualTo(1);
        assertThat(monitor.snapshot().runsStarted()).isZero();
    }
}
