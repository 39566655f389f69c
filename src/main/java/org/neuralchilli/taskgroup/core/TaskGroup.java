package org.neuralchilli.taskgroup.core;

import org.neuralchilli.taskgroup.config.Option;
import org.neuralchilli.taskgroup.config.TaskGroupOptions;
import org.neuralchilli.taskgroup.domain.Result;
import org.neuralchilli.taskgroup.domain.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A batch of independent tasks run in parallel under one deadline.
 *
 * <pre>{@code
 * TaskGroup group = TaskGroup.create("prices",
 *         Options.withTimeout(Duration.ofSeconds(1)),
 *         Options.withCollectResults());
 * group.addTask(() -> Result.success(fetchPrice("a")));
 * group.addTask(() -> Result.success(fetchPrice("b")));
 * List<Result> results = group.execute();
 * }</pre>
 *
 * Configuration by timeout and collection flag:
 * <ul>
 *     <li>timeout and collect: wait up to the deadline, return the results that made it;
 *     late tasks get their {@link org.neuralchilli.taskgroup.domain.TimeoutAware} callback</li>
 *     <li>timeout only: wait up to the deadline, return no results</li>
 *     <li>neither: dispatch every task and return at once</li>
 *     <li>collect without timeout: rejected when executed</li>
 * </ul>
 *
 * Adding tasks is thread-safe. Running the same group twice concurrently is not
 * supported; call {@link #reset()} once a run has completed to reuse the group.
 * Tasks that miss the deadline are not interrupted, they keep running until they
 * return.
 */
public class TaskGroup {

    private static final Logger log = LoggerFactory.getLogger(TaskGroup.class);

    private final Lock lock = new ReentrantLock();
    private final String name;
    private final TaskGroupOptions options;
    private final List<Task> tasks = new ArrayList<>();
    private CancellationSignal parent;

    public TaskGroup(String name, TaskGroupOptions options) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task group name cannot be null or empty");
        }
        this.name = name;
        this.options = options != null ? options : TaskGroupOptions.defaults();
        this.parent = this.options.parent();
    }

    /**
     * Create a group, applying the options in order over the defaults.
     */
    public static TaskGroup create(String name, Option... options) {
        return new TaskGroup(name, TaskGroupOptions.of(options));
    }

    public String name() {
        return name;
    }

    public TaskGroupOptions options() {
        return options;
    }

    public void addTask(Task task) {
        addTasks(List.of(Objects.requireNonNull(task, "task")));
    }

    /**
     * Add a callable; see {@link Task#of(Callable)} for how its outcome maps to a result.
     */
    public void addCallable(Callable<?> callable) {
        addTask(Task.of(callable));
    }

    public void addTasks(Collection<? extends Task> newTasks) {
        Objects.requireNonNull(newTasks, "tasks");
        for (Task task : newTasks) {
            Objects.requireNonNull(task, "Task group cannot hold a null task");
        }
        lock.lock();
        try {
            tasks.addAll(newTasks);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return tasks.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replace the parent signal the next run's deadline is layered on.
     */
    public void bindParent(CancellationSignal parent) {
        lock.lock();
        try {
            this.parent = parent;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop all tasks and the parent signal so the group can be filled again.
     */
    public void reset() {
        lock.lock();
        try {
            tasks.clear();
            parent = null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run all tasks and wait for the outcome.
     *
     * @return collected results in delivery order, empty when collection is disabled
     * @throws TaskGroupValidationException if the group has no tasks, or collects
     *                                      results without a timeout
     * @throws InterruptedException         if interrupted while waiting; the run
     *                                      itself carries on
     */
    public List<Result> execute() throws InterruptedException {
        GroupResult result;
        try {
            result = executeAsync().get();
        } catch (ExecutionException | CancellationException e) {
            throw new TaskGroupException("Task group '" + name + "' did not produce an outcome", e);
        }

        if (result.error() != null) {
            throw result.error();
        }
        return result.results();
    }

    /**
     * Start all tasks and return at once.
     * The returned future is completed exactly once, with a failed-validation
     * outcome if the pre-flight check fails. It is never completed exceptionally.
     */
    public CompletableFuture<GroupResult> executeAsync() {
        lock.lock();
        try {
            TaskGroupValidationException invalid = check();
            if (invalid != null) {
                log.debug("Task group '{}' rejected: {}", name, invalid.reason().description());
                notifyValidationFailed(invalid);
                return CompletableFuture.completedFuture(GroupResult.failure(invalid));
            }

            GroupRun run = new GroupRun(name, tasks, options, parent);
            // callers get a dependent copy, the run's own future is completed once
            return run.start().copy();
        } finally {
            lock.unlock();
        }
    }

    private TaskGroupValidationException check() {
        if (tasks.isEmpty()) {
            return new TaskGroupValidationException(name, TaskGroupValidationException.Reason.NO_TASKS);
        }
        if (options.collectResults() && !options.hasTimeout()) {
            return new TaskGroupValidationException(name, TaskGroupValidationException.Reason.COLLECT_WITHOUT_TIMEOUT);
        }
        return null;
    }

    private void notifyValidationFailed(TaskGroupValidationException invalid) {
        try {
            options.observer().onValidationFailed(name, invalid);
        } catch (Throwable e) {
            log.warn("Execution observer failed for task group '{}'", name, e);
        }
    }

    @Override
    public String toString() {
        return "TaskGroup[" +
                "name=" + name +
                ", tasks=" + size() +
                ", timeout=" + options.timeout() +
                ", collectResults=" + options.collectResults() +
                "]";
    }
}
