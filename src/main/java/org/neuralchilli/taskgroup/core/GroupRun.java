package org.neuralchilli.taskgroup.core;

import org.neuralchilli.taskgroup.config.TaskGroupOptions;
import org.neuralchilli.taskgroup.domain.Result;
import org.neuralchilli.taskgroup.domain.Task;
import org.neuralchilli.taskgroup.domain.TimeoutAware;
import org.neuralchilli.taskgroup.monitoring.ExecutionObserver;
import org.neuralchilli.taskgroup.worker.TaskWorkers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * State of a single task group execution.
 * <p>
 * One worker is launched per task. Each worker executes its task, then races its
 * result against the run signal through the {@link ResultChannel}. A supervisor
 * waits for all workers or the signal, whichever comes first, then drains the
 * channel and completes the outcome exactly once.
 */
final class GroupRun {

    private static final Logger log = LoggerFactory.getLogger(GroupRun.class);

    private final String groupName;
    private final List<Task> tasks;
    private final TaskGroupOptions options;
    private final CancellationSignal signal;
    private final ResultChannel channel;
    private final AtomicInteger pending;
    private final CompletableFuture<Void> allDone = new CompletableFuture<>();
    private final CompletableFuture<GroupResult> outcome = new CompletableFuture<>();
    private long startNanos;

    GroupRun(String groupName, List<Task> tasks, TaskGroupOptions options, CancellationSignal parent) {
        this.groupName = groupName;
        this.tasks = List.copyOf(tasks);
        this.options = options;
        this.signal = deriveSignal(parent, options);
        this.channel = new ResultChannel(this.tasks.size(), signal);
        this.pending = new AtomicInteger(this.tasks.size());
    }

    /**
     * Deadline-bound child of the parent when a timeout is configured, otherwise a
     * plain child that the run cancels itself.
     */
    static CancellationSignal deriveSignal(CancellationSignal parent, TaskGroupOptions options) {
        CancellationSignal base = parent != null ? parent : CancellationSignal.root();
        return options.hasTimeout()
                ? base.childWithTimeout(options.timeout())
                : base.child();
    }

    CompletableFuture<GroupResult> start() {
        startNanos = System.nanoTime();
        log.debug("Task group '{}' starting {} tasks (timeout={}, collect={})",
                groupName, tasks.size(), options.timeout(), options.collectResults());
        notifyObserver(o -> o.onRunStarted(groupName, tasks.size()));

        for (int i = 0; i < tasks.size(); i++) {
            launch(i, tasks.get(i));
        }

        // without a deadline the run only dispatches; nothing is waited for
        if (!options.hasTimeout()) {
            signal.cancel();
        }

        CompletableFuture.anyOf(allDone, signal.whenCancelled().toCompletableFuture())
                .whenCompleteAsync((ignored, error) -> finish(), TaskWorkers.workers());

        return outcome;
    }

    CancellationSignal signal() {
        return signal;
    }

    private void launch(int index, Task task) {
        try {
            options.executor().execute(() -> runWorker(index, task));
        } catch (RejectedExecutionException e) {
            reportFault("task launch rejected", index, e);
            workerDone();
        }
    }

    private void runWorker(int index, Task task) {
        try {
            Result result = task.execute();
            if (result == null) {
                result = Result.success(null);
            }
            route(index, task, result);
        } catch (Throwable t) {
            reportFault("task run error", index, t);
        } finally {
            workerDone();
        }
    }

    /**
     * Deliver the result, or hand it to the task's timeout handler when the signal
     * has fired. A signal firing at the moment of delivery counts as a timeout.
     */
    private void route(int index, Task task, Result result) {
        if (channel.offer(result)) {
            log.trace("Task group '{}' task {} delivered", groupName, index);
            notifyObserver(o -> o.onDelivered(groupName, index));
            return;
        }

        log.trace("Task group '{}' task {} finished after deadline", groupName, index);
        notifyObserver(o -> o.onTimedOut(groupName, index));
        if (task instanceof TimeoutAware timeoutAware) {
            timeoutAware.onTimeout(result.value(), result.error());
        }
    }

    private void workerDone() {
        if (pending.decrementAndGet() == 0) {
            allDone.complete(null);
        }
    }

    private void finish() {
        boolean expired = signal.isCancelled() && !allDone.isDone();
        List<Result> drained = channel.closeAndDrain();
        signal.cancel();

        GroupResult result = options.collectResults()
                ? GroupResult.success(drained)
                : GroupResult.empty();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

        if (expired) {
            log.debug("Task group '{}' stopped waiting after {}ms ({}), {} of {} results delivered, {} workers still running",
                    groupName, elapsed.toMillis(), signal.reason().orElse(null),
                    drained.size(), tasks.size(), pending.get());
        } else {
            log.debug("Task group '{}' completed in {}ms, {} of {} results delivered",
                    groupName, elapsed.toMillis(), drained.size(), tasks.size());
        }

        try {
            notifyObserver(o -> o.onRunCompleted(groupName, result, elapsed));
        } finally {
            outcome.complete(result);
        }
    }

    private void reportFault(String message, int index, Throwable fault) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("name", groupName);
        context.put("index", index);
        context.put("stack", stackTrace(fault));
        try {
            options.logger().error(message, fault, context);
        } catch (Throwable e) {
            log.warn("Task group '{}' logger failed while reporting task {} fault", groupName, index, e);
        }
        notifyObserver(o -> o.onFault(groupName, index, fault));
    }

    private void notifyObserver(Consumer<ExecutionObserver> call) {
        try {
            call.accept(options.observer());
        } catch (Throwable e) {
            log.warn("Execution observer failed for task group '{}'", groupName, e);
        }
    }

    private static String stackTrace(Throwable t) {
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }
}
