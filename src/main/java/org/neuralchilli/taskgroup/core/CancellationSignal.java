package org.neuralchilli.taskgroup.core;

import org.neuralchilli.taskgroup.worker.TaskWorkers;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One-way cancellation signal, optionally bound to a deadline.
 * <p>
 * Signals form a tree: cancelling a signal cancels all of its children, never its
 * parent. A child created under an already-cancelled parent starts cancelled.
 * Once fired a signal stays fired.
 */
public final class CancellationSignal {

    public enum Reason {
        /**
         * Cancelled explicitly, or through a cancelled parent
         */
        CANCELLED,

        /**
         * The signal's own deadline (or a parent's) elapsed
         */
        DEADLINE_EXCEEDED
    }

    private final CancellationSignal parent;
    private final Instant deadline;
    private final Set<CancellationSignal> children = ConcurrentHashMap.newKeySet();
    private final AtomicReference<Reason> reason = new AtomicReference<>();
    private final CompletableFuture<Reason> done = new CompletableFuture<>();
    private volatile ScheduledFuture<?> timer;

    private CancellationSignal(CancellationSignal parent, Instant deadline) {
        this.parent = parent;
        this.deadline = deadline;
    }

    /**
     * A signal that only fires when cancelled explicitly.
     */
    public static CancellationSignal root() {
        return new CancellationSignal(null, null);
    }

    /**
     * A child that fires when cancelled or when this signal fires.
     */
    public CancellationSignal child() {
        return attach(new CancellationSignal(this, null));
    }

    /**
     * A child that additionally fires once {@code timeout} has elapsed from now.
     * A deadline later than this signal's own deadline is never reached.
     */
    public CancellationSignal childWithTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive, got: " + timeout);
        }
        CancellationSignal child = attach(new CancellationSignal(this, Instant.now().plus(timeout)));
        if (!child.isCancelled()) {
            child.timer = TaskWorkers.deadlines().schedule(
                    () -> child.fire(Reason.DEADLINE_EXCEEDED),
                    timeout.toNanos(),
                    TimeUnit.NANOSECONDS
            );
            // fired between attach and scheduling
            if (child.isCancelled()) {
                child.timer.cancel(false);
            }
        }
        return child;
    }

    private CancellationSignal attach(CancellationSignal child) {
        children.add(child);
        Reason fired = reason.get();
        if (fired != null) {
            child.fire(fired);
        }
        return child;
    }

    /**
     * Fire the signal.
     *
     * @return true if this call fired it, false if it had already fired
     */
    public boolean cancel() {
        return fire(Reason.CANCELLED);
    }

    private boolean fire(Reason cause) {
        if (!reason.compareAndSet(null, cause)) {
            return false;
        }

        ScheduledFuture<?> t = timer;
        if (t != null) {
            t.cancel(false);
        }
        if (parent != null) {
            parent.children.remove(this);
        }
        for (CancellationSignal child : children) {
            child.fire(cause);
        }
        children.clear();

        done.complete(cause);
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    /**
     * Why the signal fired, empty while it has not.
     */
    public Optional<Reason> reason() {
        return Optional.ofNullable(reason.get());
    }

    /**
     * Deadline of this signal, empty when it has none of its own.
     */
    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Stage completed with the firing reason. Dependent actions run on the thread
     * that fired the signal unless an async variant is used.
     */
    public CompletionStage<Reason> whenCancelled() {
        return done.minimalCompletionStage();
    }

    /**
     * Block until the signal fires or the wait times out.
     *
     * @return true if the signal fired
     */
    public boolean await(Duration timeout) throws InterruptedException {
        try {
            done.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            // done is only ever completed normally
            throw new IllegalStateException(e);
        }
    }

    int childCount() {
        return children.size();
    }

    @Override
    public String toString() {
        return "CancellationSignal[" +
                "cancelled=" + isCancelled() +
                ", reason=" + reason.get() +
                ", deadline=" + deadline +
                "]";
    }
}
