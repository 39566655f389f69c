package org.neuralchilli.taskgroup.core;

import org.neuralchilli.taskgroup.domain.Result;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Buffered hand-off from workers to the collector, sized to the task count so an
 * offer never waits for space.
 * <p>
 * An offer and the deadline check are decided under one lock, and closing takes the
 * same lock, so a result is either in the drained list or routed to the timeout
 * path, never both and never neither. When the deadline has fired the offer is
 * refused even if the channel is still open.
 */
final class ResultChannel {

    private final Lock lock = new ReentrantLock();
    private final List<Result> buffer;
    private final int capacity;
    private final CancellationSignal deadline;
    private boolean closed = false;

    ResultChannel(int capacity, CancellationSignal deadline) {
        this.capacity = capacity;
        this.buffer = new ArrayList<>(capacity);
        this.deadline = deadline;
    }

    /**
     * @return true if the result was accepted, false if the caller must take the
     * timeout path
     */
    boolean offer(Result result) {
        lock.lock();
        try {
            if (closed || deadline.isCancelled()) {
                return false;
            }
            if (buffer.size() >= capacity) {
                throw new IllegalStateException("Result channel over capacity: " + capacity);
            }
            buffer.add(result);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Close the channel and return everything accepted so far, in arrival order.
     * Subsequent offers are refused. Closing twice returns an empty list.
     */
    List<Result> closeAndDrain() {
        lock.lock();
        try {
            if (closed) {
                return List.of();
            }
            closed = true;
            List<Result> drained = List.copyOf(buffer);
            buffer.clear();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }
}
