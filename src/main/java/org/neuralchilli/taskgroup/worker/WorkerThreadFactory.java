package org.neuralchilli.taskgroup.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread factory for creating named task group threads.
 * Threads are daemons so a task that never returns cannot keep the JVM alive.
 */
public class WorkerThreadFactory implements ThreadFactory {

    private static final Logger log = LoggerFactory.getLogger(WorkerThreadFactory.class);

    private final AtomicInteger counter = new AtomicInteger(0);
    private final String prefix;

    public WorkerThreadFactory(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Thread name prefix cannot be null or empty");
        }
        this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread t = new Thread(r);
        t.setName(prefix + "-" + counter.incrementAndGet());
        t.setDaemon(true);
        t.setUncaughtExceptionHandler((thread, e) ->
                log.error("[{}] Uncaught exception in task group thread", thread.getName(), e));
        return t;
    }

    public int createdThreads() {
        return counter.get();
    }
}
