package com.phillippitts.mindscribe.testutil;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;

/**
 * Executor that queues tasks until the test drains it, to reproduce commands that are submitted
 * but not yet applied.
 */
public class DeferredExecutor implements Executor {

    private final Deque<Runnable> tasks = new ArrayDeque<>();

    @Override
    public synchronized void execute(Runnable command) {
        tasks.add(command);
    }

    public synchronized int pending() {
        return tasks.size();
    }

    /** Runs queued tasks, including ones they enqueue, until none are left. */
    public void drain() {
        Runnable next;
        while ((next = poll()) != null) {
            next.run();
        }
    }

    private synchronized Runnable poll() {
        return tasks.poll();
    }
}
