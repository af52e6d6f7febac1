package ai.attackframework.tools.searchengine.testutils;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.Executor;

/**
 * Single-threaded stand-in for an event loop: tasks are queued and only run when the
 * test calls {@link #runAll()}.
 */
public final class QueuedExecutor implements Executor {

    private final Queue<Runnable> tasks = new ArrayDeque<>();

    @Override
    public void execute(Runnable command) {
        tasks.add(command);
    }

    /** Runs queued tasks, including ones queued while running, until the queue is empty. */
    public int runAll() {
        int ran = 0;
        Runnable r;
        while ((r = tasks.poll()) != null) {
            r.run();
            ran++;
        }
        return ran;
    }

    public int pending() {
        return tasks.size();
    }
}
