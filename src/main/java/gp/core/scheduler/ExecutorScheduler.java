package gp.core.scheduler;

import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Scheduler backed by the owning context's executor (e.g. a tab's single-thread event queue).
 *
 * Every scheduled task is submitted right away; superseded and cancelled tasks
 * turn into no-ops when the executor gets to them. Only the latest task runs.
 *
 * If the executor rejects a task (e.g. it was shut down with the tab), the
 * rejection propagates to the caller and nothing stays pending.
 *
 * Thread-safety: safe to schedule/cancel from any thread.
 */
public final class ExecutorScheduler implements DeferredScheduler {
    private final Executor executor;
    private final AtomicReference<Runnable> pending = new AtomicReference<>();

    public ExecutorScheduler(Executor executor) {
        if (executor == null) throw new IllegalArgumentException("executor cannot be null");
        this.executor = executor;
    }

    @Override
    public void scheduleImmediate(Runnable task) {
        if (task == null) throw new IllegalArgumentException("task cannot be null");

        Runnable slot = new Runnable() {
            @Override
            public void run() {
                if (pending.compareAndSet(this, null)) {
                    task.run();
                }
            }
        };
        pending.set(slot);
        try {
            executor.execute(slot);
        } catch (RuntimeException e) {
            // Rejected tasks never run; don't report them as pending.
            pending.compareAndSet(slot, null);
            throw e;
        }
    }

    @Override
    public void cancel() {
        pending.set(null);
    }

    public boolean hasPending() {
        return pending.get() != null;
    }
}
