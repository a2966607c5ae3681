package gp.core.scheduler;

/**
 * Scheduler whose pending task only runs when the owner pumps it.
 * Use this for deterministic tests or hosts that drive their own loop.
 */
public final class ManualScheduler implements DeferredScheduler {
    private Runnable pending;

    @Override
    public void scheduleImmediate(Runnable task) {
        if (task == null) throw new IllegalArgumentException("task cannot be null");
        pending = task;
    }

    @Override
    public void cancel() {
        pending = null;
    }

    public boolean hasPending() {
        return pending != null;
    }

    /**
     * Runs the pending task, if any.
     *
     * @return true if a task ran
     */
    public boolean runPending() {
        Runnable task = pending;
        if (task == null) return false;
        pending = null;
        task.run();
        return true;
    }
}
