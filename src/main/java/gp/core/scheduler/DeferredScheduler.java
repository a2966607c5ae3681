package gp.core.scheduler;

/**
 * Single-shot, zero-delay deferred execution on the owner's context.
 *
 * Contract:
 * - at most one task is pending; scheduling again replaces it
 * - cancel() drops the pending task, if any
 * - a replaced or cancelled task never runs
 */
public interface DeferredScheduler {
    void scheduleImmediate(Runnable task);

    void cancel();
}
