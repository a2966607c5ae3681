package gp.java.engine;

import gp.core.model.FrameWalker;
import gp.core.model.PermissionDecision;
import gp.core.model.Prompter;
import gp.core.scheduler.DeferredScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-tab geolocation permission negotiator.
 *
 * Serializes permission requests for the tab: at most one origin is being asked
 * about at a time, later origins wait in a FIFO queue, and a repeated request for
 * an origin that is already in progress or queued is absorbed. Decisions are
 * cached per tab (temporary) or process-wide (permanent, in {@link PermanentStore}).
 *
 * Requests are not tracked by id. A decision is delivered to every consumer in
 * the tab whose origin matches, since frames can be destroyed and recreated
 * while the user is deciding.
 *
 * Thread-safety:
 * - tab state is guarded by this negotiator's own ReentrantLock
 * - the permanent store and registry are guarded by the shared lock
 * - cross-tab cancellation runs after this negotiator's lock is released,
 *   so the negotiator itself never takes another tab's lock while holding its own
 * - consumers and the prompter are called with the lock held and must not call
 *   into another negotiator synchronously
 *
 * Instances come from {@link GeolocationPermissions#newNegotiator}; call
 * {@link #close()} when the tab closes.
 */
public final class PermissionNegotiator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PermissionNegotiator.class);

    private final PermanentStore permanentStore;
    private final NegotiatorRegistry registry;
    private final Prompter prompter;
    private final FrameWalker frames;
    private final DeferredScheduler scheduler;
    private final ReentrantLock lock = new ReentrantLock();

    private final PermissionsMap temporaryDecisions = new PermissionsMap();
    private final ArrayDeque<String> queuedOrigins = new ArrayDeque<>();
    private String originInProgress;        // null = no prompt outstanding
    private PermissionDecision pendingDelivery;

    PermissionNegotiator(
        PermanentStore permanentStore,
        NegotiatorRegistry registry,
        Prompter prompter,
        FrameWalker frames,
        DeferredScheduler scheduler
    ) {
        if (permanentStore == null) {
            throw new IllegalArgumentException("permanentStore cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (prompter == null) {
            throw new IllegalArgumentException("prompter cannot be null");
        }
        if (frames == null) {
            throw new IllegalArgumentException("frames cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }

        this.permanentStore = permanentStore;
        this.registry = registry;
        this.prompter = prompter;
        this.frames = frames;
        this.scheduler = scheduler;
    }

    /**
     * Resolves the permission for an origin on behalf of the tab's consumers.
     *
     * Resolution order:
     * 1. Temporary decision for this tab (delivered asynchronously)
     * 2. Permanent decision (delivered asynchronously)
     * 3. Nothing in progress: prompt the user, completion comes via provideDecision
     * 4. Another origin in progress: queue this one unless already queued
     *
     * A request for the origin already in progress has no effect.
     *
     * @param origin The requesting frame's origin key
     * @throws IllegalArgumentException if origin is null or empty
     */
    public void resolve(String origin) {
        Origins.requireValid(origin);

        lock.lock();
        try {
            // Temporary decisions take precedence: the user may have made a
            // one-off choice after a permanent one was recorded.
            Optional<Boolean> temporary = temporaryDecisions.lookup(origin);
            if (temporary.isPresent()) {
                deliverLater(PermissionDecision.temporary(origin, temporary.get()));
                return;
            }

            Optional<Boolean> permanent = permanentStore.lookup(origin);
            if (permanent.isPresent()) {
                deliverLater(PermissionDecision.permanent(origin, permanent.get()));
                return;
            }

            if (originInProgress == null) {
                originInProgress = origin;
                log.debug("Prompting origin={}", origin);
                prompter.showPrompt(origin);
                return;
            }

            if (!originInProgress.equals(origin) && !queuedOrigins.contains(origin)) {
                queuedOrigins.addLast(origin);
                log.debug("Queued origin={} behind={} queueSize={}",
                    origin, originInProgress, queuedOrigins.size());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Accepts the user's decision for the origin currently being prompted.
     *
     * A decision for any other origin is stale (e.g. it was in flight when the tab
     * was reset) and is ignored.
     *
     * @param origin The origin the decision is for
     * @param allow Whether access is granted
     * @param remember true to record the decision permanently for all tabs
     * @throws IllegalArgumentException if origin is null or empty
     */
    public void provideDecision(String origin, boolean allow, boolean remember) {
        Origins.requireValid(origin);

        lock.lock();
        try {
            if (!origin.equals(originInProgress)) {
                log.debug("Ignoring stale decision origin={} inProgress={}", origin, originInProgress);
                return;
            }

            deliver(originInProgress, allow);
            record(origin, allow, remember);

            if (!queuedOrigins.isEmpty()) {
                originInProgress = queuedOrigins.removeFirst();
                log.debug("Prompting next queued origin={}", originInProgress);
                prompter.showPrompt(originInProgress);
            } else {
                originInProgress = null;
            }
        } finally {
            lock.unlock();
        }

        // Other tabs waiting on this origin are answered now instead of re-prompting.
        // They get the decision just made, not a later store read that an admin
        // clear may have emptied.
        if (remember) {
            registry.broadcastCancel(this, origin, allow);
        }
    }

    /**
     * Drops all tab state: in-progress and queued requests, temporary decisions and
     * the pending deferred delivery. Hides any visible prompt. Called on navigation.
     */
    public void reset() {
        lock.lock();
        try {
            originInProgress = null;
            queuedOrigins.clear();
            temporaryDecisions.clear();
            pendingDelivery = null;
            scheduler.cancel();

            prompter.hidePrompt();
        } finally {
            lock.unlock();
        }
        log.debug("Reset tab permission state");
    }

    /**
     * Unregisters this negotiator and drops its pending deferred delivery.
     * Tab state is left as is; the negotiator must not be used afterwards.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            pendingDelivery = null;
            scheduler.cancel();
        } finally {
            lock.unlock();
        }
        registry.unregister(this);
    }

    /**
     * @return the cached decision waiting for deferred delivery, if any
     */
    Optional<PermissionDecision> pendingDelivery() {
        lock.lock();
        try {
            return Optional.ofNullable(pendingDelivery);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Answers a queued request for an origin that another tab just recorded permanently.
     * Origins not queued in this tab are left alone.
     *
     * @param origin The origin key
     * @param allow The permanent decision the other tab recorded
     */
    void cancelQueued(String origin, boolean allow) {
        lock.lock();
        try {
            if (!queuedOrigins.remove(origin)) {
                return;
            }

            log.debug("Cancelled queued origin={} allow={}", origin, allow);
            deliver(origin, allow);
        } finally {
            lock.unlock();
        }
    }

    // MUST be called while holding the lock
    private void record(String origin, boolean allow, boolean remember) {
        if (remember) {
            permanentStore.record(originInProgress, allow);
            // A leftover temporary entry would mask a later clear() of the permanent one.
            temporaryDecisions.remove(origin);
        } else {
            // Another tab may have recorded a permanent decision meanwhile; record anyway.
            temporaryDecisions.record(originInProgress, allow);
        }
    }

    // MUST be called while holding the lock
    // A newer cache hit replaces an undelivered one.
    private void deliverLater(PermissionDecision decision) {
        pendingDelivery = decision;
        try {
            scheduler.scheduleImmediate(this::onDeferredDelivery);
        } catch (RuntimeException e) {
            pendingDelivery = null;
            throw e;
        }
    }

    private void onDeferredDelivery() {
        lock.lock();
        try {
            PermissionDecision decision = pendingDelivery;
            pendingDelivery = null;
            if (decision != null) {
                log.debug("Delivering cached origin={} allow={} permanent={}",
                    decision.origin(), decision.allow(), decision.remember());
                deliver(decision.origin(), decision.allow());
            }
        } finally {
            lock.unlock();
        }
    }

    // MUST be called while holding the lock
    private void deliver(String origin, boolean allow) {
        frames.forEachConsumer((consumerOrigin, consumer) -> {
            // The page may have changed and no longer have a consumer.
            if (consumer != null && origin.equals(consumerOrigin)) {
                consumer.setAllowed(allow);
            }
        });
    }

    /**
     * @return the origin currently being prompted, if any
     */
    public Optional<String> originInProgress() {
        lock.lock();
        try {
            return Optional.ofNullable(originInProgress);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return immutable snapshot of the queued origins, head first
     */
    public List<String> queuedOrigins() {
        lock.lock();
        try {
            return List.copyOf(queuedOrigins);
        } finally {
            lock.unlock();
        }
    }

    public Optional<Boolean> temporaryDecision(String origin) {
        lock.lock();
        try {
            return temporaryDecisions.lookup(origin);
        } finally {
            lock.unlock();
        }
    }

    public boolean hasPendingDelivery() {
        lock.lock();
        try {
            return pendingDelivery != null;
        } finally {
            lock.unlock();
        }
    }
}
