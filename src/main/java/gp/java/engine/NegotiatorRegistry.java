package gp.java.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Set of live negotiators, one per open tab.
 *
 * Used only to broadcast cancellation after a permanent decision. Entries are
 * weak, so a tab that was dropped without close() does not stay reachable.
 *
 * Thread-safety: guarded by the shared lock of the owning {@link GeolocationPermissions}.
 * The broadcast copies the set under the lock and calls the negotiators after
 * releasing it, so the shared lock is never held while a negotiator lock is taken.
 */
final class NegotiatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(NegotiatorRegistry.class);

    private final ReentrantLock lock;
    private final Set<PermissionNegotiator> negotiators =
        Collections.newSetFromMap(new WeakHashMap<>());

    NegotiatorRegistry(ReentrantLock lock) {
        if (lock == null) {
            throw new IllegalArgumentException("lock cannot be null");
        }
        this.lock = lock;
    }

    void register(PermissionNegotiator negotiator) {
        lock.lock();
        try {
            negotiators.add(negotiator);
        } finally {
            lock.unlock();
        }
    }

    void unregister(PermissionNegotiator negotiator) {
        lock.lock();
        try {
            negotiators.remove(negotiator);
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return negotiators.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tells every negotiator except the source to drop its queued request for the origin.
     *
     * @param source The negotiator that recorded the permanent decision
     * @param origin The origin key
     * @param allow The recorded decision, delivered to the cancelled requests
     */
    void broadcastCancel(PermissionNegotiator source, String origin, boolean allow) {
        List<PermissionNegotiator> targets;
        lock.lock();
        try {
            targets = new ArrayList<>(negotiators);
        } finally {
            lock.unlock();
        }
        targets.remove(source);

        log.debug("Broadcasting cancellation origin={} allow={} tabs={}", origin, allow, targets.size());
        for (PermissionNegotiator target : targets) {
            target.cancelQueued(origin, allow);
        }
    }
}
