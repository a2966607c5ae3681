package gp.java.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide origin to allow/deny map shared by every tab.
 *
 * Mutated only through record/clear/clearAll. Entries live for the lifetime of the
 * process; writing them to stable storage across restarts is not handled here.
 *
 * Thread-safety: every access takes the shared lock of the owning
 * {@link GeolocationPermissions}, the same lock that guards the negotiator registry.
 */
public final class PermanentStore {

    private static final Logger log = LoggerFactory.getLogger(PermanentStore.class);

    private final ReentrantLock lock;
    private final PermissionsMap permissions = new PermissionsMap();

    PermanentStore(ReentrantLock lock) {
        if (lock == null) {
            throw new IllegalArgumentException("lock cannot be null");
        }
        this.lock = lock;
    }

    /**
     * Records a permanent decision for an origin, replacing any previous one.
     *
     * @param origin The origin key
     * @param allow The decision
     * @throws IllegalArgumentException if origin is null or empty
     */
    public void record(String origin, boolean allow) {
        Origins.requireValid(origin);

        lock.lock();
        try {
            permissions.record(origin, allow);
        } finally {
            lock.unlock();
        }
        log.debug("Recorded permanent decision origin={} allow={}", origin, allow);
    }

    /**
     * Looks up the permanent decision for an origin.
     *
     * @param origin The origin key
     * @return The allow value, or empty if the origin has no permanent decision
     */
    public Optional<Boolean> lookup(String origin) {
        lock.lock();
        try {
            return permissions.lookup(origin);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the stored decision, or false if the origin has none.
     *
     * @param origin The origin key
     * @return true only if an "allow" decision is stored
     */
    public boolean isAllowed(String origin) {
        return lookup(origin).orElse(false);
    }

    /**
     * Returns every origin with a permanent decision.
     *
     * @return Immutable snapshot, in the order origins were first recorded
     */
    public Set<String> listOrigins() {
        lock.lock();
        try {
            return Collections.unmodifiableSet(permissions.origins());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the permanent decision for one origin.
     *
     * @param origin The origin key
     * @return true if an entry was removed
     */
    public boolean clear(String origin) {
        boolean removed;
        lock.lock();
        try {
            removed = permissions.remove(origin);
        } finally {
            lock.unlock();
        }
        if (removed) {
            log.debug("Cleared permanent decision origin={}", origin);
        }
        return removed;
    }

    /**
     * Removes every permanent decision.
     *
     * @return Number of entries removed
     */
    public int clearAll() {
        int removed;
        lock.lock();
        try {
            removed = permissions.size();
            permissions.clear();
        } finally {
            lock.unlock();
        }
        log.debug("Cleared all permanent decisions count={}", removed);
        return removed;
    }

    public int size() {
        lock.lock();
        try {
            return permissions.size();
        } finally {
            lock.unlock();
        }
    }
}
