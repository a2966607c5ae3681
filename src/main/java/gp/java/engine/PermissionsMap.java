package gp.java.engine;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Origin key to allow/deny map, used for both tab-scoped and permanent decisions.
 *
 * This implementation provides:
 * - O(1) lookup/record/remove
 * - Insertion order for listing (first recorded origin first)
 * - Value equality on origin strings, never identity
 *
 * Thread-safety: NOT thread-safe. The owner guards every access with its own lock
 * (the negotiator lock for temporary decisions, the shared lock for permanent ones).
 */
final class PermissionsMap {

    private final LinkedHashMap<String, Boolean> map = new LinkedHashMap<>();

    /**
     * Returns the recorded decision for an origin.
     *
     * @param origin The origin key
     * @return The allow value, or empty if nothing is recorded
     */
    Optional<Boolean> lookup(String origin) {
        return Optional.ofNullable(map.get(origin));
    }

    /**
     * Records a decision, replacing any previous one for the origin.
     * A replaced origin keeps its original position in the listing order.
     *
     * @param origin The origin key
     * @param allow The decision
     */
    void record(String origin, boolean allow) {
        map.put(origin, allow);
    }

    /**
     * Removes an origin.
     *
     * @param origin The origin key
     * @return true if an entry was removed
     */
    boolean remove(String origin) {
        return map.remove(origin) != null;
    }

    boolean contains(String origin) {
        return map.containsKey(origin);
    }

    int size() {
        return map.size();
    }

    /**
     * Snapshot of the recorded origins, in insertion order.
     * Later changes to this map are not reflected.
     */
    Set<String> origins() {
        return new LinkedHashSet<>(map.keySet());
    }

    void clear() {
        map.clear();
    }
}
