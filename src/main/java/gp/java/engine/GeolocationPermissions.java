package gp.java.engine;

import gp.core.model.FrameWalker;
import gp.core.model.Prompter;
import gp.core.scheduler.DeferredScheduler;

import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide geolocation permission state, shared by every tab.
 *
 * Owns:
 * - the {@link PermanentStore} (origin to allow/deny, survives tabs)
 * - the registry of live {@link PermissionNegotiator}s used for cross-tab cancellation
 * - one ReentrantLock guarding both
 *
 * Construct one instance at application start and hand it to every tab; tabs get
 * their negotiator from {@link #newNegotiator}.
 *
 * Lock order: a negotiator may take the shared lock while holding its own lock.
 * The shared lock is never held while a negotiator lock is acquired.
 *
 * Usage example:
 * <pre>
 * GeolocationPermissions permissions = new GeolocationPermissions();
 * PermissionNegotiator tab = permissions.newNegotiator(prompter, frameWalker,
 *     new ExecutorScheduler(tabExecutor));
 *
 * tab.resolve("https://maps.example.com");       // prompts the user
 * tab.provideDecision("https://maps.example.com", true, true);
 * permissions.isAllowed("https://maps.example.com");  // true
 * tab.close();
 * </pre>
 */
public final class GeolocationPermissions {

    private final ReentrantLock lock = new ReentrantLock();
    private final PermanentStore permanentStore = new PermanentStore(lock);
    private final NegotiatorRegistry registry = new NegotiatorRegistry(lock);

    /**
     * Creates and registers the negotiator for a new tab.
     *
     * @param prompter Host UI used to ask the user
     * @param frames Frame tree walker bound to the tab's root frame
     * @param scheduler Deferred execution on the tab's context
     * @return A registered negotiator; close it when the tab closes
     * @throws IllegalArgumentException if any parameter is null
     */
    public PermissionNegotiator newNegotiator(
        Prompter prompter,
        FrameWalker frames,
        DeferredScheduler scheduler
    ) {
        PermissionNegotiator negotiator =
            new PermissionNegotiator(permanentStore, registry, prompter, frames, scheduler);
        registry.register(negotiator);
        return negotiator;
    }

    public PermanentStore permanentStore() {
        return permanentStore;
    }

    /**
     * @return origins with a permanent decision
     */
    public Set<String> listOrigins() {
        return permanentStore.listOrigins();
    }

    public boolean isAllowed(String origin) {
        return permanentStore.isAllowed(origin);
    }

    public boolean clear(String origin) {
        return permanentStore.clear(origin);
    }

    public int clearAll() {
        return permanentStore.clearAll();
    }

    /**
     * Returns the number of registered negotiators (open tabs).
     *
     * @return Number of live negotiators
     */
    public int liveNegotiators() {
        return registry.size();
    }
}
