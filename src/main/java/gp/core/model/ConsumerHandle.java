package gp.core.model;

/**
 * A live permission consumer (e.g. a frame's geolocation object) waiting for a decision.
 *
 * Called with the owning negotiator's lock held. Implementations must not call
 * into another tab's negotiator synchronously; post to that tab's context instead.
 */
@FunctionalInterface
public interface ConsumerHandle {
    void setAllowed(boolean allow);
}
