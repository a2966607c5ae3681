package gp.core.model;

/**
 * A cached decision waiting to be delivered. {@code remember} tells whether it
 * came from the permanent store or from the tab's temporary decisions.
 */
public record PermissionDecision(
    String origin,
    boolean allow,
    boolean remember
) {
    public static PermissionDecision temporary(String origin, boolean allow) {
        return new PermissionDecision(origin, allow, false);
    }

    public static PermissionDecision permanent(String origin, boolean allow) {
        return new PermissionDecision(origin, allow, true);
    }
}
