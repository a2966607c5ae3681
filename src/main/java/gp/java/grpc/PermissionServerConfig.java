package gp.java.grpc;

/**
 * Configuration for {@link PermissionServer}.
 *
 * @param port Port to listen on (0 picks a free port)
 * @param shutdownTimeoutSeconds How long graceful shutdown waits for in-flight calls
 */
public record PermissionServerConfig(
    int port,
    long shutdownTimeoutSeconds
) {
    public static final int DEFAULT_PORT = 9090;
    public static final long DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 5;

    public PermissionServerConfig {
        if (port < 0 || port > 65_535) throw new IllegalArgumentException("port must be in [0, 65535], got: " + port);
        if (shutdownTimeoutSeconds <= 0) throw new IllegalArgumentException("shutdownTimeoutSeconds must be > 0");
    }

    public static PermissionServerConfig defaults() {
        return new PermissionServerConfig(DEFAULT_PORT, DEFAULT_SHUTDOWN_TIMEOUT_SECONDS);
    }

    public static PermissionServerConfig of(int port) {
        return new PermissionServerConfig(port, DEFAULT_SHUTDOWN_TIMEOUT_SECONDS);
    }

    /**
     * Builds a configuration from command-line arguments.
     *
     * @param args Optional: port number
     * @return Configuration, defaults for anything not given
     * @throws IllegalArgumentException if the port is not a valid number
     */
    public static PermissionServerConfig fromArgs(String[] args) {
        if (args == null || args.length == 0) {
            return defaults();
        }
        try {
            return of(Integer.parseInt(args[0]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port: " + args[0], e);
        }
    }
}
