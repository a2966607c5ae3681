package gp.java.grpc;

import gp.java.engine.GeolocationPermissions;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Standalone gRPC server for geolocation permission administration.
 *
 * <p>Features:
 * <ul>
 *   <li>Configurable port (default: 9090)</li>
 *   <li>Graceful shutdown with timeout</li>
 *   <li>Owns the process-wide {@link GeolocationPermissions}; embedding hosts
 *       create their tab negotiators from {@link #permissions()}</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 * // Run with defaults
 * java gp.java.grpc.PermissionServer
 *
 * // Run with custom port
 * java gp.java.grpc.PermissionServer 8080
 * </pre>
 */
public final class PermissionServer {

    private static final Logger log = LoggerFactory.getLogger(PermissionServer.class);

    private final Server server;
    private final GeolocationPermissions permissions;
    private final PermissionServerConfig config;

    /**
     * Creates a server with a fresh permission state.
     *
     * @param config Server configuration
     */
    public PermissionServer(PermissionServerConfig config) {
        this(config, new GeolocationPermissions());
    }

    /**
     * Creates a server over existing permission state (useful for testing).
     *
     * @param config Server configuration
     * @param permissions Process-wide permission state
     */
    public PermissionServer(PermissionServerConfig config, GeolocationPermissions permissions) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (permissions == null) {
            throw new IllegalArgumentException("permissions cannot be null");
        }
        this.config = config;
        this.permissions = permissions;
        this.server = ServerBuilder.forPort(config.port())
            .addService(new GeolocationPermissionsServiceImpl(permissions.permanentStore()))
            .build();
    }

    /**
     * Starts the server.
     *
     * @throws IOException if server fails to start
     */
    public void start() throws IOException {
        server.start();
        log.info("PermissionServer started on port: {}", server.getPort());

        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down gRPC server (JVM shutdown hook)...");
            try {
                PermissionServer.this.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Shutdown interrupted: {}", e.getMessage());
            }
        }));
    }

    /**
     * Stops the server gracefully.
     *
     * @throws InterruptedException if shutdown is interrupted
     */
    public void stop() throws InterruptedException {
        server.shutdown().awaitTermination(config.shutdownTimeoutSeconds(), TimeUnit.SECONDS);
        log.info("PermissionServer stopped.");
    }

    /**
     * Blocks until server is terminated.
     *
     * @throws InterruptedException if waiting is interrupted
     */
    public void blockUntilShutdown() throws InterruptedException {
        server.awaitTermination();
    }

    /**
     * Returns the port the server is listening on.
     *
     * @return port number
     * @throws IllegalStateException if the server has not been started
     */
    public int getPort() {
        return server.getPort();
    }

    public GeolocationPermissions permissions() {
        return permissions;
    }

    /**
     * Main entry point.
     *
     * @param args Optional: port number
     * @throws IOException if server fails to start
     * @throws InterruptedException if server is interrupted
     */
    public static void main(String[] args) throws IOException, InterruptedException {
        PermissionServerConfig config;
        try {
            config = PermissionServerConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            log.error(e.getMessage());
            System.exit(1);
            return;
        }

        PermissionServer server = new PermissionServer(config);
        server.start();
        server.blockUntilShutdown();
    }
}
