package gp.java.grpc;

import gp.java.engine.GeolocationPermissions;
import gp.proto.GeolocationPermissionsServiceGrpc;
import gp.proto.GetAllowedRequest;
import gp.proto.HealthCheckRequest;
import gp.proto.HealthCheckResponse;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end test of PermissionServer over a real socket (ephemeral port).
 */
class PermissionServerTest {

    private PermissionServer server;
    private ManagedChannel channel;

    @AfterEach
    void tearDown() throws Exception {
        if (channel != null) {
            channel.shutdown();
            channel.awaitTermination(5, TimeUnit.SECONDS);
        }
        if (server != null) {
            server.stop();
        }
    }

    @Test
    void testServesSharedPermissionState() throws Exception {
        GeolocationPermissions permissions = new GeolocationPermissions();
        permissions.permanentStore().record("https://maps.example.com", true);

        server = new PermissionServer(PermissionServerConfig.of(0), permissions);
        server.start();
        assertTrue(server.getPort() > 0);
        assertSame(permissions, server.permissions());

        channel = ManagedChannelBuilder.forAddress("localhost", server.getPort())
            .usePlaintext()
            .build();
        GeolocationPermissionsServiceGrpc.GeolocationPermissionsServiceBlockingStub stub =
            GeolocationPermissionsServiceGrpc.newBlockingStub(channel);

        assertEquals(HealthCheckResponse.Status.SERVING,
            stub.healthCheck(HealthCheckRequest.getDefaultInstance()).getStatus());
        assertTrue(stub.getAllowed(
            GetAllowedRequest.newBuilder().setOrigin("https://maps.example.com").build()).getAllowed());
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new PermissionServer(null));
        assertThrows(IllegalArgumentException.class,
            () -> new PermissionServer(PermissionServerConfig.defaults(), null));
    }
}
