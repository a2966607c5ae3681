package gp.java.grpc;

import gp.java.engine.PermanentStore;
import gp.proto.ClearAllRequest;
import gp.proto.ClearAllResponse;
import gp.proto.ClearRequest;
import gp.proto.ClearResponse;
import gp.proto.GeolocationPermissionsServiceGrpc;
import gp.proto.GetAllowedRequest;
import gp.proto.GetAllowedResponse;
import gp.proto.HealthCheckRequest;
import gp.proto.HealthCheckResponse;
import gp.proto.ListOriginsRequest;
import gp.proto.ListOriginsResponse;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Supplier;

/**
 * gRPC administration service over the permanent geolocation permissions.
 *
 * <p>This is a thin wrapper over {@link PermanentStore} with:
 * <ul>
 *   <li>Request validation (fail-fast with INVALID_ARGUMENT)</li>
 *   <li>Error handling (INTERNAL for unexpected errors)</li>
 *   <li>Protobuf conversion</li>
 * </ul>
 *
 * <p>Thread-safety: PermanentStore handles concurrency internally.
 * This service is stateless and can handle concurrent RPCs.
 */
public final class GeolocationPermissionsServiceImpl
    extends GeolocationPermissionsServiceGrpc.GeolocationPermissionsServiceImplBase {

    private static final Logger log = LoggerFactory.getLogger(GeolocationPermissionsServiceImpl.class);

    private final PermanentStore store;

    /**
     * Creates a new gRPC service wrapping the given store.
     *
     * @param store Process-wide permanent store
     * @throws IllegalArgumentException if store is null
     */
    public GeolocationPermissionsServiceImpl(PermanentStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    @Override
    public void listOrigins(
        ListOriginsRequest request,
        StreamObserver<ListOriginsResponse> responseObserver
    ) {
        respond(responseObserver, () -> {
            List<String> origins = store.listOrigins().stream().sorted().toList();
            return ListOriginsResponse.newBuilder()
                .addAllOrigins(origins)
                .build();
        });
    }

    @Override
    public void getAllowed(
        GetAllowedRequest request,
        StreamObserver<GetAllowedResponse> responseObserver
    ) {
        respond(responseObserver, () -> GetAllowedResponse.newBuilder()
            .setAllowed(store.isAllowed(requireOrigin(request.getOrigin())))
            .build());
    }

    @Override
    public void clear(
        ClearRequest request,
        StreamObserver<ClearResponse> responseObserver
    ) {
        respond(responseObserver, () -> {
            boolean removed = store.clear(requireOrigin(request.getOrigin()));
            log.info("Cleared permanent permission origin={} removed={}", request.getOrigin(), removed);
            return ClearResponse.newBuilder()
                .setRemoved(removed)
                .build();
        });
    }

    @Override
    public void clearAll(
        ClearAllRequest request,
        StreamObserver<ClearAllResponse> responseObserver
    ) {
        respond(responseObserver, () -> {
            int removed = store.clearAll();
            log.info("Cleared all permanent permissions count={}", removed);
            return ClearAllResponse.newBuilder()
                .setRemovedCount(removed)
                .build();
        });
    }

    @Override
    public void healthCheck(
        HealthCheckRequest request,
        StreamObserver<HealthCheckResponse> responseObserver
    ) {
        // Simple health check: if we can respond, we're serving
        HealthCheckResponse response = HealthCheckResponse.newBuilder()
            .setStatus(HealthCheckResponse.Status.SERVING)
            .build();

        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }

    // Protobuf strings are never null, only empty
    private static String requireOrigin(String origin) {
        if (origin.isEmpty()) {
            throw new IllegalArgumentException("origin must not be empty");
        }
        return origin;
    }

    private static <T> void respond(StreamObserver<T> responseObserver, Supplier<T> call) {
        T response;
        try {
            response = call.get();
        } catch (IllegalArgumentException e) {
            responseObserver.onError(
                Status.INVALID_ARGUMENT
                    .withDescription(e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
            return;
        } catch (Exception e) {
            log.error("Unexpected error handling permission RPC", e);
            responseObserver.onError(
                Status.INTERNAL
                    .withDescription("Internal error: " + e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
            return;
        }

        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }
}
