package qg.java.grpc;

import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import qg.core.clock.ManualClock;
import qg.java.engine.AdmissionGate;
import qg.proto.HealthCheckRequest;
import qg.proto.HealthCheckResponse;
import qg.proto.QuotaStatusRequest;
import qg.proto.QuotaStatusServiceGrpc;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the real Netty transport on an ephemeral port.
 */
class GovernorServerTest {

    private GovernorServer server;
    private ManagedChannel channel;

    @AfterEach
    void tearDown() throws Exception {
        if (channel != null) {
            channel.shutdownNow();
            channel.awaitTermination(5, TimeUnit.SECONDS);
        }
        if (server != null) {
            server.stop();
        }
    }

    @Test
    void testServesSharedGateOverNetwork() throws Exception {
        AdmissionGate gate = new AdmissionGate(new ManualClock(0L), 4);
        server = new GovernorServer(0, gate);
        server.start();
        assertTrue(server.getPort() > 0);

        channel = ManagedChannelBuilder.forAddress("localhost", server.getPort())
            .usePlaintext()
            .build();
        QuotaStatusServiceGrpc.QuotaStatusServiceBlockingStub stub = QuotaStatusServiceGrpc.newBlockingStub(channel)
            .withDeadlineAfter(5, TimeUnit.SECONDS);

        gate.admit();

        assertEquals(3L, stub.getQuotaStatus(QuotaStatusRequest.getDefaultInstance()).getAvailableRequests());
        assertEquals(HealthCheckResponse.Status.SERVING,
            stub.healthCheck(HealthCheckRequest.getDefaultInstance()).getStatus());
    }

    @Test
    void testStop_isIdempotent() throws Exception {
        server = new GovernorServer(0, new AdmissionGate(new ManualClock(0L), 4));
        server.start();

        server.stop();
        assertDoesNotThrow(() -> server.stop());
    }
}
