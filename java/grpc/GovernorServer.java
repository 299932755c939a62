package qg.java.grpc;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qg.core.clock.SystemClock;
import qg.java.engine.AdmissionGate;
import qg.java.engine.GovernorConfig;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * gRPC server exposing quota diagnostics for an {@link AdmissionGate}.
 *
 * <p>Features:
 * <ul>
 *   <li>Configurable port (default: 9090)</li>
 *   <li>Graceful shutdown with timeout</li>
 *   <li>Serves the gate owned by the embedding component, or a fresh one in standalone mode</li>
 * </ul>
 *
 * <p>Embedding:
 * <pre>
 * AdmissionGate gate = new AdmissionGate(SystemClock.instance(), config.requestsPerHour());
 * GovernorServer server = new GovernorServer(config.statusPort(), gate);
 * server.start();
 * </pre>
 */
public final class GovernorServer {

    private static final Logger log = LoggerFactory.getLogger(GovernorServer.class);
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Server server;

    /**
     * Creates a server reporting on the given gate.
     *
     * @param port Port to listen on (0 picks a free port)
     * @param gate Gate shared with the outbound-call sites
     */
    public GovernorServer(int port, AdmissionGate gate) {
        this.server = ServerBuilder.forPort(port)
            .addService(new QuotaStatusServiceImpl(gate))
            .build();
    }

    /**
     * Starts the server.
     *
     * @throws IOException if server fails to start
     */
    public void start() throws IOException {
        server.start();
        log.info("GovernorServer started on port: {}", server.getPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down gRPC server (JVM shutdown hook)...");
            try {
                GovernorServer.this.stop();
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
        if (server.isShutdown()) {
            return;
        }
        server.shutdown();
        if (!server.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            log.warn("gRPC server did not stop within {} s, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
            server.shutdownNow();
        }
        log.info("GovernorServer stopped.");
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
     * Returns the bound port. Only valid after {@link #start()}.
     *
     * @return port number
     */
    public int getPort() {
        return server.getPort();
    }

    public static void main(String[] args) throws InterruptedException {
        GovernorConfig config;
        try {
            config = GovernorConfig.load();
        } catch (IOException | IllegalArgumentException e) {
            log.error("Invalid governor configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        AdmissionGate gate = new AdmissionGate(SystemClock.instance(), config.requestsPerHour());
        GovernorServer server = new GovernorServer(config.statusPort(), gate);
        try {
            server.start();
        } catch (IOException e) {
            log.error("Failed to start on port {}", config.statusPort(), e);
            System.exit(1);
            return;
        }
        server.blockUntilShutdown();
    }
}
