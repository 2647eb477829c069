package io.ringhandoff.grpc.server;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.ringhandoff.grpc.services.HandoffAdminServiceImpl;
import io.ringhandoff.handoff.manager.HandoffManager;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

@Slf4j
public class GrpcAdminServer implements AutoCloseable {

    private final int port;
    private final HandoffManager manager;
    private Server server;

    public GrpcAdminServer(final int port, final HandoffManager manager) {
        this.port = port;
        this.manager = manager;
    }

    public void start() throws IOException {
        server = ServerBuilder.forPort(port)
                .addService(new HandoffAdminServiceImpl(manager))
                .build()
                .start();

        log.info("gRPC handoff admin service started on port {}", server.getPort());
    }

    public void blockUntilShutdown() throws InterruptedException {
        if (server != null) {
            server.awaitTermination();
        }
    }

    public void stop() {
        if (server == null) return;
        server.shutdown();
        try {
            if (!server.awaitTermination(5, TimeUnit.SECONDS)) {
                server.shutdownNow();
            }
        } catch (final InterruptedException e) {
            server.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }
}
