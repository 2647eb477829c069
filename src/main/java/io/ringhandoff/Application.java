package io.ringhandoff;

import io.ringhandoff.config.impl.HandoffConfig;
import io.ringhandoff.config.type.ConfigLoader;
import io.ringhandoff.grpc.server.GrpcAdminServer;
import io.ringhandoff.handoff.manager.HandoffManager;
import io.ringhandoff.handoff.transfer.TransferTaskProvider;
import io.ringhandoff.handoff.transfer.impl.HandoffReceiverSupervisor;
import io.ringhandoff.handoff.transfer.impl.HandoffSenderSupervisor;
import io.ringhandoff.ring.RingEventBus;
import io.ringhandoff.ring.StaticRingManager;
import lombok.extern.slf4j.Slf4j;

/**
 * Main class to start a RingHandoff node: ring view, transfer supervisors, the handoff manager
 * and its gRPC admin surface.
 */
@Slf4j
public class Application {
    public static void main(final String[] args) throws Exception {
        if (args.length < 1) {
            System.err.println("Usage: java -jar ringhandoff.jar <handoff-config.yaml>");
            System.exit(1);
        }

        final HandoffConfig cfg = ConfigLoader.load(args[0]);

        final StaticRingManager ring = new StaticRingManager(cfg.getNodes(), cfg.getRingSize(), cfg.getReplicationFactor());
        final RingEventBus ringEvents = new RingEventBus();
        ringEvents.subscribe(r -> log.info("Ring v{} published ({} partitions)", r.version(), r.ringSize()));

        final TransferTaskProvider provider = ConfigLoader.loadTransferProvider(cfg);
        final HandoffSenderSupervisor senders = new HandoffSenderSupervisor(provider);
        final HandoffReceiverSupervisor receivers = new HandoffReceiverSupervisor(provider);

        final HandoffManager manager = new HandoffManager(
                senders,
                receivers,
                ring,
                ringEvents,
                cfg.getHandoffConcurrency()
        ).start();

        final GrpcAdminServer admin = new GrpcAdminServer(cfg.getAdminPort(), manager);
        admin.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down RingHandoff node {}...", cfg.getNodeId());
                admin.stop();
                manager.close();
                senders.close();
                receivers.close();
                ringEvents.close();
                log.info("Shutdown complete.");
            } catch (final Exception e) {
                log.error("Error during shutdown", e);
            }
        }));

        log.info("RingHandoff node {} started (provider={}, concurrency={}, admin port {})",
                cfg.getNodeId(), provider.getClass().getSimpleName(), cfg.getHandoffConcurrency(), cfg.getAdminPort());

        admin.blockUntilShutdown();
    }
}
