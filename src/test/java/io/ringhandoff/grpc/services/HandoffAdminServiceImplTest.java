package io.ringhandoff.grpc.services;

import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import io.ringhandoff.api.HandoffAdminApi;
import io.ringhandoff.handoff.manager.HandoffManager;
import io.ringhandoff.handoff.model.TransportOptions;
import io.ringhandoff.handoff.transfer.impl.HandoffReceiverSupervisor;
import io.ringhandoff.handoff.transfer.impl.HandoffSenderSupervisor;
import io.ringhandoff.handoff.transfer.impl.SimulatedTransferTaskProvider;
import io.ringhandoff.handoff.transfer.impl.TransferSupervisor;
import io.ringhandoff.ring.RingEventBus;
import io.ringhandoff.ring.StaticRingManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class HandoffAdminServiceImplTest {

    // slow enough that sessions stay listed for the duration of a test
    private final SimulatedTransferTaskProvider provider = new SimulatedTransferTaskProvider(10_000, 100L);
    private final HandoffSenderSupervisor senders = new HandoffSenderSupervisor(new TransferSupervisor("admin-sender"), provider);
    private final HandoffReceiverSupervisor receivers = new HandoffReceiverSupervisor(new TransferSupervisor("admin-receiver"), provider);
    private final RingEventBus ringEvents = new RingEventBus();

    private HandoffManager manager;
    private HandoffAdminServiceImpl service;

    @BeforeEach
    public void setUp() {
        manager = new HandoffManager(senders, receivers, new StaticRingManager(List.of(0, 1), 4, 2), ringEvents, 2).start();
        service = new HandoffAdminServiceImpl(manager);
    }

    @AfterEach
    public void tearDown() {
        manager.close();
        senders.close();
        receivers.close();
        ringEvents.close();
    }

    @Test
    public void testHandoffStatusFiltersByDirection() throws Exception {
        manager.addOutbound("kv", 3, 1, null);
        manager.addInbound(new TransportOptions(false, Map.of("module", "kv", "partition", "2", "node", "1")));

        final CapturingObserver<HandoffAdminApi.StatusReply> all = new CapturingObserver<>();
        service.handoffStatus(HandoffAdminApi.StatusRequest.getDefaultInstance(), all);
        assertEquals(2, all.single().getHandoffsCount());

        final CapturingObserver<HandoffAdminApi.StatusReply> outbound = new CapturingObserver<>();
        service.handoffStatus(HandoffAdminApi.StatusRequest.newBuilder()
                .setDirection(HandoffAdminApi.Direction.OUTBOUND)
                .build(), outbound);

        final HandoffAdminApi.HandoffEntry entry = outbound.single().getHandoffs(0);
        assertEquals(1, outbound.single().getHandoffsCount());
        assertEquals("kv", entry.getModule());
        assertEquals(3, entry.getPartition());
        assertEquals(1, entry.getNode());
        assertEquals(HandoffAdminApi.Direction.OUTBOUND, entry.getDirection());
        assertEquals("active", entry.getState());
    }

    @Test
    public void testUnresolvedInboundHasNoIdFields() throws Exception {
        manager.addInbound(TransportOptions.none());

        final CapturingObserver<HandoffAdminApi.StatusReply> reply = new CapturingObserver<>();
        service.handoffStatus(HandoffAdminApi.StatusRequest.newBuilder()
                .setDirection(HandoffAdminApi.Direction.INBOUND)
                .build(), reply);

        final HandoffAdminApi.HandoffEntry entry = reply.single().getHandoffs(0);
        assertFalse(entry.hasModule());
        assertFalse(entry.hasPartition());
        assertFalse(entry.hasNode());
    }

    @Test
    public void testSetAndGetConcurrency() {
        final CapturingObserver<HandoffAdminApi.Ack> ack = new CapturingObserver<>();
        service.setConcurrency(HandoffAdminApi.SetConcurrencyRequest.newBuilder().setLimit(5).build(), ack);
        assertTrue(ack.single().getSuccess());

        final CapturingObserver<HandoffAdminApi.ConcurrencyReply> limit = new CapturingObserver<>();
        service.getConcurrency(HandoffAdminApi.Empty.getDefaultInstance(), limit);
        assertEquals(5, limit.single().getLimit());
    }

    @Test
    public void testNegativeLimitIsRefused() {
        final CapturingObserver<HandoffAdminApi.Ack> ack = new CapturingObserver<>();
        service.setConcurrency(HandoffAdminApi.SetConcurrencyRequest.newBuilder().setLimit(-3).build(), ack);

        assertFalse(ack.single().getSuccess());
        assertFalse(ack.single().getError().isEmpty());
        assertEquals(2, manager.concurrency());
    }

    @Test
    public void testKillHandoffsDropsLimitToZero() {
        final CapturingObserver<HandoffAdminApi.Ack> ack = new CapturingObserver<>();
        service.killHandoffs(HandoffAdminApi.Empty.getDefaultInstance(), ack);

        assertTrue(ack.single().getSuccess());
        assertEquals(0, manager.concurrency());
    }

    @Test
    public void testExclusionRoundTrip() {
        final CapturingObserver<HandoffAdminApi.Ack> add1 = new CapturingObserver<>();
        final CapturingObserver<HandoffAdminApi.Ack> add2 = new CapturingObserver<>();
        final CapturingObserver<HandoffAdminApi.Ack> remove = new CapturingObserver<>();
        service.addExclusion(exclusion("kv", 9), add1);
        service.addExclusion(exclusion("kv", 1), add2);
        service.removeExclusion(exclusion("kv", 9), remove);
        assertTrue(add1.single().getSuccess());
        assertTrue(remove.single().getSuccess());

        final CapturingObserver<HandoffAdminApi.ExclusionsReply> reply = new CapturingObserver<>();
        service.getExclusions(HandoffAdminApi.ModuleRequest.newBuilder().setModule("kv").build(), reply);
        assertEquals("kv", reply.single().getModule());
        assertEquals(List.of(1), reply.single().getPartitionsList());
    }

    @Test
    public void testEmptyModuleIsRefused() {
        final CapturingObserver<HandoffAdminApi.Ack> ack = new CapturingObserver<>();
        service.addExclusion(exclusion("", 1), ack);

        assertFalse(ack.single().getSuccess());
        assertEquals("module is required", ack.single().getError());
        assertTrue(manager.getExclusions("").isEmpty());
    }

    @Test
    public void testClosedManagerIsReportedToTheCaller() {
        manager.close();

        final CapturingObserver<HandoffAdminApi.Ack> setAck = new CapturingObserver<>();
        service.setConcurrency(HandoffAdminApi.SetConcurrencyRequest.newBuilder().setLimit(3).build(), setAck);
        assertFalse(setAck.single().getSuccess());
        assertEquals("Handoff manager is closed", setAck.single().getError());

        final CapturingObserver<HandoffAdminApi.Ack> killAck = new CapturingObserver<>();
        service.killHandoffs(HandoffAdminApi.Empty.getDefaultInstance(), killAck);
        assertFalse(killAck.single().getSuccess());

        final CapturingObserver<HandoffAdminApi.StatusReply> status = new CapturingObserver<>();
        service.handoffStatus(HandoffAdminApi.StatusRequest.getDefaultInstance(), status);
        assertEquals(Status.Code.UNAVAILABLE, status.errorCode());

        final CapturingObserver<HandoffAdminApi.ConcurrencyReply> limit = new CapturingObserver<>();
        service.getConcurrency(HandoffAdminApi.Empty.getDefaultInstance(), limit);
        assertEquals(Status.Code.UNAVAILABLE, limit.errorCode());

        final CapturingObserver<HandoffAdminApi.ExclusionsReply> exclusions = new CapturingObserver<>();
        service.getExclusions(HandoffAdminApi.ModuleRequest.newBuilder().setModule("kv").build(), exclusions);
        assertEquals(Status.Code.UNAVAILABLE, exclusions.errorCode());
    }

    private static HandoffAdminApi.ExclusionRequest exclusion(final String module, final int partition) {
        return HandoffAdminApi.ExclusionRequest.newBuilder().setModule(module).setPartition(partition).build();
    }

    private static final class CapturingObserver<T> implements StreamObserver<T> {
        private final List<T> values = new ArrayList<>();
        private boolean completed;
        private Throwable error;

        @Override
        public void onNext(final T value) {
            values.add(value);
        }

        @Override
        public void onError(final Throwable t) {
            error = t;
        }

        @Override
        public void onCompleted() {
            completed = true;
        }

        T single() {
            assertNull(error, "unexpected error");
            assertTrue(completed, "stream not completed");
            assertEquals(1, values.size());
            return values.get(0);
        }

        Status.Code errorCode() {
            assertTrue(values.isEmpty());
            assertFalse(completed);
            return Status.fromThrowable(error).getCode();
        }
    }
}
