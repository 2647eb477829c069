package io.ringhandoff.handoff.manager;

import io.ringhandoff.handoff.model.Direction;
import io.ringhandoff.handoff.model.HandoffId;
import io.ringhandoff.handoff.transfer.TransportHandle;
import io.ringhandoff.handoff.transfer.impl.TransferSupervisor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SessionTableTest {

    private final TransferSupervisor supervisor = new TransferSupervisor("session-table-test");

    @AfterEach
    public void tearDown() {
        supervisor.close();
    }

    private HandoffSession session(final int partition) {
        final TransportHandle h = supervisor.start(Direction.OUTBOUND, ctx -> Thread.sleep(Long.MAX_VALUE));
        return new HandoffSession(HandoffId.of("kv", partition, 1), Direction.OUTBOUND, h, System.nanoTime(), null);
    }

    @Test
    public void testBeyondReturnsTheNewestSessions() {
        final SessionTable table = new SessionTable();
        final HandoffSession a = session(0);
        final HandoffSession b = session(1);
        final HandoffSession c = session(2);
        table.append(a);
        table.append(b);
        table.append(c);

        assertEquals(List.of(b, c), table.beyond(1));
        assertEquals(List.of(a, b, c), table.beyond(0));
        assertTrue(table.beyond(3).isEmpty());
        assertTrue(table.beyond(10).isEmpty());
        assertEquals(3, table.size());
    }

    @Test
    public void testTakeRemovesByHandleIdentity() {
        final SessionTable table = new SessionTable();
        final HandoffSession a = session(0);
        final HandoffSession b = session(1);
        table.append(a);
        table.append(b);

        assertSame(b, table.find(b.getTransportHandle()));
        assertSame(b, table.take(b.getTransportHandle()));
        assertNull(table.take(b.getTransportHandle()));
        assertNull(table.find(b.getTransportHandle()));
        assertEquals(List.of(a), table.all());
    }
}
