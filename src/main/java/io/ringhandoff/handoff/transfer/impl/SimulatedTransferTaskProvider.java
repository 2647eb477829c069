package io.ringhandoff.handoff.transfer.impl;

import io.ringhandoff.handoff.model.HandoffId;
import io.ringhandoff.handoff.model.TransportOptions;
import io.ringhandoff.handoff.transfer.TransferContext;
import io.ringhandoff.handoff.transfer.TransferTask;
import io.ringhandoff.handoff.transfer.TransferTaskProvider;
import io.ringhandoff.handoff.vnode.VnodeHandle;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transfer bodies that move no data: they tick through a fixed number of objects with a delay,
 * reporting progress as they go. Used for local clusters and for exercising handoff throttling.
 * <p>
 * A receiver learns what it is receiving from the {@code module}, {@code partition} and
 * {@code node} transport properties, when present.
 */
@Slf4j
@Getter
public final class SimulatedTransferTaskProvider implements TransferTaskProvider {

    public static final String OBJECTS_KEY = "simulatedObjects";
    public static final String DELAY_KEY = "simulatedObjectDelayMillis";

    private final int objects;
    private final long objectDelayMillis;

    public SimulatedTransferTaskProvider() {
        this(100, 10L);
    }

    public SimulatedTransferTaskProvider(final Map<String, Object> settings) {
        this(((Number) settings.getOrDefault(OBJECTS_KEY, 100)).intValue(),
                ((Number) settings.getOrDefault(DELAY_KEY, 10L)).longValue());
    }

    public SimulatedTransferTaskProvider(final int objects, final long objectDelayMillis) {
        if (objects < 0) throw new IllegalArgumentException("objects must be >= 0");
        if (objectDelayMillis < 0) throw new IllegalArgumentException("objectDelayMillis must be >= 0");
        this.objects = objects;
        this.objectDelayMillis = objectDelayMillis;
    }

    @Override
    public TransferTask sender(final int targetNode, final String module, final int partition, final VnodeHandle vnode) {
        return ctx -> {
            log.debug("Simulated send of {} partition {} to node {}", module, partition, targetNode);
            tick(ctx, "objects_sent");
        };
    }

    @Override
    public TransferTask receiver(final TransportOptions options) {
        return ctx -> {
            final String module = options.property("module");
            if (module != null) {
                ctx.reportInboundId(new HandoffId(module,
                        parseOrNull(options.property("partition")),
                        parseOrNull(options.property("node"))));
            }
            tick(ctx, "objects_received");
        };
    }

    private void tick(final TransferContext ctx, final String counter) throws InterruptedException {
        for (int i = 1; i <= objects; i++) {
            if (ctx.isTerminating()) return;
            if (objectDelayMillis > 0) Thread.sleep(objectDelayMillis);
            final Map<String, Object> status = new LinkedHashMap<>();
            status.put(counter, i);
            status.put("objects_total", objects);
            ctx.reportStatus(status);
        }
    }

    private static Integer parseOrNull(final String value) {
        return value == null ? null : Integer.valueOf(value);
    }
}
