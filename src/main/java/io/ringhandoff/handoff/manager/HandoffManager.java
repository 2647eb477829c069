package io.ringhandoff.handoff.manager;

import io.ringhandoff.handoff.exception.HandoffException;
import io.ringhandoff.handoff.exception.HandoffSpawnException;
import io.ringhandoff.handoff.exception.MaxConcurrencyException;
import io.ringhandoff.handoff.model.Direction;
import io.ringhandoff.handoff.model.ExitReason;
import io.ringhandoff.handoff.model.HandoffExit;
import io.ringhandoff.handoff.model.HandoffId;
import io.ringhandoff.handoff.model.HandoffStatus;
import io.ringhandoff.handoff.model.TransportOptions;
import io.ringhandoff.handoff.transfer.ReceiverSupervisor;
import io.ringhandoff.handoff.transfer.SenderSupervisor;
import io.ringhandoff.handoff.transfer.TransferMonitor;
import io.ringhandoff.handoff.transfer.TransportHandle;
import io.ringhandoff.handoff.vnode.VnodeHandle;
import io.ringhandoff.ring.RingEvents;
import io.ringhandoff.ring.RingStateProvider;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Per-node handoff coordinator.
 * <p>
 * Throttles concurrent transfers, keeps the exclusion set, starts sender/receiver units on request
 * and cleans up after them when they stop. All state lives on one event-loop thread; every public
 * method is a message to that loop. Calls that return something block until the loop has answered,
 * the others ({@link #addExclusion}, {@link #removeExclusion}, {@link #statusUpdate},
 * {@link #setInboundId}) return as soon as the message is queued.
 * <p>
 * Sessions are only ever removed when their unit's exit is observed. Lowering the limit signals the
 * surplus units and leaves them listed until they are gone, so the exit reason still reaches
 * the vnode.
 * <p>
 * One instance per node: build it at startup, {@link #start()} it, {@link #close()} it at shutdown.
 */
@Slf4j
public final class HandoffManager implements AutoCloseable {

    /** Limit used when the configuration does not set one. */
    public static final int DEFAULT_CONCURRENCY = 1;

    private static final long CLOSE_TIMEOUT_MS = 5_000L;

    private final SenderSupervisor senders;
    private final ReceiverSupervisor receivers;
    private final ConcurrencyGovernor governor;
    private final RingStateProvider ringState;
    private final RingEvents ringEvents;

    private final BlockingQueue<Message> mailbox = new LinkedBlockingQueue<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Thread loop;
    private final TransferMonitor monitor = new SessionMonitor();

    // event-loop state
    private final ExclusionRegistry exclusions = new ExclusionRegistry();
    private final SessionTable sessions = new SessionTable();
    private int concurrency;

    public HandoffManager(final SenderSupervisor senders,
                          final ReceiverSupervisor receivers,
                          final RingStateProvider ringState,
                          final RingEvents ringEvents) {
        this(senders, receivers, ringState, ringEvents, DEFAULT_CONCURRENCY);
    }

    public HandoffManager(final SenderSupervisor senders,
                          final ReceiverSupervisor receivers,
                          final RingStateProvider ringState,
                          final RingEvents ringEvents,
                          final int initialConcurrency) {
        if (initialConcurrency < 0) throw new IllegalArgumentException("concurrency must be >= 0");
        this.senders = Objects.requireNonNull(senders, "senders");
        this.receivers = Objects.requireNonNull(receivers, "receivers");
        this.ringState = Objects.requireNonNull(ringState, "ringState");
        this.ringEvents = Objects.requireNonNull(ringEvents, "ringEvents");
        this.governor = new ConcurrencyGovernor(senders, receivers);
        this.concurrency = initialConcurrency;
        this.loop = new Thread(this::runLoop, "handoff-manager");
        this.loop.setDaemon(true);
    }

    public HandoffManager start() {
        if (closed.get()) throw new IllegalStateException("Handoff manager is closed");
        if (started.compareAndSet(false, true)) {
            loop.start();
            log.info("Handoff manager started (concurrency={})", concurrency);
        }
        return this;
    }

    /* ── handoff api ─────────────────────────── */

    /**
     * Starts streaming a local partition to {@code targetNode}.
     *
     * @param vnode owner of the partition; told why the transfer stopped once it has
     * @return handle of the sender unit
     * @throws MaxConcurrencyException if the node is already at its transfer limit
     * @throws HandoffSpawnException   if the sender could not be started
     */
    public TransportHandle addOutbound(final String module,
                                       final int partition,
                                       final int targetNode,
                                       final VnodeHandle vnode) throws MaxConcurrencyException {
        Objects.requireNonNull(module, "module");
        final HandoffId id = HandoffId.of(module, partition, targetNode);
        return awaitAdmission(submit(() -> admit(Direction.OUTBOUND, id, vnode,
                () -> senders.startSender(targetNode, module, partition, vnode))));
    }

    /**
     * Starts a receiver for a partition some remote node is about to stream here.
     *
     * @return handle of the receiver unit
     * @throws MaxConcurrencyException if the node is already at its transfer limit
     * @throws HandoffSpawnException   if the receiver could not be started
     */
    public TransportHandle addInbound(final TransportOptions options) throws MaxConcurrencyException {
        final TransportOptions opts = options == null ? TransportOptions.none() : options;
        return awaitAdmission(submit(() -> admit(Direction.INBOUND, HandoffId.unset(), null,
                () -> receivers.startReceiver(opts))));
    }

    /** Active sessions in admission order. */
    public List<HandoffStatus> handoffStatus() {
        return await(submit(this::statusSnapshot));
    }

    /** Active sessions of one direction, in admission order. */
    public List<HandoffStatus> handoffStatus(final Direction direction) {
        Objects.requireNonNull(direction, "direction");
        final List<HandoffStatus> out = new ArrayList<>();
        for (final HandoffStatus s : handoffStatus()) {
            if (s.direction() == direction) out.add(s);
        }
        return out;
    }

    /**
     * Changes the transfer limit. If more sessions are tracked than the new limit allows, the oldest
     * {@code limit} keep running and the rest are terminated with {@link ExitReason#MAX_CONCURRENCY}.
     */
    public void setConcurrency(final int limit) {
        if (limit < 0) throw new IllegalArgumentException("concurrency must be >= 0, got " + limit);
        await(submit(() -> {
            applyConcurrency(limit);
            return null;
        }));
    }

    public void killHandoffs() {
        setConcurrency(0);
    }

    public int concurrency() {
        return await(submit(() -> concurrency));
    }

    /* ── exclusion api ─────────────────────────── */

    public void addExclusion(final String module, final int partition) {
        Objects.requireNonNull(module, "module");
        tell("add_exclusion", () -> {
            if (exclusions.add(module, partition)) {
                log.info("Excluded {} partition {} from inbound handoff", module, partition);
            }
            ringEvents.ringUpdate(ringState.rawRing());
        });
    }

    public void removeExclusion(final String module, final int partition) {
        Objects.requireNonNull(module, "module");
        tell("remove_exclusion", () -> {
            if (exclusions.remove(module, partition)) {
                log.info("Cleared exclusion of {} partition {}", module, partition);
            }
        });
    }

    /** Excluded partitions of {@code module}, ascending. */
    public List<Integer> getExclusions(final String module) {
        Objects.requireNonNull(module, "module");
        return await(submit(() -> exclusions.partitions(module)));
    }

    /* ── transfer unit reports ─────────────────────────── */

    /** Merges a progress report into the session's status. Unknown handles are ignored. */
    public void statusUpdate(final TransportHandle handle, final Map<String, Object> status) {
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(status, "status");
        tell("status_update", () -> {
            final HandoffSession s = sessions.find(handle);
            if (s != null) s.mergeStatus(status);
        });
    }

    /** Records the id an inbound unit negotiated with its sender. Ignored for outbound or unknown handles. */
    public void setInboundId(final TransportHandle handle, final HandoffId id) {
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(id, "id");
        tell("set_inbound_id", () -> {
            final HandoffSession s = sessions.find(handle);
            if (s == null || s.getDirection() != Direction.INBOUND) {
                log.debug("Ignoring inbound id {} for {}", id, handle);
                return;
            }
            s.resolveId(id);
        });
    }

    /* ── event-loop handlers ─────────────────────────── */

    private TransportHandle admit(final Direction direction,
                                  final HandoffId id,
                                  final VnodeHandle vnode,
                                  final Supplier<TransportHandle> spawn) throws MaxConcurrencyException {
        if (!governor.capacityAvailable(concurrency)) {
            final int active = governor.activeTransfers();
            log.debug("Refusing {} handoff {}: {} active, limit {}", direction.label(), id, active, concurrency);
            throw new MaxConcurrencyException(concurrency, active);
        }

        final TransportHandle handle;
        try {
            handle = Objects.requireNonNull(spawn.get(), "supervisor returned no handle");
        } catch (final HandoffSpawnException e) {
            throw e;
        } catch (final RuntimeException e) {
            throw new HandoffSpawnException("Could not start " + direction.label() + " handoff " + id, e);
        }

        try {
            handle.monitor(monitor);
        } catch (final RuntimeException e) {
            // every running unit the manager admitted must be tracked
            handle.terminate(ExitReason.KILLED);
            throw new HandoffSpawnException("Could not monitor " + direction.label() + " handoff " + id, e);
        }
        sessions.append(new HandoffSession(id, direction, handle, System.nanoTime(), vnode));
        log.debug("Started {} handoff {} as {}", direction.label(), id, handle);
        return handle;
    }

    private List<HandoffStatus> statusSnapshot() {
        final List<HandoffStatus> out = new ArrayList<>(sessions.size());
        for (final HandoffSession s : sessions.all()) {
            out.add(s.snapshot());
        }
        return out;
    }

    private void applyConcurrency(final int limit) {
        concurrency = limit;
        final List<HandoffSession> discard = sessions.beyond(limit);
        if (discard.isEmpty()) {
            log.info("Handoff concurrency set to {}", limit);
            return;
        }
        log.info("Handoff concurrency set to {}, terminating {} of {} sessions", limit, discard.size(), sessions.size());
        // sessions stay listed until their exit arrives
        for (final HandoffSession s : discard) {
            s.getTransportHandle().terminate(ExitReason.MAX_CONCURRENCY);
        }
    }

    private void onExit(final TransportHandle handle, final ExitReason reason) {
        final HandoffSession s = sessions.take(handle);
        if (s == null) {
            log.debug("Exit of untracked transfer {} ({})", handle, reason);
            return;
        }
        log.debug("{} handoff {} stopped after {} ms: {}", s.getDirection().label(), s.getId(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - s.getStartedAtNanos()), reason);

        if (!reason.isNormal()) {
            log.error("An {} handoff of partition {} {} was terminated for reason: {}",
                    s.getDirection().label(), s.getId().module(), s.getId().partition(), reason);
        }

        final VnodeHandle vnode = s.getVnode();
        if (vnode != null) {
            try {
                if (!vnode.tell(new HandoffExit(reason))) {
                    log.debug("Vnode {} did not accept handoff exit {}", vnode, reason);
                }
            } catch (final RuntimeException e) {
                log.debug("Handoff exit delivery to {} failed: {}", vnode, e.toString());
            }
        }
    }

    /** Observer registered on every admitted unit. */
    TransferMonitor monitor() {
        return monitor;
    }

    /* ── mailbox plumbing ─────────────────────────── */

    private interface Message {
        void handle();

        default void reject(final IllegalStateException cause) {
        }
    }

    private static final class Call<T> implements Message {
        private final Callable<T> body;
        private final CompletableFuture<T> reply = new CompletableFuture<>();

        Call(final Callable<T> body) {
            this.body = body;
        }

        @Override
        public void handle() {
            try {
                reply.complete(body.call());
            } catch (final Throwable t) {
                reply.completeExceptionally(t);
            }
        }

        @Override
        public void reject(final IllegalStateException cause) {
            reply.completeExceptionally(cause);
        }
    }

    private record Notification(String name, Runnable body) implements Message {
        @Override
        public void handle() {
            body.run();
        }
    }

    private <T> CompletableFuture<T> submit(final Callable<T> body) {
        if (!started.get() && !closed.get()) {
            throw new IllegalStateException("Handoff manager is not started");
        }
        final Call<T> call = new Call<>(body);
        enqueue(call);
        return call.reply;
    }

    private void tell(final String name, final Runnable body) {
        enqueue(new Notification(name, body));
    }

    private void enqueue(final Message m) {
        if (closed.get()) {
            m.reject(closedException());
            return;
        }
        mailbox.add(m);
        // close() may have drained the mailbox between the check and the add
        if (closed.get() && mailbox.remove(m)) {
            m.reject(closedException());
        }
    }

    private void runLoop() {
        while (!closed.get()) {
            final Message m;
            try {
                m = mailbox.take();
            } catch (final InterruptedException e) {
                break;
            }
            try {
                m.handle();
            } catch (final RuntimeException e) {
                log.error("Handoff manager failed to process {}", m, e);
            }
        }
        rejectPending();
    }

    private void rejectPending() {
        final List<Message> pending = new ArrayList<>();
        mailbox.drainTo(pending);
        for (final Message m : pending) {
            m.reject(closedException());
        }
    }

    private static IllegalStateException closedException() {
        return new IllegalStateException("Handoff manager is closed");
    }

    private static TransportHandle awaitAdmission(final CompletableFuture<TransportHandle> f) throws MaxConcurrencyException {
        try {
            return f.get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the handoff manager", e);
        } catch (final ExecutionException e) {
            if (e.getCause() instanceof MaxConcurrencyException) {
                throw (MaxConcurrencyException) e.getCause();
            }
            throw rethrow(e.getCause());
        }
    }

    private static <T> T await(final CompletableFuture<T> f) {
        try {
            return f.get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the handoff manager", e);
        } catch (final ExecutionException e) {
            throw rethrow(e.getCause());
        }
    }

    private static RuntimeException rethrow(final Throwable cause) {
        if (cause instanceof RuntimeException) return (RuntimeException) cause;
        if (cause instanceof Error) throw (Error) cause;
        if (cause instanceof HandoffException) return new IllegalStateException(cause.getMessage(), cause);
        return new IllegalStateException(cause);
    }

    private final class SessionMonitor implements TransferMonitor {
        @Override
        public void statusUpdated(final TransportHandle handle, final Map<String, Object> status) {
            statusUpdate(handle, status);
        }

        @Override
        public void inboundIdResolved(final TransportHandle handle, final HandoffId id) {
            setInboundId(handle, id);
        }

        @Override
        public void exited(final TransportHandle handle, final ExitReason reason) {
            tell("exit", () -> onExit(handle, reason));
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        if (started.get()) {
            loop.interrupt();
            try {
                loop.join(CLOSE_TIMEOUT_MS);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        rejectPending();
        log.info("Handoff manager stopped");
    }
}
