package io.ringhandoff.grpc.services;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;
import io.ringhandoff.api.HandoffAdminApi;
import io.ringhandoff.api.HandoffAdminServiceGrpc;
import io.ringhandoff.handoff.manager.HandoffManager;
import io.ringhandoff.handoff.model.Direction;
import io.ringhandoff.handoff.model.HandoffId;
import io.ringhandoff.handoff.model.HandoffStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@RequiredArgsConstructor
public class HandoffAdminServiceImpl extends HandoffAdminServiceGrpc.HandoffAdminServiceImplBase {

    private static final HandoffAdminApi.Ack OK = HandoffAdminApi.Ack.newBuilder().setSuccess(true).build();

    private final HandoffManager manager;

    @Override
    public void handoffStatus(final HandoffAdminApi.StatusRequest request,
                              final StreamObserver<HandoffAdminApi.StatusReply> responseObserver) {
        final List<HandoffStatus> statuses;
        try {
            statuses = switch (request.getDirection()) {
                case OUTBOUND -> manager.handoffStatus(Direction.OUTBOUND);
                case INBOUND -> manager.handoffStatus(Direction.INBOUND);
                default -> manager.handoffStatus();
            };
        } catch (final IllegalStateException e) {
            responseObserver.onError(unavailable(e));
            return;
        }

        final HandoffAdminApi.StatusReply.Builder reply = HandoffAdminApi.StatusReply.newBuilder();
        for (final HandoffStatus s : statuses) {
            reply.addHandoffs(toProto(s));
        }
        responseObserver.onNext(reply.build());
        responseObserver.onCompleted();
    }

    @Override
    public void setConcurrency(final HandoffAdminApi.SetConcurrencyRequest request,
                               final StreamObserver<HandoffAdminApi.Ack> responseObserver) {
        final int limit = request.getLimit();
        if (limit < 0) {
            responseObserver.onNext(HandoffAdminApi.Ack.newBuilder()
                    .setSuccess(false)
                    .setError("limit must be >= 0, got " + limit)
                    .build());
            responseObserver.onCompleted();
            return;
        }
        try {
            manager.setConcurrency(limit);
            responseObserver.onNext(OK);
        } catch (final IllegalStateException e) {
            log.error("Failed to set handoff concurrency to {}: {}", limit, e.getMessage());
            responseObserver.onNext(failed(e));
        }
        responseObserver.onCompleted();
    }

    @Override
    public void getConcurrency(final HandoffAdminApi.Empty request,
                               final StreamObserver<HandoffAdminApi.ConcurrencyReply> responseObserver) {
        final int limit;
        try {
            limit = manager.concurrency();
        } catch (final IllegalStateException e) {
            responseObserver.onError(unavailable(e));
            return;
        }
        responseObserver.onNext(HandoffAdminApi.ConcurrencyReply.newBuilder()
                .setLimit(limit)
                .build());
        responseObserver.onCompleted();
    }

    @Override
    public void killHandoffs(final HandoffAdminApi.Empty request,
                             final StreamObserver<HandoffAdminApi.Ack> responseObserver) {
        log.info("Killing all handoffs on operator request");
        try {
            manager.killHandoffs();
            responseObserver.onNext(OK);
        } catch (final IllegalStateException e) {
            log.error("Failed to kill handoffs: {}", e.getMessage());
            responseObserver.onNext(failed(e));
        }
        responseObserver.onCompleted();
    }

    @Override
    public void addExclusion(final HandoffAdminApi.ExclusionRequest request,
                             final StreamObserver<HandoffAdminApi.Ack> responseObserver) {
        if (!validModule(request.getModule(), responseObserver)) return;
        manager.addExclusion(request.getModule(), request.getPartition());
        responseObserver.onNext(OK);
        responseObserver.onCompleted();
    }

    @Override
    public void removeExclusion(final HandoffAdminApi.ExclusionRequest request,
                                final StreamObserver<HandoffAdminApi.Ack> responseObserver) {
        if (!validModule(request.getModule(), responseObserver)) return;
        manager.removeExclusion(request.getModule(), request.getPartition());
        responseObserver.onNext(OK);
        responseObserver.onCompleted();
    }

    @Override
    public void getExclusions(final HandoffAdminApi.ModuleRequest request,
                              final StreamObserver<HandoffAdminApi.ExclusionsReply> responseObserver) {
        final List<Integer> partitions;
        try {
            partitions = manager.getExclusions(request.getModule());
        } catch (final IllegalStateException e) {
            responseObserver.onError(unavailable(e));
            return;
        }
        responseObserver.onNext(HandoffAdminApi.ExclusionsReply.newBuilder()
                .setModule(request.getModule())
                .addAllPartitions(partitions)
                .build());
        responseObserver.onCompleted();
    }

    private static HandoffAdminApi.Ack failed(final Exception e) {
        return HandoffAdminApi.Ack.newBuilder()
                .setSuccess(false)
                .setError(e.getMessage())
                .build();
    }

    private static StatusRuntimeException unavailable(final Exception e) {
        return Status.UNAVAILABLE.withDescription(e.getMessage()).withCause(e).asRuntimeException();
    }

    private static boolean validModule(final String module, final StreamObserver<HandoffAdminApi.Ack> responseObserver) {
        if (!module.isEmpty()) return true;
        responseObserver.onNext(HandoffAdminApi.Ack.newBuilder()
                .setSuccess(false)
                .setError("module is required")
                .build());
        responseObserver.onCompleted();
        return false;
    }

    private static HandoffAdminApi.HandoffEntry toProto(final HandoffStatus s) {
        final HandoffAdminApi.HandoffEntry.Builder b = HandoffAdminApi.HandoffEntry.newBuilder()
                .setDirection(s.direction() == Direction.OUTBOUND
                        ? HandoffAdminApi.Direction.OUTBOUND
                        : HandoffAdminApi.Direction.INBOUND)
                .setState(s.state().name().toLowerCase(Locale.ROOT));

        final HandoffId id = s.id();
        if (id.module() != null) b.setModule(id.module());
        if (id.partition() != null) b.setPartition(id.partition());
        if (id.node() != null) b.setNode(id.node());

        for (final Map.Entry<String, Object> e : s.status().entrySet()) {
            b.putStatus(e.getKey(), String.valueOf(e.getValue()));
        }
        return b.build();
    }
}
