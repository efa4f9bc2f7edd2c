package com.splitttr.canvas.room;

import com.splitttr.canvas.crdt.CanvasDocument;
import com.splitttr.canvas.crdt.MalformedUpdateException;
import com.splitttr.canvas.lifecycle.RoomLifecycle;
import com.splitttr.canvas.lifecycle.RoomTimers;
import com.splitttr.canvas.message.Envelope;
import com.splitttr.canvas.message.EnvelopeCodec;
import com.splitttr.canvas.message.EnvelopeException;
import com.splitttr.canvas.session.CapacityExceededException;
import com.splitttr.canvas.session.HeartbeatMonitor;
import com.splitttr.canvas.session.PeerConnection;
import com.splitttr.canvas.session.RoomSession;
import com.splitttr.canvas.session.SessionRegistry;
import com.splitttr.canvas.storage.DurableStorage;
import com.splitttr.canvas.storage.StorageException;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Coordinator for one shared canvas. Owns the document and the sessions editing
 * it; every state change runs on the room's {@link RoomMailbox}, so none of the
 * parts it composes need locking.
 *
 * <p>Public methods only enqueue work and are safe to call from any thread.
 */
public class CanvasRoom {

    private static final Logger log = Logger.getLogger(CanvasRoom.class);

    static final int CLOSE_DELIVERY_FAILED = 1011;

    private final String id;
    private final CanvasDocument document;
    private final SessionRegistry sessions;
    private final HeartbeatMonitor heartbeat;
    private final RoomLifecycle lifecycle;
    private final EnvelopeCodec codec;
    private final RoomMailbox mailbox;
    private final Consumer<CanvasRoom> onEvicted;

    private volatile RoomState state = RoomState.UNINITIALIZED;

    public CanvasRoom(String id, RoomSettings settings, CanvasDocument document, DurableStorage storage,
                      RoomTimers timers, Clock clock, Executor pool, EnvelopeCodec codec,
                      Consumer<CanvasRoom> onEvicted) {
        this.id = id;
        this.document = document;
        this.codec = codec;
        this.onEvicted = onEvicted;
        this.mailbox = new RoomMailbox(id, pool);
        this.sessions = new SessionRegistry(settings.maxSessions(), clock);
        this.heartbeat = new HeartbeatMonitor(sessions, timers, mailbox, clock,
            settings.heartbeatInterval(), settings.heartbeatTimeout(), new HeartbeatListener());
        this.lifecycle = new RoomLifecycle(id, storage, timers, mailbox, clock,
            settings.idleEviction(), this::onEvictionAlarm);
    }

    public String id() {
        return id;
    }

    public RoomState state() {
        return state;
    }

    public CompletionStage<Admission> admit(PeerConnection connection, String identity) {
        var result = new CompletableFuture<Admission>();
        mailbox.execute(() -> {
            try {
                result.complete(doAdmit(connection, identity));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
                throw e;
            }
        });
        return result;
    }

    public void receive(RoomSession sender, String frame) {
        mailbox.execute(() -> route(sender, frame));
    }

    public void receiveBinary(RoomSession sender, int length) {
        mailbox.execute(() -> {
            if (!sessions.contains(sender)) return;
            try {
                codec.checkBinary(length);
                log.debugf("Ignoring %d byte binary frame from %s", length, sender);
            } catch (EnvelopeException e) {
                reject(sender, e);
            }
        });
    }

    public void disconnect(RoomSession session) {
        mailbox.execute(() -> {
            if (sessions.remove(session)) {
                log.infof("%s left room %s", session, id);
                afterRemoval();
            }
        });
    }

    public CompletionStage<RoomStatus> describe() {
        var result = new CompletableFuture<RoomStatus>();
        mailbox.execute(() -> {
            try {
                result.complete(new RoomStatus(
                    id,
                    state,
                    sessions.size(),
                    heartbeat.isActive(),
                    lifecycle.alarmAt().orElse(null),
                    sessions.snapshot().stream()
                        .map(s -> new RoomStatus.SessionInfo(s.id(), s.identity(), s.admittedAt(), s.lastPong()))
                        .toList()));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    /**
     * Process shutdown: persist whatever is unsaved and stop all timers.
     */
    public CompletionStage<Void> shutdown() {
        var result = new CompletableFuture<Void>();
        mailbox.execute(() -> {
            try {
                heartbeat.stop();
                lifecycle.deleteAlarm();
                if (state != RoomState.UNINITIALIZED) {
                    lifecycle.persist(document);
                }
                state = RoomState.EVICTED;
                result.complete(null);
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    private Admission doAdmit(PeerConnection connection, String identity) {
        if (identity == null || identity.isBlank()) {
            return Admission.rejected(RejectionReason.MISSING_IDENTITY);
        }
        if (state == RoomState.EVICTED) {
            return Admission.rejected(RejectionReason.ROOM_EVICTED);
        }

        if (sessions.isEmpty()) {
            try {
                lifecycle.activate(document, state == RoomState.UNINITIALIZED);
            } catch (StorageException e) {
                log.warnf(e, "Room %s cannot restore its snapshot, turning away %s", id, identity);
                if (state == RoomState.UNINITIALIZED) {
                    // nothing was served from this instance; the next connection gets a fresh room
                    state = RoomState.EVICTED;
                    onEvicted.accept(this);
                }
                return Admission.rejected(RejectionReason.STORAGE_UNAVAILABLE);
            }
            heartbeat.start();
        }

        RoomSession session;
        try {
            session = sessions.admit(connection, identity);
        } catch (CapacityExceededException e) {
            log.warnf("Room %s is full (%d sessions), rejecting %s", id, e.limit(), identity);
            return Admission.rejected(RejectionReason.CAPACITY_EXCEEDED);
        }
        state = RoomState.SERVING;
        log.infof("%s joined room %s (%d sessions)", session, id, sessions.size());

        deliver(session, Envelope.sync(document.encodeSnapshot()));
        return Admission.accepted(this, session);
    }

    private void route(RoomSession sender, String frame) {
        if (!sessions.contains(sender)) return;

        Envelope envelope;
        try {
            envelope = codec.decode(frame);
        } catch (EnvelopeException e) {
            reject(sender, e);
            return;
        }

        switch (envelope.type()) {
            case UPDATE -> applyUpdate(sender, envelope);
            case AWARENESS -> broadcast(sender, envelope);
            case PING -> deliver(sender, Envelope.pong());
            case PONG -> sessions.touch(sender);
            default -> log.debugf("Dropping inbound %s from %s", envelope.type().wireName(), sender);
        }
    }

    private void applyUpdate(RoomSession sender, Envelope envelope) {
        try {
            document.applyUpdate(envelope.updateBytes());
        } catch (MalformedUpdateException e) {
            log.debugf(e, "Dropping undecodable update from %s", sender);
            return;
        }
        lifecycle.markDirty();
        broadcast(sender, envelope);
    }

    private void reject(RoomSession sender, EnvelopeException e) {
        if (e.reason() == EnvelopeException.Reason.TOO_LARGE) {
            log.warnf("Oversized frame from %s in room %s", sender, id);
            deliver(sender, Envelope.error(e.getMessage()));
        } else {
            log.debugf("Dropping frame from %s: %s", sender, e.getMessage());
        }
    }

    private void broadcast(RoomSession sender, Envelope envelope) {
        String frame = codec.encode(envelope);
        for (RoomSession peer : sessions.snapshot()) {
            if (peer != sender) {
                send(peer, frame);
            }
        }
    }

    private void deliver(RoomSession session, Envelope envelope) {
        send(session, codec.encode(envelope));
    }

    private void send(RoomSession peer, String frame) {
        if (!sessions.contains(peer)) return;
        CompletionStage<Void> sent;
        try {
            if (!peer.connection().isOpen()) {
                drop(peer, "connection closed");
                return;
            }
            sent = peer.connection().send(frame);
        } catch (RuntimeException e) {
            drop(peer, String.valueOf(e.getMessage()));
            return;
        }
        sent.whenComplete((ignored, failure) -> {
            if (failure != null) {
                mailbox.execute(() -> drop(peer, String.valueOf(failure.getMessage())));
            }
        });
    }

    private void drop(RoomSession peer, String cause) {
        if (!sessions.remove(peer)) return;
        log.warnf("Delivery to %s in room %s failed (%s), dropping session", peer, id, cause);
        try {
            peer.connection().close(CLOSE_DELIVERY_FAILED, "delivery failed");
        } catch (RuntimeException e) {
            log.debugf(e, "Closing %s failed", peer);
        }
        afterRemoval();
    }

    private void afterRemoval() {
        if (!sessions.isEmpty() || state != RoomState.SERVING) return;
        heartbeat.stop();
        lifecycle.deactivate(document);
        state = RoomState.DRAINING;
        log.infof("Room %s is empty, eviction scheduled", id);
    }

    private void onEvictionAlarm() {
        if (state == RoomState.EVICTED) return;
        if (!sessions.isEmpty()) {
            log.debugf("Eviction alarm for room %s ignored, %d sessions present", id, sessions.size());
            return;
        }
        if (!lifecycle.persist(document)) {
            lifecycle.rearm();
            return;
        }
        heartbeat.stop();
        state = RoomState.EVICTED;
        log.infof("Room %s evicted", id);
        onEvicted.accept(this);
    }

    private class HeartbeatListener implements HeartbeatMonitor.Listener {

        @Override
        public void probe(RoomSession session) {
            deliver(session, Envelope.ping());
        }

        @Override
        public void pruned(RoomSession session) {
            log.infof("%s timed out in room %s", session, id);
        }

        @Override
        public void emptied() {
            afterRemoval();
        }
    }
}
