package com.splitttr.canvas.room;

import com.splitttr.canvas.crdt.CanvasDocument;
import com.splitttr.canvas.lifecycle.RoomTimers;
import com.splitttr.canvas.message.EnvelopeCodec;
import com.splitttr.canvas.session.PeerConnection;
import com.splitttr.canvas.storage.DurableStorage;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Process-wide map of live rooms, one per document id. Created once at startup;
 * rooms are added on their first connection and removed when they evict
 * themselves.
 *
 * <p>This is the only entry point for callers outside the room: they hand in a
 * connection with an identity that has already been authenticated and authorized
 * for the document.
 */
public class RoomDirectory {

    private static final Logger log = Logger.getLogger(RoomDirectory.class);

    private final ConcurrentHashMap<String, CanvasRoom> rooms = new ConcurrentHashMap<>();

    private final RoomSettings settings;
    private final DurableStorage storage;
    private final RoomTimers timers;
    private final Clock clock;
    private final Executor pool;
    private final Supplier<CanvasDocument> documents;
    private final EnvelopeCodec codec;

    public RoomDirectory(RoomSettings settings, DurableStorage storage, RoomTimers timers, Clock clock,
                         Executor pool, Supplier<CanvasDocument> documents) {
        this.settings = settings;
        this.storage = storage;
        this.timers = timers;
        this.clock = clock;
        this.pool = pool;
        this.documents = documents;
        this.codec = new EnvelopeCodec(settings.maxMessageBytes());
    }

    public CompletionStage<Admission> admit(String roomId, PeerConnection connection, String identity) {
        if (roomId == null || roomId.isBlank()) {
            throw new IllegalArgumentException("roomId required");
        }
        if (identity == null || identity.isBlank()) {
            log.warnf("Connection %s to room %s has no identity", connection.id(), roomId);
            return CompletableFuture.completedFuture(Admission.rejected(RejectionReason.MISSING_IDENTITY));
        }

        CanvasRoom room = rooms.computeIfAbsent(roomId, this::createRoom);
        return room.admit(connection, identity).thenCompose(admission -> {
            if (admission.rejection() == RejectionReason.ROOM_EVICTED) {
                // lost the race with eviction; the next lookup creates a fresh room
                rooms.remove(roomId, room);
                return admit(roomId, connection, identity);
            }
            return CompletableFuture.completedFuture(admission);
        });
    }

    public Optional<CanvasRoom> find(String roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    public Collection<CanvasRoom> rooms() {
        return List.copyOf(rooms.values());
    }

    public int size() {
        return rooms.size();
    }

    /**
     * Persists every live room and tears it down. Used on process shutdown.
     */
    public CompletableFuture<Void> shutdown() {
        var pending = rooms.values().stream()
            .map(room -> room.shutdown().toCompletableFuture())
            .toArray(CompletableFuture[]::new);
        log.infof("Shutting down %d rooms", pending.length);
        return CompletableFuture.allOf(pending).whenComplete((ignored, failure) -> rooms.clear());
    }

    private CanvasRoom createRoom(String roomId) {
        log.infof("Opening room %s", roomId);
        return new CanvasRoom(roomId, settings, documents.get(), storage, timers, clock, pool, codec,
            this::evicted);
    }

    private void evicted(CanvasRoom room) {
        if (rooms.remove(room.id(), room)) {
            log.infof("Room %s released, %d rooms open", room.id(), rooms.size());
        }
    }
}
