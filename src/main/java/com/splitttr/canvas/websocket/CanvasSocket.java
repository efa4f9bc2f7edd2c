package com.splitttr.canvas.websocket;

import com.splitttr.canvas.room.Admission;
import com.splitttr.canvas.room.CanvasRoom;
import com.splitttr.canvas.room.RejectionReason;
import com.splitttr.canvas.room.RoomDirectory;
import com.splitttr.canvas.security.AuthService;
import com.splitttr.canvas.security.CanvasAccessPolicy;
import com.splitttr.canvas.session.RoomSession;
import io.quarkus.websockets.next.*;
import io.vertx.core.buffer.Buffer;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket endpoint for real-time canvas collaboration, one room per canvas id.
 * Identity comes from the JWT; everything past admission is the room's business.
 */
@WebSocket(path = "/ws/canvases/{canvasId}")
public class CanvasSocket {

    private static final Logger log = Logger.getLogger(CanvasSocket.class);

    static final int POLICY_VIOLATION = 1008;
    static final int INTERNAL_ERROR = 1011;
    static final int TRY_AGAIN_LATER = 1013;

    @Inject
    RoomDirectory rooms;

    @Inject
    AuthService authService;

    @Inject
    CanvasAccessPolicy accessPolicy;

    // connection id -> room and session it was admitted as
    private static final Map<String, Binding> bindings = new ConcurrentHashMap<>();

    record Binding(CanvasRoom room, RoomSession session) {}

    @OnOpen
    public void onOpen(WebSocketConnection connection) {
        String canvasId = connection.pathParam("canvasId");
        if (canvasId == null || canvasId.isBlank()) {
            connection.closeAndAwait(new CloseReason(POLICY_VIOLATION, "Canvas ID required"));
            return;
        }

        String userId = authService.resolveIdentity(connection);
        if (userId != null && !accessPolicy.canJoin(userId, canvasId)) {
            log.warnf("%s has no access to canvas %s", userId, canvasId);
            connection.closeAndAwait(new CloseReason(POLICY_VIOLATION, "Forbidden - no access to this canvas"));
            return;
        }

        // runs on a worker thread, so waiting for the room mailbox is fine here
        Admission admission;
        try {
            admission = rooms.admit(canvasId, new WebSocketPeerConnection(connection), userId)
                .toCompletableFuture()
                .join();
        } catch (CompletionException e) {
            log.errorf(e.getCause(), "Admitting %s to canvas %s failed", connection.id(), canvasId);
            connection.closeAndAwait(new CloseReason(INTERNAL_ERROR, "Room unavailable"));
            return;
        }
        if (!admission.isAccepted()) {
            log.warnf("Connection %s to canvas %s rejected: %s", connection.id(), canvasId, admission.rejection().code());
            connection.closeAndAwait(closeReasonFor(admission.rejection()));
            return;
        }
        bindings.put(connection.id(), new Binding(admission.room(), admission.session()));
    }

    @OnTextMessage
    public void onMessage(String message, WebSocketConnection connection) {
        Binding binding = bindings.get(connection.id());
        if (binding == null) return;
        binding.room().receive(binding.session(), message);
    }

    @OnBinaryMessage
    public void onBinaryMessage(Buffer message, WebSocketConnection connection) {
        Binding binding = bindings.get(connection.id());
        if (binding == null) return;
        binding.room().receiveBinary(binding.session(), message.length());
    }

    @OnClose
    public void onClose(WebSocketConnection connection) {
        log.debugf("WebSocket closed: %s", connection.id());
        release(connection);
    }

    @OnError
    public void onError(WebSocketConnection connection, Throwable t) {
        log.warnf(t, "WebSocket error on %s", connection.id());
        release(connection);
    }

    static CloseReason closeReasonFor(RejectionReason reason) {
        return switch (reason) {
            case MISSING_IDENTITY -> new CloseReason(POLICY_VIOLATION, "Forbidden - missing user context");
            case CAPACITY_EXCEEDED -> new CloseReason(TRY_AGAIN_LATER, "Room is full - too many connections");
            case STORAGE_UNAVAILABLE, ROOM_EVICTED -> new CloseReason(TRY_AGAIN_LATER, "Room unavailable, retry");
        };
    }

    private void release(WebSocketConnection connection) {
        Binding binding = bindings.remove(connection.id());
        if (binding != null) {
            binding.room().disconnect(binding.session());
        }
    }
}
