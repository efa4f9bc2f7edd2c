package com.splitttr.canvas.websocket;

import com.splitttr.canvas.session.PeerConnection;
import io.quarkus.websockets.next.CloseReason;
import io.quarkus.websockets.next.WebSocketConnection;
import org.jboss.logging.Logger;

import java.util.concurrent.CompletionStage;

/**
 * Adapts a websockets-next connection to the room's transport contract. Sends and
 * closes are fire-and-forget Unis, never awaited on the room mailbox.
 */
class WebSocketPeerConnection implements PeerConnection {

    private static final Logger log = Logger.getLogger(WebSocketPeerConnection.class);

    private final WebSocketConnection connection;

    WebSocketPeerConnection(WebSocketConnection connection) {
        this.connection = connection;
    }

    @Override
    public String id() {
        return connection.id();
    }

    @Override
    public boolean isOpen() {
        return connection.isOpen();
    }

    @Override
    public CompletionStage<Void> send(String frame) {
        return connection.sendText(frame).subscribeAsCompletionStage();
    }

    @Override
    public void close(int code, String reason) {
        connection.close(new CloseReason(code, reason)).subscribe().with(
            ignored -> log.debugf("Closed %s (%d %s)", connection.id(), code, reason),
            failure -> log.debugf(failure, "Close of %s failed", connection.id()));
    }
}
