package com.splitttr.canvas.session;

import java.time.Instant;

/**
 * One live connection admitted into a room. Only the liveness timestamp changes
 * after admission.
 */
public final class RoomSession {

    private final PeerConnection connection;
    private final String identity;
    private final Instant admittedAt;
    private volatile Instant lastPong;

    RoomSession(PeerConnection connection, String identity, Instant admittedAt) {
        this.connection = connection;
        this.identity = identity;
        this.admittedAt = admittedAt;
        this.lastPong = admittedAt;
    }

    public String id() {
        return connection.id();
    }

    public PeerConnection connection() {
        return connection;
    }

    public String identity() {
        return identity;
    }

    public Instant admittedAt() {
        return admittedAt;
    }

    public Instant lastPong() {
        return lastPong;
    }

    void markAlive(Instant at) {
        this.lastPong = at;
    }

    @Override
    public String toString() {
        return "RoomSession[" + id() + ", " + identity + "]";
    }
}
