package com.splitttr.canvas.session;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Live sessions of one room, keyed by connection id. Owned by the room mailbox,
 * so it takes no locks of its own.
 */
public class SessionRegistry {

    public static final int DEFAULT_MAX_SESSIONS = 50;

    private final Map<String, RoomSession> sessions = new LinkedHashMap<>();
    private final int maxSessions;
    private final Clock clock;

    public SessionRegistry(int maxSessions, Clock clock) {
        if (maxSessions < 1) {
            throw new IllegalArgumentException("maxSessions must be at least 1");
        }
        this.maxSessions = maxSessions;
        this.clock = clock;
    }

    /**
     * @throws CapacityExceededException once the room holds {@code maxSessions} sessions
     */
    public RoomSession admit(PeerConnection connection, String identity) {
        if (sessions.size() >= maxSessions) {
            throw new CapacityExceededException(maxSessions);
        }
        if (sessions.containsKey(connection.id())) {
            throw new IllegalStateException("Connection " + connection.id() + " already admitted");
        }
        var session = new RoomSession(connection, identity, clock.instant());
        sessions.put(connection.id(), session);
        return session;
    }

    /**
     * Idempotent.
     *
     * @return whether this call removed the session
     */
    public boolean remove(RoomSession session) {
        return sessions.remove(session.id(), session);
    }

    public void touch(RoomSession session) {
        if (contains(session)) {
            session.markAlive(clock.instant());
        }
    }

    public boolean contains(RoomSession session) {
        return sessions.get(session.id()) == session;
    }

    public boolean isEmpty() {
        return sessions.isEmpty();
    }

    public int size() {
        return sessions.size();
    }

    /**
     * Copy in admission order, safe to iterate while sessions are removed.
     */
    public List<RoomSession> snapshot() {
        return new ArrayList<>(sessions.values());
    }
}
