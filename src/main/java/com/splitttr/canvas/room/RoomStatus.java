package com.splitttr.canvas.room;

import java.time.Instant;
import java.util.List;

public record RoomStatus(
    String id,
    RoomState state,
    int sessionCount,
    boolean heartbeatActive,
    Instant evictionAt,
    List<SessionInfo> sessions
) {
    public record SessionInfo(String id, String identity, Instant admittedAt, Instant lastPong) {}
}
