package com.splitttr.canvas.room;

public enum RoomState {
    /** Created, document not yet restored. */
    UNINITIALIZED,
    /** At least one session, document restored. */
    SERVING,
    /** No sessions, eviction alarm armed. */
    DRAINING,
    /** Torn down; the next connection gets a new room. */
    EVICTED
}
