package com.splitttr.canvas.room;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RejectionReason {
    CAPACITY_EXCEEDED("capacity_exceeded"),
    MISSING_IDENTITY("missing_identity"),
    STORAGE_UNAVAILABLE("storage_unavailable"),
    // the room was torn down while the request queued; RoomDirectory retries on a new room
    ROOM_EVICTED("room_evicted");

    private final String code;

    RejectionReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
