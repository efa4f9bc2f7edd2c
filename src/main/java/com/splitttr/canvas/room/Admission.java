package com.splitttr.canvas.room;

import com.splitttr.canvas.session.RoomSession;

/**
 * Outcome of a connection request: the room and session on success, the reason
 * otherwise.
 */
public record Admission(CanvasRoom room, RoomSession session, RejectionReason rejection) {

    public static Admission accepted(CanvasRoom room, RoomSession session) {
        return new Admission(room, session, null);
    }

    public static Admission rejected(RejectionReason reason) {
        return new Admission(null, null, reason);
    }

    public boolean isAccepted() {
        return rejection == null;
    }
}
