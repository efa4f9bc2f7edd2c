package com.splitttr.canvas.room;

import com.splitttr.canvas.config.CollabConfig;
import com.splitttr.canvas.lifecycle.RoomLifecycle;
import com.splitttr.canvas.message.EnvelopeCodec;
import com.splitttr.canvas.session.HeartbeatMonitor;
import com.splitttr.canvas.session.SessionRegistry;

import java.time.Duration;

public record RoomSettings(
    int maxSessions,
    int maxMessageBytes,
    Duration heartbeatInterval,
    Duration heartbeatTimeout,
    Duration idleEviction
) {

    public RoomSettings {
        if (heartbeatTimeout.compareTo(heartbeatInterval) < 0) {
            throw new IllegalArgumentException("heartbeat timeout must not be shorter than the interval");
        }
    }

    public static RoomSettings defaults() {
        return new RoomSettings(
            SessionRegistry.DEFAULT_MAX_SESSIONS,
            EnvelopeCodec.DEFAULT_MAX_MESSAGE_BYTES,
            HeartbeatMonitor.DEFAULT_INTERVAL,
            HeartbeatMonitor.DEFAULT_TIMEOUT,
            RoomLifecycle.DEFAULT_IDLE_EVICTION
        );
    }

    public static RoomSettings from(CollabConfig config) {
        return new RoomSettings(
            config.maxSessionsPerRoom(),
            config.maxMessageBytes(),
            config.heartbeat().interval(),
            config.heartbeat().timeout(),
            config.idleEviction()
        );
    }

    public RoomSettings withMaxSessions(int maxSessions) {
        return new RoomSettings(maxSessions, maxMessageBytes, heartbeatInterval, heartbeatTimeout, idleEviction);
    }

    public RoomSettings withMaxMessageBytes(int maxMessageBytes) {
        return new RoomSettings(maxSessions, maxMessageBytes, heartbeatInterval, heartbeatTimeout, idleEviction);
    }
}
