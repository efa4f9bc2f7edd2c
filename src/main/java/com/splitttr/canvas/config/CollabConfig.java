package com.splitttr.canvas.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Configuration mapping for the collaboration rooms.
 *
 * <p>Configuration prefix: {@code canvas.collab}
 *
 * <p>Limits apply per room and per process; rooms on different instances do not
 * share them.
 */
@ConfigMapping(prefix = "canvas.collab")
public interface CollabConfig {

    /**
     * Hard cap on concurrent sessions in one room.
     *
     * @return Max sessions (default: 50)
     */
    @WithDefault("50")
    int maxSessionsPerRoom();

    /**
     * Largest inbound frame accepted, in bytes.
     *
     * @return Max message size (default: 2 MiB)
     */
    @WithDefault("2097152")
    int maxMessageBytes();

    /**
     * How long a room stays in memory after its last session leaves.
     *
     * @return Idle eviction delay (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration idleEviction();

    /**
     * Threads shared by all room mailboxes.
     */
    @WithDefault("4")
    int workerThreads();

    HeartbeatConfig heartbeat();

    StorageConfig storage();

    AuthConfig auth();

    interface HeartbeatConfig {

        /**
         * How often each room probes its sessions.
         *
         * @return Probe interval (default: 60 seconds)
         */
        @WithDefault("PT60S")
        Duration interval();

        /**
         * Silence after which a session is closed on the next sweep.
         *
         * @return Pong timeout (default: 90 seconds)
         */
        @WithDefault("PT90S")
        Duration timeout();
    }

    interface StorageConfig {

        /**
         * memory, file or remote.
         */
        @WithDefault("memory")
        String provider();

        /**
         * Snapshot directory for the file provider.
         */
        Optional<Path> directory();
    }

    interface AuthConfig {

        /**
         * Accept the X-User-Email handshake header as identity outside prod mode.
         */
        @WithDefault("false")
        boolean devHeaderEnabled();
    }
}
