package com.splitttr.canvas.session;

import com.splitttr.canvas.lifecycle.RoomTimers;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executor;

/**
 * Periodic liveness sweep for one room. Idle while the room has no sessions,
 * active from the first admission until a sweep or the room leaves the registry
 * empty.
 */
public class HeartbeatMonitor {

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(60);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(90);

    static final int CLOSE_NORMAL = 1000;
    static final String TIMEOUT_REASON = "heartbeat timeout";

    private static final Logger log = Logger.getLogger(HeartbeatMonitor.class);

    /**
     * Room-side callbacks, all invoked from the room mailbox.
     */
    public interface Listener {

        /** Send a liveness probe; the listener handles delivery failures. */
        void probe(RoomSession session);

        /** A stale session was closed and removed from the registry. */
        void pruned(RoomSession session);

        /** The sweep left the registry empty. The monitor has already stopped. */
        void emptied();
    }

    private final SessionRegistry registry;
    private final RoomTimers timers;
    private final Executor mailbox;
    private final Clock clock;
    private final Duration interval;
    private final Duration timeout;
    private final Listener listener;

    private RoomTimers.Cancellable timer;

    public HeartbeatMonitor(SessionRegistry registry, RoomTimers timers, Executor mailbox, Clock clock,
                            Duration interval, Duration timeout, Listener listener) {
        this.registry = registry;
        this.timers = timers;
        this.mailbox = mailbox;
        this.clock = clock;
        this.interval = interval;
        this.timeout = timeout;
        this.listener = listener;
    }

    public void start() {
        if (timer != null) return;
        timer = timers.scheduleRepeating(interval, () -> mailbox.execute(this::sweep));
    }

    public void stop() {
        if (timer == null) return;
        timer.cancel();
        timer = null;
    }

    public boolean isActive() {
        return timer != null;
    }

    void sweep() {
        // a tick queued before stop() may still arrive
        if (timer == null) return;

        Instant now = clock.instant();
        for (RoomSession session : registry.snapshot()) {
            if (!registry.contains(session)) continue;

            if (Duration.between(session.lastPong(), now).compareTo(timeout) > 0) {
                prune(session);
            } else {
                listener.probe(session);
            }
        }

        if (registry.isEmpty()) {
            stop();
            listener.emptied();
        }
    }

    private void prune(RoomSession session) {
        log.infof("Pruning %s after %s without pong", session, Duration.between(session.lastPong(), clock.instant()));
        try {
            session.connection().close(CLOSE_NORMAL, TIMEOUT_REASON);
        } catch (RuntimeException e) {
            log.debugf(e, "Closing stale connection %s failed", session.id());
        }
        if (registry.remove(session)) {
            listener.pruned(session);
        }
    }
}
