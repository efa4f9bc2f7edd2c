package com.splitttr.canvas.lifecycle;

import com.splitttr.canvas.crdt.CanvasDocument;
import com.splitttr.canvas.crdt.MalformedUpdateException;
import com.splitttr.canvas.storage.DurableStorage;
import com.splitttr.canvas.storage.StorageException;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Persistence and idle-eviction scheduling for one room. Every method must be
 * called from the room mailbox; the alarm callback is delivered there too.
 */
public class RoomLifecycle {

    public static final Duration DEFAULT_IDLE_EVICTION = Duration.ofMinutes(5);

    private static final Logger log = Logger.getLogger(RoomLifecycle.class);

    private final String roomId;
    private final DurableStorage storage;
    private final RoomTimers timers;
    private final Executor mailbox;
    private final Clock clock;
    private final Duration idleEviction;
    private final Runnable onAlarm;

    private RoomTimers.Cancellable alarm;
    private Instant alarmAt;
    // bumped on every set/delete so a fire that raced a cancel is ignored
    private long alarmGeneration;
    private boolean dirty;
    private int failedPersists;

    public RoomLifecycle(String roomId, DurableStorage storage, RoomTimers timers, Executor mailbox,
                         Clock clock, Duration idleEviction, Runnable onAlarm) {
        this.roomId = roomId;
        this.storage = storage;
        this.timers = timers;
        this.mailbox = mailbox;
        this.clock = clock;
        this.idleEviction = idleEviction;
        this.onAlarm = onAlarm;
    }

    /**
     * Called when the first session enters an empty room. Cancels a pending
     * eviction and, for a fresh room, restores the stored snapshot.
     *
     * @throws StorageException if the stored snapshot could not be read or decoded;
     *         the room must not serve in that case
     */
    public void activate(CanvasDocument document, boolean fresh) {
        deleteAlarm();
        if (!fresh) {
            return;
        }
        Optional<byte[]> saved = storage.get(roomId);
        if (saved.isEmpty()) {
            log.debugf("No stored snapshot for room %s", roomId);
            return;
        }
        try {
            document.restore(saved.get());
        } catch (MalformedUpdateException e) {
            throw new StorageException("Stored snapshot for room " + roomId + " is unreadable", e);
        }
        dirty = false;
        log.infof("Restored room %s from a %d byte snapshot", roomId, saved.get().length);
    }

    public void markDirty() {
        dirty = true;
    }

    public boolean isDirty() {
        return dirty;
    }

    /**
     * Writes the snapshot if anything changed since the last successful write.
     * Failures are logged and leave the room dirty for the next attempt.
     *
     * @return whether storage now holds the current state
     */
    public boolean persist(CanvasDocument document) {
        if (!dirty) {
            return true;
        }
        byte[] snapshot = document.encodeSnapshot();
        try {
            storage.put(roomId, snapshot);
        } catch (StorageException e) {
            failedPersists++;
            log.warnf(e, "Persisting room %s failed (%d in a row), will retry", roomId, failedPersists);
            return false;
        }
        dirty = false;
        failedPersists = 0;
        log.infof("Persisted room %s (%d bytes)", roomId, snapshot.length);
        return true;
    }

    /**
     * Last session left: persist, then arm the eviction alarm.
     */
    public void deactivate(CanvasDocument document) {
        persist(document);
        setAlarm(clock.instant().plus(idleEviction));
    }

    public void setAlarm(Instant at) {
        cancelTimer();
        long generation = ++alarmGeneration;
        Duration delay = Duration.between(clock.instant(), at);
        if (delay.isNegative()) {
            delay = Duration.ZERO;
        }
        alarmAt = at;
        alarm = timers.schedule(delay, () -> mailbox.execute(() -> fire(generation)));
        log.debugf("Room %s eviction alarm set for %s", roomId, at);
    }

    public void deleteAlarm() {
        if (alarm != null) {
            log.debugf("Room %s eviction alarm cancelled", roomId);
        }
        cancelTimer();
        alarmGeneration++;
        alarmAt = null;
    }

    public Optional<Instant> alarmAt() {
        return Optional.ofNullable(alarmAt);
    }

    /**
     * Re-arms the alarm one idle period from now, used when eviction had to be
     * postponed.
     */
    public void rearm() {
        setAlarm(clock.instant().plus(idleEviction));
    }

    private void fire(long generation) {
        if (generation != alarmGeneration) return;
        alarm = null;
        alarmAt = null;
        onAlarm.run();
    }

    private void cancelTimer() {
        if (alarm != null) {
            alarm.cancel();
            alarm = null;
        }
    }
}
