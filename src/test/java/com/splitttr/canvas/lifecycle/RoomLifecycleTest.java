package com.splitttr.canvas.lifecycle;

import com.fasterxml.jackson.databind.node.IntNode;
import com.splitttr.canvas.crdt.LwwCanvasDocument;
import com.splitttr.canvas.crdt.MalformedUpdateException;
import com.splitttr.canvas.storage.StorageException;
import com.splitttr.canvas.support.FlakyStorage;
import com.splitttr.canvas.support.ManualTimers;
import com.splitttr.canvas.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RoomLifecycleTest {

    private static final String ROOM = "doc-1";

    private MutableClock clock;
    private ManualTimers timers;
    private FlakyStorage storage;
    private int alarms;
    private RoomLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAtEpoch();
        timers = new ManualTimers(clock);
        storage = new FlakyStorage();
        lifecycle = new RoomLifecycle(ROOM, storage, timers, Runnable::run, clock,
            RoomLifecycle.DEFAULT_IDLE_EVICTION, () -> alarms++);
    }

    @Test
    void freshActivationRestoresTheStoredSnapshot() {
        var earlier = new LwwCanvasDocument("alice");
        earlier.put("rect-1", IntNode.valueOf(1));
        storage.put(ROOM, earlier.encodeSnapshot());

        var document = new LwwCanvasDocument("server");
        lifecycle.activate(document, true);

        assertArrayEquals(earlier.encodeSnapshot(), document.encodeSnapshot());
        assertFalse(lifecycle.isDirty());
    }

    @Test
    void reactivationKeepsInMemoryState() {
        storage.put(ROOM, new LwwCanvasDocument("alice").encodeSnapshot());
        int readsBefore = storage.reads();

        var document = new LwwCanvasDocument("server");
        lifecycle.activate(document, false);

        assertEquals(readsBefore, storage.reads());
        assertTrue(document.isEmpty());
    }

    @Test
    void activationWithNothingStoredStartsEmpty() {
        var document = new LwwCanvasDocument("server");

        lifecycle.activate(document, true);

        assertEquals(1, storage.reads());
        assertTrue(document.isEmpty());
    }

    @Test
    void restoreFailurePropagates() {
        storage.failReads(true);

        assertThrows(StorageException.class, () -> lifecycle.activate(new LwwCanvasDocument("server"), true));
    }

    @Test
    void undecodableSnapshotIsReportedAsAStorageFailure() {
        storage.put(ROOM, new byte[] {1, 2, 3});
        var document = new LwwCanvasDocument("server");

        var e = assertThrows(StorageException.class, () -> lifecycle.activate(document, true));

        assertInstanceOf(MalformedUpdateException.class, e.getCause());
        assertTrue(document.isEmpty());
    }

    @Test
    void deactivationPersistsThenArmsTheAlarm() {
        var document = new LwwCanvasDocument("server");
        document.put("n", IntNode.valueOf(7));
        lifecycle.markDirty();

        lifecycle.deactivate(document);

        assertArrayEquals(document.encodeSnapshot(), storage.stored(ROOM).orElseThrow());
        assertEquals(clock.instant().plus(Duration.ofMinutes(5)), lifecycle.alarmAt().orElseThrow());

        timers.advance(Duration.ofMinutes(5).minusSeconds(1));
        assertEquals(0, alarms);
        timers.advance(Duration.ofSeconds(1));
        assertEquals(1, alarms);
        assertTrue(lifecycle.alarmAt().isEmpty());
    }

    @Test
    void activationCancelsAPendingAlarm() {
        var document = new LwwCanvasDocument("server");
        lifecycle.deactivate(document);

        timers.advance(Duration.ofMinutes(2));
        lifecycle.activate(document, false);
        timers.advance(Duration.ofMinutes(10));

        assertEquals(0, alarms);
        assertTrue(lifecycle.alarmAt().isEmpty());
    }

    @Test
    void settingTheAlarmAgainReplacesThePreviousOne() {
        lifecycle.setAlarm(clock.instant().plusSeconds(10));
        lifecycle.setAlarm(clock.instant().plusSeconds(20));

        timers.advance(Duration.ofSeconds(30));

        assertEquals(1, alarms);
    }

    @Test
    void cleanDocumentIsNotWritten() {
        assertTrue(lifecycle.persist(new LwwCanvasDocument("server")));
        assertEquals(0, storage.writes());
    }

    @Test
    void failedPersistStaysDirtyUntilARetrySucceeds() {
        var document = new LwwCanvasDocument("server");
        document.put("n", IntNode.valueOf(1));
        lifecycle.markDirty();
        storage.failNextWrites(1);

        assertFalse(lifecycle.persist(document));
        assertTrue(lifecycle.isDirty());
        assertTrue(storage.stored(ROOM).isEmpty());

        assertTrue(lifecycle.persist(document));
        assertFalse(lifecycle.isDirty());
        assertArrayEquals(document.encodeSnapshot(), storage.stored(ROOM).orElseThrow());
    }
}
