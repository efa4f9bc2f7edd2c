package com.splitttr.canvas.room;

import org.jboss.logging.Logger;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Serial executor for one room. Tasks run one at a time in submission order on a
 * shared pool, which makes the room a single logical actor without owning a
 * thread.
 */
public final class RoomMailbox implements Executor {

    private static final Logger log = Logger.getLogger(RoomMailbox.class);
    // yield the pool thread after this many tasks so busy rooms cannot starve quiet ones
    private static final int BATCH = 64;

    private final String roomId;
    private final Executor pool;
    private final Queue<Runnable> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean scheduled = new AtomicBoolean();

    public RoomMailbox(String roomId, Executor pool) {
        this.roomId = roomId;
        this.pool = pool;
    }

    @Override
    public void execute(Runnable task) {
        queue.add(task);
        schedule();
    }

    private void schedule() {
        if (!scheduled.compareAndSet(false, true)) return;
        try {
            pool.execute(this::drain);
        } catch (RejectedExecutionException e) {
            scheduled.set(false);
            throw e;
        }
    }

    private void drain() {
        try {
            Runnable task;
            int ran = 0;
            while (ran < BATCH && (task = queue.poll()) != null) {
                ran++;
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.errorf(e, "Task failed in room %s", roomId);
                }
            }
        } finally {
            scheduled.set(false);
            if (!queue.isEmpty()) {
                schedule();
            }
        }
    }
}
