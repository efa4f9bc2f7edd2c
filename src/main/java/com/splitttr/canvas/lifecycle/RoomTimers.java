package com.splitttr.canvas.lifecycle;

import java.time.Duration;

/**
 * Timer source for heartbeat sweeps and eviction alarms. Tasks run on the timer
 * thread; callers hop onto their room mailbox themselves.
 */
public interface RoomTimers {

    interface Cancellable {
        void cancel();
    }

    Cancellable schedule(Duration delay, Runnable task);

    Cancellable scheduleRepeating(Duration period, Runnable task);
}
