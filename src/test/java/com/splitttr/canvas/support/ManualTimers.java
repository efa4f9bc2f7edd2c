package com.splitttr.canvas.support;

import com.splitttr.canvas.lifecycle.RoomTimers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Timers driven by a {@link MutableClock}; nothing fires until {@link #advance}.
 */
public class ManualTimers implements RoomTimers {

    private final MutableClock clock;
    private final List<Task> tasks = new ArrayList<>();
    private long sequence;

    private final class Task implements Cancellable {
        final Runnable action;
        final Duration period;
        final long order = sequence++;
        Instant due;

        Task(Instant due, Duration period, Runnable action) {
            this.due = due;
            this.period = period;
            this.action = action;
        }

        @Override
        public void cancel() {
            tasks.remove(this);
        }
    }

    public ManualTimers(MutableClock clock) {
        this.clock = clock;
    }

    public MutableClock clock() {
        return clock;
    }

    @Override
    public Cancellable schedule(Duration delay, Runnable task) {
        var scheduled = new Task(clock.instant().plus(delay), null, task);
        tasks.add(scheduled);
        return scheduled;
    }

    @Override
    public Cancellable scheduleRepeating(Duration period, Runnable task) {
        var scheduled = new Task(clock.instant().plus(period), period, task);
        tasks.add(scheduled);
        return scheduled;
    }

    /**
     * Moves the clock forward, firing every task that falls due on the way in time
     * order.
     */
    public void advance(Duration duration) {
        Instant target = clock.instant().plus(duration);
        while (true) {
            Optional<Task> next = tasks.stream()
                .filter(task -> !task.due.isAfter(target))
                .min(Comparator.comparing((Task task) -> task.due).thenComparingLong(task -> task.order));
            if (next.isEmpty()) break;

            Task task = next.get();
            clock.set(task.due);
            if (task.period != null) {
                task.due = task.due.plus(task.period);
            } else {
                tasks.remove(task);
            }
            task.action.run();
        }
        clock.set(target);
    }

    public int pending() {
        return tasks.size();
    }
}
