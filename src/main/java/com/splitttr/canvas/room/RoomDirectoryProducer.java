package com.splitttr.canvas.room;

import com.splitttr.canvas.config.CollabConfig;
import com.splitttr.canvas.crdt.LwwCanvasDocument;
import com.splitttr.canvas.lifecycle.ExecutorRoomTimers;
import com.splitttr.canvas.storage.DurableStorage;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

@ApplicationScoped
public class RoomDirectoryProducer {

    private static final Logger log = Logger.getLogger(RoomDirectoryProducer.class);
    private static final long SHUTDOWN_SECONDS = 10;

    @Inject
    CollabConfig config;

    @Inject
    DurableStorage storage;

    private ScheduledExecutorService scheduler;
    private ExecutorService workers;

    @Produces
    @Singleton
    public RoomDirectory roomDirectory() {
        scheduler = Executors.newSingleThreadScheduledExecutor(threads("room-timer"));
        workers = Executors.newFixedThreadPool(config.workerThreads(), threads("room-worker"));

        var settings = RoomSettings.from(config);
        log.infof("Rooms hold up to %d sessions, probe every %s, evict after %s idle",
            settings.maxSessions(), settings.heartbeatInterval(), settings.idleEviction());
        return new RoomDirectory(settings, storage, new ExecutorRoomTimers(scheduler),
            Clock.systemUTC(), workers, LwwCanvasDocument::new);
    }

    void close(@Disposes RoomDirectory directory) {
        try {
            directory.shutdown().get(SHUTDOWN_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warnf("Rooms did not persist within %d seconds", SHUTDOWN_SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("Room shutdown failed", e);
        } finally {
            scheduler.shutdownNow();
            workers.shutdown();
        }
    }

    private static ThreadFactory threads(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
