package io.synclane.lock;

import io.synclane.model.HeartbeatUpdate;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Keeps {@code lastHeartbeatAt} fresh while the holder is blocked in a long network call.
 */
public final class HeartbeatTicker implements AutoCloseable {
    private final ScheduledExecutorService scheduler;

    private HeartbeatTicker(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    public static HeartbeatTicker start(SyncLockManager manager, long intervalMs) {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "synclane-heartbeat");
            thread.setDaemon(true);
            return thread;
        });
        long period = Math.max(1L, intervalMs);
        scheduler.scheduleAtFixedRate(
                () -> manager.updateHeartbeat(HeartbeatUpdate.keepAlive()),
                period,
                period,
                TimeUnit.MILLISECONDS
        );
        return new HeartbeatTicker(scheduler);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
