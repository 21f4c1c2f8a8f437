package com.pocketping.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Periodically invokes a heartbeat action on its own daemon thread.
 * Restartable: {@link #stop()} followed by {@link #start()} resumes ticking,
 * {@link #close()} releases the thread for good.
 */
@Slf4j
public class HeartbeatRunner implements AutoCloseable {

    private static final long MIN_INTERVAL_MS = 10;

    private final String name;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile long intervalMs;
    private volatile Consumer<String> heartbeatAction;
    private ScheduledFuture<?> scheduledTask;
    /** Bumped on every start, stop and reschedule; a tick from an older generation never reschedules. */
    private long generation;

    /**
     * Create a new heartbeat runner.
     *
     * @param name            thread name
     * @param intervalMs      interval between heartbeats in milliseconds
     * @param heartbeatAction action to invoke on each heartbeat (receives reason
     *                        string)
     */
    public HeartbeatRunner(String name, long intervalMs, Consumer<String> heartbeatAction) {
        this.name = name;
        this.intervalMs = Math.max(MIN_INTERVAL_MS, intervalMs);
        this.heartbeatAction = heartbeatAction;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Heartbeat {} already running", name);
            return;
        }
        scheduleNext();
        log.debug("Heartbeat {} started (interval: {}ms)", name, intervalMs);
    }

    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        generation++;
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
        }
        log.debug("Heartbeat {} stopped", name);
    }

    /**
     * Update the heartbeat interval; a running loop is rescheduled.
     */
    public synchronized void updateInterval(long newIntervalMs) {
        this.intervalMs = Math.max(MIN_INTERVAL_MS, newIntervalMs);
        if (running.get()) {
            if (scheduledTask != null) {
                scheduledTask.cancel(false);
            }
            scheduleNext();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    private void scheduleNext() {
        long gen = ++generation;
        scheduledTask = scheduler.schedule(() -> tick(gen), intervalMs, TimeUnit.MILLISECONDS);
    }

    private void tick(long gen) {
        synchronized (this) {
            if (!running.get() || gen != generation) {
                return;
            }
        }
        runOnce("scheduled");
        synchronized (this) {
            if (running.get() && gen == generation) {
                scheduleNext();
            }
        }
    }

    private void runOnce(String reason) {
        try {
            var action = heartbeatAction;
            if (action != null) {
                action.accept(reason);
            }
        } catch (Exception e) {
            log.error("Heartbeat {} action failed: {}", name, e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        stop();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
    }
}
