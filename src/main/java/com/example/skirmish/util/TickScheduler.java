package com.example.skirmish.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-period heartbeat for the simulation.
 *
 * Every tick first runs any one-shot commands that have come due, then calls
 * {@link Tickable#onTick(long)} on each subscriber in subscription order. All of it
 * happens on a single thread, so subscribers need no locking among themselves.
 *
 * In production call {@link #start()}; tests drive the loop with {@link #runTick()}.
 */
public class TickScheduler {

    private static final Logger logger = LoggerFactory.getLogger(TickScheduler.class);

    private final long tickDurationMs;
    private final List<Tickable> subscribers = new CopyOnWriteArrayList<>();
    private final List<PendingCommand> pending = new ArrayList<>();
    private final Object pendingLock = new Object();

    private ScheduledExecutorService executor;
    private ScheduledFuture<?> heartbeat;

    private volatile long currentTick = 0;
    private volatile long lastTickStartedAtMs = System.currentTimeMillis();

    public TickScheduler(long tickDurationMs) {
        if (tickDurationMs <= 0) {
            throw new IllegalArgumentException("tickDurationMs must be positive: " + tickDurationMs);
        }
        this.tickDurationMs = tickDurationMs;
    }

    /** Add a subscriber. Subscribing the same object twice has no effect. */
    public void subscribe(Tickable tickable) {
        Objects.requireNonNull(tickable, "tickable");
        ((CopyOnWriteArrayList<Tickable>) subscribers).addIfAbsent(tickable);
    }

    /** Remove a subscriber. Takes effect immediately, even mid-tick. */
    public boolean unsubscribe(Tickable tickable) {
        return subscribers.remove(tickable);
    }

    public boolean isSubscribed(Tickable tickable) {
        return subscribers.contains(tickable);
    }

    public int getSubscriberCount() {
        return subscribers.size();
    }

    /**
     * Run a command at the start of a later tick.
     * @param delayTicks ticks from now; values below 1 mean the next tick
     */
    public void scheduleOnce(int delayTicks, Runnable command) {
        Objects.requireNonNull(command, "command");
        long due = currentTick + Math.max(1, delayTicks);
        synchronized (pendingLock) {
            pending.add(new PendingCommand(due, command));
        }
    }

    /**
     * Advance the simulation by one tick.
     */
    public void runTick() {
        long tick = ++currentTick;
        lastTickStartedAtMs = System.currentTimeMillis();

        runDueCommands(tick);

        for (Tickable t : subscribers) {
            // skip anything unsubscribed earlier in this same tick
            if (!subscribers.contains(t)) continue;
            try {
                t.onTick(tick);
            } catch (Exception e) {
                logger.warn("[TickScheduler] Subscriber {} failed on tick {}: {}", t, tick, e.getMessage(), e);
            }
        }
    }

    private void runDueCommands(long tick) {
        List<PendingCommand> due = new ArrayList<>();
        synchronized (pendingLock) {
            Iterator<PendingCommand> it = pending.iterator();
            while (it.hasNext()) {
                PendingCommand c = it.next();
                if (c.dueTick <= tick) {
                    due.add(c);
                    it.remove();
                }
            }
        }
        for (PendingCommand c : due) {
            try {
                c.command.run();
            } catch (Exception e) {
                logger.warn("[TickScheduler] One-shot command failed on tick {}: {}", tick, e.getMessage(), e);
            }
        }
    }

    /**
     * Start the wall-clock heartbeat on a single daemon thread.
     */
    public synchronized void start() {
        if (heartbeat != null) return;
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "skirmish-tick");
            t.setDaemon(true);
            return t;
        });
        heartbeat = executor.scheduleAtFixedRate(this::runTick, tickDurationMs, tickDurationMs, TimeUnit.MILLISECONDS);
        logger.info("[TickScheduler] Started with {}ms ticks", tickDurationMs);
    }

    public synchronized boolean isRunning() {
        return heartbeat != null;
    }

    public synchronized void shutdown() {
        if (heartbeat != null) {
            heartbeat.cancel(false);
            heartbeat = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
            logger.info("[TickScheduler] Stopped after {} ticks", currentTick);
        }
        synchronized (pendingLock) {
            pending.clear();
        }
    }

    public long getCurrentTick() {
        return currentTick;
    }

    public long getTickDurationMs() {
        return tickDurationMs;
    }

    public long ticksToMillis(int ticks) {
        return ticks * tickDurationMs;
    }

    /** Wall-clock milliseconds since the current tick started, for render interpolation. */
    public long getElapsedSinceTickMs() {
        return Math.max(0L, System.currentTimeMillis() - lastTickStartedAtMs);
    }

    private static final class PendingCommand {
        final long dueTick;
        final Runnable command;

        PendingCommand(long dueTick, Runnable command) {
            this.dueTick = dueTick;
            this.command = command;
        }
    }
}
