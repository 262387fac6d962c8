package com.example.skirmish.behavior;

import com.example.skirmish.model.Vec2;
import com.example.skirmish.util.Tickable;

import java.util.Objects;

/**
 * Base for tick-driven movement.
 *
 * Each tick, {@link #nextPosition(long)} decides where the agent will be at the end
 * of the tick. The result is published as a {@link TickWindow} and becomes the
 * agent's simulated position straight away; frame-rate code only reads the window.
 */
public abstract class TickMover implements Tickable {

    protected final long tickDurationMs;
    private Vec2 position;
    private volatile TickWindow window;

    protected TickMover(Vec2 start, long tickDurationMs) {
        this.position = Objects.requireNonNull(start, "start");
        this.tickDurationMs = Math.max(1, tickDurationMs);
        this.window = TickWindow.stationary(start, this.tickDurationMs);
    }

    @Override
    public final void onTick(long tick) {
        Vec2 next = nextPosition(tick);
        if (next == null) next = position;
        window = new TickWindow(position, next, tickDurationMs);
        position = next;
    }

    /**
     * Decide this tick's destination and update behaviour state.
     * @return end-of-tick position; null to stay put
     */
    protected abstract Vec2 nextPosition(long tick);

    public abstract BehaviorState getState();

    public Vec2 getPosition() {
        return position;
    }

    public TickWindow getWindow() {
        return window;
    }

    /** Render position {@code elapsedMs} into the current tick. */
    public Vec2 getRenderPosition(long elapsedMs) {
        return window.sample(elapsedMs);
    }

    /** Place the agent without interpolating. */
    public void teleport(Vec2 to) {
        position = Objects.requireNonNull(to, "to");
        window = TickWindow.stationary(to, tickDurationMs);
    }

    protected double tickSeconds() {
        return tickDurationMs / 1000.0;
    }
}
