package com.example.skirmish.behavior;

import com.example.skirmish.model.Vec2;

import java.util.Objects;

/**
 * Where an agent starts and ends the current tick. Renderers sample it every
 * frame; only the tick loop ever creates a new one.
 */
public final class TickWindow {

    private final Vec2 from;
    private final Vec2 to;
    private final long durationMs;

    public TickWindow(Vec2 from, Vec2 to, long durationMs) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.durationMs = Math.max(1, durationMs);
    }

    public static TickWindow stationary(Vec2 at, long durationMs) {
        return new TickWindow(at, at, durationMs);
    }

    /**
     * Interpolated position {@code elapsedMs} into the tick. Elapsed time is clamped
     * to the window, and sampling at or past the end returns {@link #getTo()} exactly.
     */
    public Vec2 sample(long elapsedMs) {
        if (elapsedMs <= 0) return from;
        if (elapsedMs >= durationMs) return to;
        return Vec2.lerp(from, to, (double) elapsedMs / durationMs);
    }

    public Vec2 getFrom() { return from; }
    public Vec2 getTo() { return to; }
    public long getDurationMs() { return durationMs; }

    public boolean isMoving() {
        return !from.equals(to);
    }

    /** Travel direction for sprite selection; zero when stationary. */
    public Vec2 getDirection() {
        return to.subtract(from);
    }

    @Override
    public String toString() {
        return "TickWindow[" + from + " -> " + to + "]";
    }
}
