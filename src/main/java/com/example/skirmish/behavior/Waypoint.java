package com.example.skirmish.behavior;

import com.example.skirmish.model.Vec2;

import java.util.Objects;

/**
 * One point of a {@link WaypointPath}, relative to the path's anchor.
 */
public final class Waypoint {

    public static final double MIN_SPEED_MULTIPLIER = 0.0001;

    private final Vec2 offset;
    private final double waitSeconds;
    private final double speedMultiplier;

    public Waypoint(Vec2 offset) {
        this(offset, 0.0, 1.0);
    }

    public Waypoint(Vec2 offset, double waitSeconds, double speedMultiplier) {
        this.offset = Objects.requireNonNull(offset, "offset");
        this.waitSeconds = Math.max(0.0, waitSeconds);
        this.speedMultiplier = Math.max(MIN_SPEED_MULTIPLIER, speedMultiplier);
    }

    public Vec2 getOffset() { return offset; }
    public double getWaitSeconds() { return waitSeconds; }
    public double getSpeedMultiplier() { return speedMultiplier; }
}
