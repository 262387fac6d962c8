package com.example.skirmish.behavior;

import com.example.skirmish.model.NpcCombatProfile;
import com.example.skirmish.model.Vec2;

import java.util.Objects;

/**
 * An NPC's spawn point and the radius around it that it will fight in.
 */
public final class AggroState {

    private final Vec2 spawn;
    private final double radius;

    public AggroState(Vec2 spawn, double radius) {
        this.spawn = Objects.requireNonNull(spawn, "spawn");
        this.radius = Math.max(0.0, radius);
    }

    /**
     * Radius from the profile when it sets one, otherwise the reach of the wander bounds.
     */
    public static AggroState forNpc(Vec2 spawn, NpcCombatProfile profile, WanderBounds bounds) {
        double r = profile != null ? profile.getAggroRange() : 0.0;
        if (r <= 0.0 && bounds != null) r = bounds.chaseRadius();
        return new AggroState(spawn, r);
    }

    public boolean isWithin(Vec2 p) {
        return p.distanceTo(spawn) <= radius;
    }

    public Vec2 getSpawn() { return spawn; }
    public double getRadius() { return radius; }
}
