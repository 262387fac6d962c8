package com.example.skirmish.behavior;

import com.example.skirmish.model.Vec2;

import java.util.Random;

/**
 * Region an NPC may wander and chase inside, relative to its origin. Either an
 * area centred on the origin, explicit min/max offsets, or a circle.
 */
public final class WanderBounds {

    private final Vec2 minOffset;
    private final Vec2 maxOffset;
    private final boolean centredArea;
    private final double radius;          // 0 = rectangle

    private WanderBounds(Vec2 minOffset, Vec2 maxOffset, boolean centredArea, double radius) {
        this.minOffset = Vec2.of(Math.min(minOffset.getX(), maxOffset.getX()), Math.min(minOffset.getY(), maxOffset.getY()));
        this.maxOffset = Vec2.of(Math.max(minOffset.getX(), maxOffset.getX()), Math.max(minOffset.getY(), maxOffset.getY()));
        this.centredArea = centredArea;
        this.radius = radius;
    }

    /** Area of {@code width x height} centred on the origin. */
    public static WanderBounds area(double width, double height) {
        double hx = Math.abs(width) / 2.0;
        double hy = Math.abs(height) / 2.0;
        return new WanderBounds(Vec2.of(-hx, -hy), Vec2.of(hx, hy), true, 0.0);
    }

    public static WanderBounds offsets(Vec2 minOffset, Vec2 maxOffset) {
        return new WanderBounds(minOffset, maxOffset, false, 0.0);
    }

    /** Circle of {@code radius} around the origin. */
    public static WanderBounds circle(double radius) {
        double r = Math.abs(radius);
        if (r <= 0.0) throw new IllegalArgumentException("radius must be > 0: " + radius);
        return new WanderBounds(Vec2.of(-r, -r), Vec2.of(r, r), true, r);
    }

    /** Random point inside the bounds around {@code origin}. */
    public Vec2 randomPoint(Vec2 origin, Random random) {
        if (isCircle()) {
            double angle = random.nextDouble() * 2.0 * Math.PI;
            double dist = radius * Math.sqrt(random.nextDouble());
            return origin.add(Vec2.of(Math.cos(angle) * dist, Math.sin(angle) * dist));
        }
        double x = minOffset.getX() + random.nextDouble() * (maxOffset.getX() - minOffset.getX());
        double y = minOffset.getY() + random.nextDouble() * (maxOffset.getY() - minOffset.getY());
        return origin.add(Vec2.of(x, y));
    }

    public Vec2 clamp(Vec2 p, Vec2 origin) {
        if (isCircle()) {
            Vec2 offset = p.subtract(origin);
            if (offset.length() <= radius) return p;
            return origin.add(offset.normalized().scale(radius));
        }
        return p.clamp(origin.getX() + minOffset.getX(), origin.getX() + maxOffset.getX(),
            origin.getY() + minOffset.getY(), origin.getY() + maxOffset.getY());
    }

    public boolean contains(Vec2 p, Vec2 origin) {
        double dx = p.getX() - origin.getX();
        double dy = p.getY() - origin.getY();
        if (isCircle()) return Math.sqrt(dx * dx + dy * dy) <= radius;
        return dx >= minOffset.getX() && dx <= maxOffset.getX()
            && dy >= minOffset.getY() && dy <= maxOffset.getY();
    }

    /**
     * Farthest distance from the origin the bounds reach: half the diagonal for a
     * centred area, the largest corner otherwise.
     */
    public double chaseRadius() {
        if (isCircle()) return radius;
        if (centredArea) {
            return maxOffset.length();
        }
        double max = 0.0;
        max = Math.max(max, minOffset.length());
        max = Math.max(max, maxOffset.length());
        max = Math.max(max, Vec2.of(minOffset.getX(), maxOffset.getY()).length());
        max = Math.max(max, Vec2.of(maxOffset.getX(), minOffset.getY()).length());
        return max;
    }

    public boolean isCircle() { return radius > 0.0; }
    public double getRadius() { return radius; }
    public Vec2 getMinOffset() { return minOffset; }
    public Vec2 getMaxOffset() { return maxOffset; }

    @Override
    public String toString() {
        if (isCircle()) return "WanderBounds[r=" + radius + "]";
        return "WanderBounds[" + minOffset + " .. " + maxOffset + "]";
    }
}
