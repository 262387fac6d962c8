package com.example.skirmish.model;

/**
 * Immutable 2D world position or direction, in tiles.
 */
public final class Vec2 {

    public static final Vec2 ZERO = new Vec2(0.0, 0.0);

    private final double x;
    private final double y;

    public Vec2(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public static Vec2 of(double x, double y) {
        return new Vec2(x, y);
    }

    public double getX() { return x; }
    public double getY() { return y; }

    public Vec2 add(Vec2 other) {
        return new Vec2(x + other.x, y + other.y);
    }

    public Vec2 subtract(Vec2 other) {
        return new Vec2(x - other.x, y - other.y);
    }

    public Vec2 scale(double factor) {
        return new Vec2(x * factor, y * factor);
    }

    public double length() {
        return Math.sqrt(x * x + y * y);
    }

    public double distanceTo(Vec2 other) {
        double dx = other.x - x;
        double dy = other.y - y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    /**
     * Unit vector in the same direction, or ZERO for a zero-length vector.
     */
    public Vec2 normalized() {
        double len = length();
        if (len < 1e-9) return ZERO;
        return new Vec2(x / len, y / len);
    }

    /**
     * Step from this point toward {@code target} by at most {@code maxDistance},
     * landing exactly on the target when it is within reach.
     */
    public Vec2 moveTowards(Vec2 target, double maxDistance) {
        double dist = distanceTo(target);
        if (dist <= maxDistance || dist < 1e-9) {
            return target;
        }
        double f = maxDistance / dist;
        return new Vec2(x + (target.x - x) * f, y + (target.y - y) * f);
    }

    /**
     * Linear interpolation. {@code t} is clamped to [0,1]; t == 1 returns {@code to} itself
     * so sampling at the end of a window never drifts.
     */
    public static Vec2 lerp(Vec2 from, Vec2 to, double t) {
        if (t <= 0.0) return from;
        if (t >= 1.0) return to;
        return new Vec2(from.x + (to.x - from.x) * t, from.y + (to.y - from.y) * t);
    }

    public Vec2 clamp(double minX, double maxX, double minY, double maxY) {
        return new Vec2(Math.max(minX, Math.min(maxX, x)), Math.max(minY, Math.min(maxY, y)));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Vec2)) return false;
        Vec2 other = (Vec2) o;
        return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(x) + Double.hashCode(y);
    }

    @Override
    public String toString() {
        return String.format("(%.2f, %.2f)", x, y);
    }
}
