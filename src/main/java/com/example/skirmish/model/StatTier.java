package com.example.skirmish.model;

/**
 * Pet stat multiplier that applies from {@code level} upwards.
 */
public class StatTier {

    private final int level;
    private final double multiplier;

    public StatTier(int level, double multiplier) {
        this.level = Math.max(1, level);
        this.multiplier = Math.max(0.0, multiplier);
    }

    public int getLevel() { return level; }
    public double getMultiplier() { return multiplier; }
}
