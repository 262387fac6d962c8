package com.example.skirmish.model;

/**
 * A pet-level threshold that changes the pet's tier name and visual scale.
 */
public class EvolutionTier {

    private final int level;
    private final String tierName;
    private final double scale;

    public EvolutionTier(int level, String tierName, double scale) {
        this.level = Math.max(1, level);
        this.tierName = tierName == null ? "" : tierName;
        this.scale = scale > 0 ? scale : 1.0;
    }

    public int getLevel() { return level; }
    public String getTierName() { return tierName; }
    public double getScale() { return scale; }
}
