package com.example.skirmish.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Data for a pet. Only pets with {@code canFight} take part in combat.
 *
 * The per-Beastmaster-level fields are fractions: 0.01 means each owner Beastmaster
 * level adds 1% to the scaled value.
 */
public class PetDefinition {

    private final String id;
    private final String displayName;

    // Combat
    private final boolean canFight;
    private final int attackLevel;
    private final int strengthLevel;
    private final int attackSpeedTicks;
    private final int accuracyBonus;
    private final int damageBonus;
    private final double moveSpeed;        // Tiles per second; 0 = configured pet speed

    // Owner scaling
    private final double attackLevelPerBeastmasterLevel;
    private final double strengthLevelPerBeastmasterLevel;
    private final double maxHitPerBeastmasterLevel;

    private final List<EvolutionTier> evolutionTiers;

    private PetDefinition(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id");
        this.displayName = b.displayName != null ? b.displayName : b.id;
        this.canFight = b.canFight;
        this.attackLevel = Math.max(1, b.attackLevel);
        this.strengthLevel = Math.max(1, b.strengthLevel);
        this.attackSpeedTicks = b.attackSpeedTicks > 0 ? b.attackSpeedTicks : ItemCombatStats.DEFAULT_ATTACK_SPEED_TICKS;
        this.accuracyBonus = b.accuracyBonus;
        this.damageBonus = b.damageBonus;
        this.moveSpeed = Math.max(0.0, b.moveSpeed);
        this.attackLevelPerBeastmasterLevel = b.attackLevelPerBeastmasterLevel;
        this.strengthLevelPerBeastmasterLevel = b.strengthLevelPerBeastmasterLevel;
        this.maxHitPerBeastmasterLevel = b.maxHitPerBeastmasterLevel;
        List<EvolutionTier> tiers = new ArrayList<>(b.evolutionTiers);
        tiers.sort(Comparator.comparingInt(EvolutionTier::getLevel));
        this.evolutionTiers = Collections.unmodifiableList(tiers);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() { return id; }
    public String getDisplayName() { return displayName; }
    public boolean canFight() { return canFight; }
    public int getAttackLevel() { return attackLevel; }
    public int getStrengthLevel() { return strengthLevel; }
    public int getAttackSpeedTicks() { return attackSpeedTicks; }
    public int getAccuracyBonus() { return accuracyBonus; }
    public int getDamageBonus() { return damageBonus; }
    public double getMoveSpeed() { return moveSpeed; }
    public double getAttackLevelPerBeastmasterLevel() { return attackLevelPerBeastmasterLevel; }
    public double getStrengthLevelPerBeastmasterLevel() { return strengthLevelPerBeastmasterLevel; }
    public double getMaxHitPerBeastmasterLevel() { return maxHitPerBeastmasterLevel; }
    public List<EvolutionTier> getEvolutionTiers() { return evolutionTiers; }

    public static class Builder {
        private final String id;
        private String displayName;
        private boolean canFight;
        private int attackLevel = 1;
        private int strengthLevel = 1;
        private int attackSpeedTicks = ItemCombatStats.DEFAULT_ATTACK_SPEED_TICKS;
        private int accuracyBonus;
        private int damageBonus;
        private double moveSpeed;
        private double attackLevelPerBeastmasterLevel;
        private double strengthLevelPerBeastmasterLevel;
        private double maxHitPerBeastmasterLevel;
        private final List<EvolutionTier> evolutionTiers = new ArrayList<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder displayName(String v) { this.displayName = v; return this; }
        public Builder canFight(boolean v) { this.canFight = v; return this; }
        public Builder attackLevel(int v) { this.attackLevel = v; return this; }
        public Builder strengthLevel(int v) { this.strengthLevel = v; return this; }
        public Builder attackSpeedTicks(int v) { this.attackSpeedTicks = v; return this; }
        public Builder accuracyBonus(int v) { this.accuracyBonus = v; return this; }
        public Builder damageBonus(int v) { this.damageBonus = v; return this; }
        public Builder moveSpeed(double v) { this.moveSpeed = v; return this; }
        public Builder attackLevelPerBeastmasterLevel(double v) { this.attackLevelPerBeastmasterLevel = v; return this; }
        public Builder strengthLevelPerBeastmasterLevel(double v) { this.strengthLevelPerBeastmasterLevel = v; return this; }
        public Builder maxHitPerBeastmasterLevel(double v) { this.maxHitPerBeastmasterLevel = v; return this; }
        public Builder evolutionTier(EvolutionTier tier) { if (tier != null) this.evolutionTiers.add(tier); return this; }

        public PetDefinition build() {
            return new PetDefinition(this);
        }
    }
}
