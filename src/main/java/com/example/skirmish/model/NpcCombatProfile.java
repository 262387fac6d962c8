package com.example.skirmish.model;

import java.util.Objects;

/**
 * Static combat definition for a type of NPC.
 * Spawned NPCs share one profile; the profile itself is never mutated.
 */
public class NpcCombatProfile {

    private final String key;              // Unique string identifier (e.g., "goblin_green")
    private final String name;             // Display name (e.g., "Green Goblin")

    // Levels
    private final int attackLevel;
    private final int strengthLevel;
    private final int defenceLevel;
    private final int hitpointsLevel;      // Also the NPC's max HP

    // Defensive bonuses
    private final int meleeDefence;
    private final int rangeDefence;
    private final int magicDefence;

    // Offence
    private final int attackSpeedTicks;
    private final DamageType attackType;
    private final CombatStyle style;

    // Behaviour
    private final boolean aggressive;      // Attacks players/enemies in range without provocation
    private final double aggroRange;       // Tiles from spawn; 0 = derive from wander bounds
    private final Faction faction;

    // Spawning
    private final int respawnTicks;        // Ticks to respawn after death (0 = no respawn)

    private NpcCombatProfile(Builder b) {
        this.key = Objects.requireNonNull(b.key, "key");
        this.name = b.name != null ? b.name : b.key;
        this.attackLevel = Math.max(1, b.attackLevel);
        this.strengthLevel = Math.max(1, b.strengthLevel);
        this.defenceLevel = Math.max(1, b.defenceLevel);
        this.hitpointsLevel = Math.max(1, b.hitpointsLevel);
        this.meleeDefence = b.meleeDefence;
        this.rangeDefence = b.rangeDefence;
        this.magicDefence = b.magicDefence;
        this.attackSpeedTicks = b.attackSpeedTicks > 0 ? b.attackSpeedTicks : ItemCombatStats.DEFAULT_ATTACK_SPEED_TICKS;
        this.attackType = b.attackType != null ? b.attackType : DamageType.MELEE;
        this.style = b.style != null ? b.style : CombatStyle.ACCURATE;
        this.aggressive = b.aggressive;
        this.aggroRange = Math.max(0.0, b.aggroRange);
        this.faction = b.faction != null ? b.faction : Faction.NEUTRAL;
        this.respawnTicks = Math.max(0, b.respawnTicks);
    }

    public static Builder builder(String key) {
        return new Builder(key);
    }

    public String getKey() { return key; }
    public String getName() { return name; }
    public int getAttackLevel() { return attackLevel; }
    public int getStrengthLevel() { return strengthLevel; }
    public int getDefenceLevel() { return defenceLevel; }
    public int getHitpointsLevel() { return hitpointsLevel; }
    public int getMeleeDefence() { return meleeDefence; }
    public int getRangeDefence() { return rangeDefence; }
    public int getMagicDefence() { return magicDefence; }
    public int getAttackSpeedTicks() { return attackSpeedTicks; }
    public DamageType getAttackType() { return attackType; }
    public CombatStyle getStyle() { return style; }
    public boolean isAggressive() { return aggressive; }
    public double getAggroRange() { return aggroRange; }
    public Faction getFaction() { return faction; }
    public int getRespawnTicks() { return respawnTicks; }

    @Override
    public String toString() {
        return "NpcCombatProfile[" + key + " att=" + attackLevel + " str=" + strengthLevel
            + " def=" + defenceLevel + " hp=" + hitpointsLevel + "]";
    }

    public static class Builder {
        private final String key;
        private String name;
        private int attackLevel = 1;
        private int strengthLevel = 1;
        private int defenceLevel = 1;
        private int hitpointsLevel = 10;
        private int meleeDefence;
        private int rangeDefence;
        private int magicDefence;
        private int attackSpeedTicks = ItemCombatStats.DEFAULT_ATTACK_SPEED_TICKS;
        private DamageType attackType = DamageType.MELEE;
        private CombatStyle style = CombatStyle.ACCURATE;
        private boolean aggressive;
        private double aggroRange;
        private Faction faction = Faction.NEUTRAL;
        private int respawnTicks;

        private Builder(String key) {
            this.key = key;
        }

        public Builder name(String name) { this.name = name; return this; }
        public Builder attackLevel(int v) { this.attackLevel = v; return this; }
        public Builder strengthLevel(int v) { this.strengthLevel = v; return this; }
        public Builder defenceLevel(int v) { this.defenceLevel = v; return this; }
        public Builder hitpointsLevel(int v) { this.hitpointsLevel = v; return this; }
        public Builder meleeDefence(int v) { this.meleeDefence = v; return this; }
        public Builder rangeDefence(int v) { this.rangeDefence = v; return this; }
        public Builder magicDefence(int v) { this.magicDefence = v; return this; }
        public Builder attackSpeedTicks(int v) { this.attackSpeedTicks = v; return this; }
        public Builder attackType(DamageType v) { this.attackType = v; return this; }
        public Builder style(CombatStyle v) { this.style = v; return this; }
        public Builder aggressive(boolean v) { this.aggressive = v; return this; }
        public Builder aggroRange(double v) { this.aggroRange = v; return this; }
        public Builder faction(Faction v) { this.faction = v; return this; }
        public Builder respawnTicks(int v) { this.respawnTicks = v; return this; }

        public NpcCombatProfile build() {
            return new NpcCombatProfile(this);
        }
    }
}
