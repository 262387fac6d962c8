package com.example.skirmish.config;

import com.example.skirmish.model.StatTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Tunable constants for the tick loop and combat resolution.
 *
 * Loaded from a YAML resource (default {@code /skirmish.yaml}). Missing keys and
 * malformed values keep their defaults, so a partial file is fine:
 * <pre>
 * tick:
 *   durationMs: 600
 * combat:
 *   meleeRange: 1.5
 * pet:
 *   statTiers:
 *     - { level: 1, multiplier: 0.5 }
 * </pre>
 */
public final class CombatConfig {

    private static final Logger logger = LoggerFactory.getLogger(CombatConfig.class);

    public static final String DEFAULT_RESOURCE = "/skirmish.yaml";

    private final long tickDurationMs;
    private final double meleeRange;
    private final int defaultAttackSpeedTicks;
    private final int styleBonus;              // Accurate/Aggressive/Defensive
    private final int controlledBonus;         // Controlled, applied to all three
    private final int effectiveLevelBase;      // Added to every effective level
    private final double minHitChance;         // Floor for chance to hit
    private final int deathExitWaitTicks;      // Wait cap after a kill
    private final double petLeashFactor;       // Leash = meleeRange * factor
    private final double petMoveSpeed;
    private final double petFollowDistance;
    private final double xpPerDamage;
    private final double hitpointsXpPerDamage;
    private final double beastmasterXpPerDamage;
    private final double beastmasterPetXpPerDamage;
    private final List<StatTier> petStatTiers;

    private CombatConfig(Builder b) {
        this.tickDurationMs = b.tickDurationMs > 0 ? b.tickDurationMs : 600;
        this.meleeRange = Math.max(0.0, b.meleeRange);
        this.defaultAttackSpeedTicks = Math.max(1, b.defaultAttackSpeedTicks);
        this.styleBonus = Math.max(0, b.styleBonus);
        this.controlledBonus = Math.max(0, b.controlledBonus);
        this.effectiveLevelBase = Math.max(0, b.effectiveLevelBase);
        this.minHitChance = Math.min(1.0, Math.max(0.0, b.minHitChance));
        this.deathExitWaitTicks = Math.max(0, b.deathExitWaitTicks);
        this.petLeashFactor = Math.max(1.0, b.petLeashFactor);
        this.petMoveSpeed = b.petMoveSpeed > 0 ? b.petMoveSpeed : 5.0;
        this.petFollowDistance = Math.max(0.0, b.petFollowDistance);
        this.xpPerDamage = Math.max(0.0, b.xpPerDamage);
        this.hitpointsXpPerDamage = Math.max(0.0, b.hitpointsXpPerDamage);
        this.beastmasterXpPerDamage = Math.max(0.0, b.beastmasterXpPerDamage);
        this.beastmasterPetXpPerDamage = Math.max(0.0, b.beastmasterPetXpPerDamage);
        List<StatTier> tiers = new ArrayList<>(b.petStatTiers);
        tiers.sort(Comparator.comparingInt(StatTier::getLevel));
        this.petStatTiers = Collections.unmodifiableList(tiers);
    }

    public static CombatConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Load from a classpath resource. Falls back to defaults when the resource
     * is missing or unreadable.
     */
    public static CombatConfig load(String resourcePath) {
        try (InputStream is = CombatConfig.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                logger.warn("[CombatConfig] Resource not found: {} - using defaults", resourcePath);
                return defaults();
            }
            return fromStream(is);
        } catch (Exception e) {
            logger.warn("[CombatConfig] Failed to load {}: {} - using defaults", resourcePath, e.getMessage());
            return defaults();
        }
    }

    public static CombatConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    @SuppressWarnings("unchecked")
    static CombatConfig fromStream(InputStream is) {
        Yaml yaml = new Yaml();
        Object root = yaml.load(is);
        Builder b = builder();
        if (!(root instanceof Map)) {
            logger.warn("[CombatConfig] Config root is not a mapping - using defaults");
            return b.build();
        }
        Map<String, Object> data = (Map<String, Object>) root;

        Map<String, Object> tick = section(data, "tick");
        b.tickDurationMs(parseLong(tick.get("durationMs"), b.tickDurationMs));

        Map<String, Object> combat = section(data, "combat");
        b.meleeRange(parseDouble(combat.get("meleeRange"), b.meleeRange));
        b.defaultAttackSpeedTicks(parseInt(combat.get("defaultAttackSpeedTicks"), b.defaultAttackSpeedTicks));
        b.styleBonus(parseInt(combat.get("styleBonus"), b.styleBonus));
        b.controlledBonus(parseInt(combat.get("controlledBonus"), b.controlledBonus));
        b.effectiveLevelBase(parseInt(combat.get("effectiveLevelBase"), b.effectiveLevelBase));
        b.minHitChance(parseDouble(combat.get("minHitChance"), b.minHitChance));
        b.deathExitWaitTicks(parseInt(combat.get("deathExitWaitTicks"), b.deathExitWaitTicks));

        Map<String, Object> pet = section(data, "pet");
        b.petLeashFactor(parseDouble(pet.get("leashFactor"), b.petLeashFactor));
        b.petMoveSpeed(parseDouble(pet.get("moveSpeed"), b.petMoveSpeed));
        b.petFollowDistance(parseDouble(pet.get("followDistance"), b.petFollowDistance));
        Object tiers = pet.get("statTiers");
        if (tiers instanceof List) {
            List<StatTier> parsed = new ArrayList<>();
            for (Object o : (List<Object>) tiers) {
                if (!(o instanceof Map)) continue;
                Map<String, Object> t = (Map<String, Object>) o;
                parsed.add(new StatTier(parseInt(t.get("level"), 1), parseDouble(t.get("multiplier"), 1.0)));
            }
            if (!parsed.isEmpty()) b.petStatTiers(parsed);
        }

        Map<String, Object> xp = section(data, "xp");
        b.xpPerDamage(parseDouble(xp.get("perDamage"), b.xpPerDamage));
        b.hitpointsXpPerDamage(parseDouble(xp.get("hitpointsPerDamage"), b.hitpointsXpPerDamage));

        Map<String, Object> bm = section(data, "beastmaster");
        b.beastmasterXpPerDamage(parseDouble(bm.get("xpPerDamage"), b.beastmasterXpPerDamage));
        b.beastmasterPetXpPerDamage(parseDouble(bm.get("petXpPerDamage"), b.beastmasterPetXpPerDamage));

        CombatConfig cfg = b.build();
        logger.info("[CombatConfig] Loaded: tick={}ms meleeRange={} attackSpeed={}",
            cfg.tickDurationMs, cfg.meleeRange, cfg.defaultAttackSpeedTicks);
        return cfg;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> data, String key) {
        Object o = data.get(key);
        if (o instanceof Map) return (Map<String, Object>) o;
        return Collections.emptyMap();
    }

    private static int parseInt(Object o, int def) {
        if (o == null) return def;
        if (o instanceof Number) return ((Number) o).intValue();
        try {
            return Integer.parseInt(o.toString().trim());
        } catch (NumberFormatException e) {
            logger.warn("[CombatConfig] Bad integer '{}', keeping {}", o, def);
            return def;
        }
    }

    private static long parseLong(Object o, long def) {
        if (o == null) return def;
        if (o instanceof Number) return ((Number) o).longValue();
        try {
            return Long.parseLong(o.toString().trim());
        } catch (NumberFormatException e) {
            logger.warn("[CombatConfig] Bad integer '{}', keeping {}", o, def);
            return def;
        }
    }

    private static double parseDouble(Object o, double def) {
        if (o == null) return def;
        if (o instanceof Number) return ((Number) o).doubleValue();
        try {
            return Double.parseDouble(o.toString().trim());
        } catch (NumberFormatException e) {
            logger.warn("[CombatConfig] Bad number '{}', keeping {}", o, def);
            return def;
        }
    }

    /**
     * Multiplier for a pet of the given level: the highest tier whose level is
     * at or below it, or 1.0 when no tier applies.
     */
    public double petStatMultiplier(int petLevel) {
        double m = 1.0;
        boolean found = false;
        for (StatTier t : petStatTiers) {
            if (petLevel >= t.getLevel()) {
                m = t.getMultiplier();
                found = true;
            }
        }
        if (!found && !petStatTiers.isEmpty()) return petStatTiers.get(0).getMultiplier();
        return m;
    }

    public long getTickDurationMs() { return tickDurationMs; }
    public double getMeleeRange() { return meleeRange; }
    public int getDefaultAttackSpeedTicks() { return defaultAttackSpeedTicks; }
    public int getStyleBonus() { return styleBonus; }
    public int getControlledBonus() { return controlledBonus; }
    public int getEffectiveLevelBase() { return effectiveLevelBase; }
    public double getMinHitChance() { return minHitChance; }
    public int getDeathExitWaitTicks() { return deathExitWaitTicks; }
    public double getPetLeashFactor() { return petLeashFactor; }
    public double getPetLeashRange() { return meleeRange * petLeashFactor; }
    public double getPetMoveSpeed() { return petMoveSpeed; }
    public double getPetFollowDistance() { return petFollowDistance; }
    public double getXpPerDamage() { return xpPerDamage; }
    public double getHitpointsXpPerDamage() { return hitpointsXpPerDamage; }
    public double getBeastmasterXpPerDamage() { return beastmasterXpPerDamage; }
    public double getBeastmasterPetXpPerDamage() { return beastmasterPetXpPerDamage; }
    public List<StatTier> getPetStatTiers() { return petStatTiers; }

    public static class Builder {
        private long tickDurationMs = 600;
        private double meleeRange = 1.5;
        private int defaultAttackSpeedTicks = 4;
        private int styleBonus = 3;
        private int controlledBonus = 1;
        private int effectiveLevelBase = 0;
        private double minHitChance = 0.0;
        private int deathExitWaitTicks = 2;
        private double petLeashFactor = 5.0;
        private double petMoveSpeed = 5.0;
        private double petFollowDistance = 1.0;
        private double xpPerDamage = 4.0;
        private double hitpointsXpPerDamage = 1.33;
        private double beastmasterXpPerDamage = 4.0;
        private double beastmasterPetXpPerDamage = 12.0;
        private List<StatTier> petStatTiers = new ArrayList<>(List.of(
            new StatTier(1, 0.5), new StatTier(25, 0.75), new StatTier(50, 1.0)));

        private Builder() {
        }

        public Builder tickDurationMs(long v) { this.tickDurationMs = v; return this; }
        public Builder meleeRange(double v) { this.meleeRange = v; return this; }
        public Builder defaultAttackSpeedTicks(int v) { this.defaultAttackSpeedTicks = v; return this; }
        public Builder styleBonus(int v) { this.styleBonus = v; return this; }
        public Builder controlledBonus(int v) { this.controlledBonus = v; return this; }
        public Builder effectiveLevelBase(int v) { this.effectiveLevelBase = v; return this; }
        public Builder minHitChance(double v) { this.minHitChance = v; return this; }
        public Builder deathExitWaitTicks(int v) { this.deathExitWaitTicks = v; return this; }
        public Builder petLeashFactor(double v) { this.petLeashFactor = v; return this; }
        public Builder petMoveSpeed(double v) { this.petMoveSpeed = v; return this; }
        public Builder petFollowDistance(double v) { this.petFollowDistance = v; return this; }
        public Builder xpPerDamage(double v) { this.xpPerDamage = v; return this; }
        public Builder hitpointsXpPerDamage(double v) { this.hitpointsXpPerDamage = v; return this; }
        public Builder beastmasterXpPerDamage(double v) { this.beastmasterXpPerDamage = v; return this; }
        public Builder beastmasterPetXpPerDamage(double v) { this.beastmasterPetXpPerDamage = v; return this; }
        public Builder petStatTiers(List<StatTier> v) { this.petStatTiers = new ArrayList<>(v); return this; }

        public CombatConfig build() {
            return new CombatConfig(this);
        }
    }
}
