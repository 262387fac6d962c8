package com.example.skirmish.combat;

import com.example.skirmish.config.CombatConfig;
import com.example.skirmish.model.CombatStyle;

import java.util.Objects;
import java.util.Random;

/**
 * Accuracy and damage formulas.
 *
 * Stateless apart from the injected random source. Inputs are clamped so no
 * combination of levels and bonuses yields a negative roll or a NaN chance.
 */
public class CombatMath {

    private final CombatConfig config;
    private final Random random;

    public CombatMath(CombatConfig config) {
        this(config, new Random());
    }

    public CombatMath(CombatConfig config, Random random) {
        this.config = Objects.requireNonNull(config, "config");
        this.random = Objects.requireNonNull(random, "random");
    }

    public int effectiveAttack(int level, CombatStyle style) {
        int bonus = style == CombatStyle.ACCURATE ? config.getStyleBonus()
            : style == CombatStyle.CONTROLLED ? config.getControlledBonus() : 0;
        return effective(level, bonus);
    }

    public int effectiveStrength(int level, CombatStyle style) {
        int bonus = style == CombatStyle.AGGRESSIVE ? config.getStyleBonus()
            : style == CombatStyle.CONTROLLED ? config.getControlledBonus() : 0;
        return effective(level, bonus);
    }

    public int effectiveDefence(int level, CombatStyle style) {
        int bonus = style == CombatStyle.DEFENSIVE ? config.getStyleBonus()
            : style == CombatStyle.CONTROLLED ? config.getControlledBonus() : 0;
        return effective(level, bonus);
    }

    private int effective(int level, int styleBonus) {
        return Math.max(1, Math.max(1, level) + styleBonus + config.getEffectiveLevelBase());
    }

    public static int attackRoll(int effectiveAttack, int attackBonus) {
        return Math.max(1, effectiveAttack) * (Math.max(0, attackBonus) + 64);
    }

    public static int defenceRoll(int effectiveDefence, int defenceBonus) {
        return Math.max(1, effectiveDefence) * (Math.max(0, defenceBonus) + 64);
    }

    /**
     * Probability that an attack lands, in [0, 1].
     */
    public double chanceToHit(int attackRoll, int defenceRoll) {
        double atk = Math.max(0, attackRoll);
        double def = Math.max(0, defenceRoll);
        double chance;
        if (atk > def) {
            chance = 1.0 - (def + 2.0) / (2.0 * (atk + 1.0));
        } else {
            chance = atk / (2.0 * (def + 1.0));
        }
        if (Double.isNaN(chance)) chance = 0.0;
        chance = Math.min(1.0, Math.max(0.0, chance));
        return Math.max(config.getMinHitChance(), chance);
    }

    public static int maxHit(int effectiveStrength, int strengthBonus) {
        int bonus = Math.max(0, strengthBonus) + 64;
        int max = (int) Math.floor(0.5 + Math.max(1, effectiveStrength) * bonus / 640.0);
        return Math.max(0, max);
    }

    /** Uniform integer in {@code [0, maxHit]}. */
    public int rollDamage(int maxHit) {
        if (maxHit <= 0) return 0;
        return random.nextInt(maxHit + 1);
    }

    public boolean rollHit(double chance) {
        return random.nextDouble() < chance;
    }

    /**
     * Roll one attack. The defender's bonus is picked by the attacker's damage type.
     */
    public CombatRoll roll(CombatantStats attacker, CombatantStats defender) {
        Objects.requireNonNull(attacker, "attacker");
        Objects.requireNonNull(defender, "defender");

        int attEff = effectiveAttack(attacker.getAttackLevel(), attacker.getStyle());
        int defEff = effectiveDefence(defender.getDefenceLevel(), defender.getStyle());
        int atkRoll = attackRoll(attEff, attacker.getBonuses().getAttack());
        int defRoll = defenceRoll(defEff, defender.getBonuses().defenceAgainst(attacker.getDamageType()));
        double chance = chanceToHit(atkRoll, defRoll);

        int strEff = effectiveStrength(attacker.getStrengthLevel(), attacker.getStyle());
        int max = maxHit(strEff, attacker.getBonuses().getStrength());
        if (attacker.getMaxHitMultiplier() != 1.0) {
            max = (int) Math.rint(max * attacker.getMaxHitMultiplier());
        }

        boolean hit = rollHit(chance);
        int damage = hit ? rollDamage(max) : 0;
        return new CombatRoll(hit, damage, max, chance, atkRoll, defRoll);
    }
}
