package com.example.skirmish.combat;

import com.example.skirmish.config.CombatConfig;
import com.example.skirmish.model.CombatStyle;
import com.example.skirmish.model.DamageType;
import com.example.skirmish.model.EquipmentBonuses;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the accuracy and damage formulas.
 */
@DisplayName("CombatMath Tests")
public class CombatMathTest {

    private final CombatConfig config = CombatConfig.defaults();
    private final CombatMath math = new CombatMath(config, new Random(42));

    // === Effective levels ===

    @Test
    @DisplayName("Style bonuses apply only to their own stat")
    void styleBonuses() {
        assertEquals(13, math.effectiveAttack(10, CombatStyle.ACCURATE));
        assertEquals(10, math.effectiveStrength(10, CombatStyle.ACCURATE));
        assertEquals(13, math.effectiveStrength(10, CombatStyle.AGGRESSIVE));
        assertEquals(13, math.effectiveDefence(10, CombatStyle.DEFENSIVE));
        assertEquals(10, math.effectiveDefence(10, CombatStyle.AGGRESSIVE));
    }

    @Test
    @DisplayName("Controlled adds one to every stat")
    void controlledBonus() {
        assertEquals(11, math.effectiveAttack(10, CombatStyle.CONTROLLED));
        assertEquals(11, math.effectiveStrength(10, CombatStyle.CONTROLLED));
        assertEquals(11, math.effectiveDefence(10, CombatStyle.CONTROLLED));
    }

    @Test
    @DisplayName("Levels below 1 count as 1")
    void levelFloor() {
        assertEquals(1, math.effectiveStrength(-20, CombatStyle.DEFENSIVE));
        assertEquals(1, math.effectiveAttack(0, null));
    }

    @Test
    @DisplayName("Configured level base is added to every effective level")
    void levelBase() {
        CombatMath based = new CombatMath(CombatConfig.builder().effectiveLevelBase(8).build());
        assertEquals(21, based.effectiveAttack(10, CombatStyle.ACCURATE));
        assertEquals(18, based.effectiveStrength(10, CombatStyle.ACCURATE));
    }

    // === Rolls ===

    @Test
    @DisplayName("Attack and defence rolls never go below the level floor")
    void rollsClamped() {
        assertEquals(64, CombatMath.attackRoll(0, -30));
        assertEquals(13 * 74, CombatMath.attackRoll(13, 10));
        assertEquals(64, CombatMath.defenceRoll(-5, -100));
    }

    // === Chance to hit ===

    @Test
    @DisplayName("Chance uses the attacker-favoured branch when the attack roll is higher")
    void chanceAttackerHigher() {
        assertEquals(1.0 - 502.0 / (2.0 * 1001.0), math.chanceToHit(1000, 500), 1e-12);
    }

    @Test
    @DisplayName("Chance uses the defender-favoured branch otherwise")
    void chanceDefenderHigher() {
        assertEquals(500.0 / (2.0 * 1001.0), math.chanceToHit(500, 1000), 1e-12);
        assertEquals(1000.0 / (2.0 * 1001.0), math.chanceToHit(1000, 1000), 1e-12);
    }

    @Test
    @DisplayName("Chance stays within [0, 1] for extreme inputs")
    void chanceBounded() {
        int[] values = {Integer.MIN_VALUE, -1, 0, 1, 64, 10_000, Integer.MAX_VALUE};
        for (int a : values) {
            for (int d : values) {
                double c = math.chanceToHit(a, d);
                assertFalse(Double.isNaN(c));
                assertTrue(c >= 0.0 && c <= 1.0, a + " vs " + d + " gave " + c);
            }
        }
        assertEquals(0.0, math.chanceToHit(0, 0), 1e-12);
    }

    @Test
    @DisplayName("Chance never decreases as the attack roll grows")
    void chanceMonotone() {
        double previous = -1;
        for (int atk = 0; atk <= 5000; atk += 7) {
            double c = math.chanceToHit(atk, 1000);
            assertTrue(c >= previous, "dropped at " + atk);
            previous = c;
        }
    }

    @Test
    @DisplayName("Configured minimum chance is a floor")
    void minimumChance() {
        CombatMath floored = new CombatMath(CombatConfig.builder().minHitChance(0.25).build());
        assertEquals(0.25, floored.chanceToHit(0, 10_000), 1e-12);
        assertTrue(floored.chanceToHit(10_000, 64) > 0.9);
    }

    // === Max hit and damage ===

    @ParameterizedTest
    @CsvSource({
        "10, 0, 1",
        "13, 0, 1",
        "50, 30, 7",
        "99, 0, 10",
        "0, -10, 0"
    })
    @DisplayName("Max hit formula")
    void maxHit(int effectiveStrength, int strengthBonus, int expected) {
        assertEquals(expected, CombatMath.maxHit(effectiveStrength, strengthBonus));
    }

    @Test
    @DisplayName("Level 10 accurate fighter with no gear has a max hit of 1")
    void accurateMaxHitExample() {
        CombatantStats attacker = new CombatantStats(10, 10, 1, EquipmentBonuses.NONE, CombatStyle.ACCURATE, DamageType.MELEE);
        CombatRoll roll = math.roll(attacker, CombatantStats.fallback(DamageType.MELEE));
        assertEquals(1, roll.getMaxHit());
        assertTrue(roll.getDamage() >= 0 && roll.getDamage() <= 1);
    }

    @Test
    @DisplayName("Damage rolls cover [0, max] uniformly")
    void rollDamageRange() {
        int[] counts = new int[6];
        int rolls = 6000;
        long sum = 0;
        for (int i = 0; i < rolls; i++) {
            int d = math.rollDamage(5);
            assertTrue(d >= 0 && d <= 5, "out of range: " + d);
            counts[d]++;
            sum += d;
        }
        for (int v = 0; v <= 5; v++) {
            assertTrue(counts[v] > 800, "value " + v + " seen " + counts[v] + " times");
        }
        assertEquals(2.5, (double) sum / rolls, 0.15);
    }

    @Test
    @DisplayName("Non-positive max hit always rolls zero")
    void rollDamageZero() {
        assertEquals(0, math.rollDamage(0));
        assertEquals(0, math.rollDamage(-4));
    }

    // === Full roll ===

    @Test
    @DisplayName("Defender bonus is picked by the attacker's damage type")
    void defenceByDamageType() {
        EquipmentBonuses armour = new EquipmentBonuses(0, 0, 0, 0, 10, 20, 100, 4);
        CombatantStats defender = new CombatantStats(1, 1, 1, armour, CombatStyle.DEFENSIVE, DamageType.MELEE);
        int defEff = math.effectiveDefence(1, CombatStyle.DEFENSIVE);

        CombatantStats melee = new CombatantStats(20, 20, 1, EquipmentBonuses.NONE, CombatStyle.ACCURATE, DamageType.MELEE);
        assertEquals(defEff * 74, math.roll(melee, defender).getDefenceRoll());
        assertEquals(defEff * 84, math.roll(melee.withDamageType(DamageType.RANGED), defender).getDefenceRoll());
        assertEquals(defEff * 164, math.roll(melee.withDamageType(DamageType.MAGIC), defender).getDefenceRoll());
    }

    @Test
    @DisplayName("Max hit multiplier is applied and rounded")
    void maxHitMultiplier() {
        CombatMath sure = new CombatMath(config, new MaxRollRandom());
        EquipmentBonuses gear = new EquipmentBonuses(0, 30, 0, 0, 0, 0, 0, 4);
        CombatantStats attacker = new CombatantStats(1, 50, 1, gear, CombatStyle.ACCURATE, DamageType.MELEE)
            .withMaxHitMultiplier(2.0);

        CombatRoll roll = sure.roll(attacker, CombatantStats.fallback(DamageType.MELEE));

        assertEquals(14, roll.getMaxHit());
        assertTrue(roll.isHit());
        assertEquals(14, roll.getDamage());
    }

    @Test
    @DisplayName("A miss deals no damage")
    void missDealsNothing() {
        Random neverHits = new Random() {
            @Override
            public double nextDouble() {
                return 0.999999;
            }
        };
        CombatMath unlucky = new CombatMath(config, neverHits);
        CombatantStats weak = CombatantStats.fallback(DamageType.MELEE);
        CombatantStats tank = new CombatantStats(1, 1, 99, new EquipmentBonuses(0, 0, 0, 0, 200, 0, 0, 4),
            CombatStyle.DEFENSIVE, DamageType.MELEE);

        CombatRoll roll = unlucky.roll(weak, tank);
        assertFalse(roll.isHit());
        assertEquals(0, roll.getDamage());
    }
}
