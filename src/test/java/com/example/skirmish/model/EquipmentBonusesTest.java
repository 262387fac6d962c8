package com.example.skirmish.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EquipmentBonuses Tests")
public class EquipmentBonusesTest {

    @Test
    @DisplayName("Nothing equipped gives no bonuses and the default speed")
    void emptyIsNone() {
        EquipmentBonuses b = EquipmentBonuses.aggregate(new EnumMap<>(EquipmentSlot.class));
        assertSame(EquipmentBonuses.NONE, b);
        assertEquals(ItemCombatStats.DEFAULT_ATTACK_SPEED_TICKS, b.getAttackSpeedTicks());
        assertSame(EquipmentBonuses.NONE, EquipmentBonuses.aggregate(null));
    }

    @Test
    @DisplayName("Bonuses are summed across slots and speed comes from the weapon")
    void aggregatesSlots() {
        Map<EquipmentSlot, ItemCombatStats> equipped = new EnumMap<>(EquipmentSlot.class);
        equipped.put(EquipmentSlot.WEAPON, ItemCombatStats.weapon(12, 10, 5));
        equipped.put(EquipmentSlot.BODY, ItemCombatStats.armour(20, 15, -5));
        equipped.put(EquipmentSlot.HEAD, ItemCombatStats.armour(4, 3, 1));

        EquipmentBonuses b = EquipmentBonuses.aggregate(equipped);

        assertEquals(12, b.getAttack());
        assertEquals(10, b.getStrength());
        assertEquals(24, b.getMeleeDefence());
        assertEquals(18, b.getRangeDefence());
        assertEquals(-4, b.getMagicDefence());
        assertEquals(5, b.getAttackSpeedTicks());
    }

    @Test
    @DisplayName("Defence bonus is chosen by incoming damage type")
    void defenceAgainst() {
        EquipmentBonuses b = new EquipmentBonuses(0, 0, 0, 0, 7, 8, 9, 4);
        assertEquals(7, b.defenceAgainst(DamageType.MELEE));
        assertEquals(8, b.defenceAgainst(DamageType.RANGED));
        assertEquals(9, b.defenceAgainst(DamageType.MAGIC));
        assertEquals(7, b.defenceAgainst(DamageType.BURN));
        assertEquals(7, b.defenceAgainst(null));
    }

    @Test
    @DisplayName("Non-positive speed falls back to the default")
    void speedFallback() {
        assertEquals(ItemCombatStats.DEFAULT_ATTACK_SPEED_TICKS, new EquipmentBonuses(0, 0, 0, 0, 0, 0, 0, 0).getAttackSpeedTicks());
    }

    @Test
    @DisplayName("Replacing attack and strength keeps everything else")
    void withAttackAndStrength() {
        EquipmentBonuses b = new EquipmentBonuses(1, 2, 3, 4, 5, 6, 7, 3).withAttackAndStrength(10, 20);
        assertEquals(10, b.getAttack());
        assertEquals(20, b.getStrength());
        assertEquals(5, b.getMeleeDefence());
        assertEquals(3, b.getAttackSpeedTicks());
    }
}
