package com.example.skirmish.player;

import com.example.skirmish.combat.CombatantStats;
import com.example.skirmish.model.CombatStyle;
import com.example.skirmish.model.DamageType;
import com.example.skirmish.model.EquipmentSlot;
import com.example.skirmish.model.ItemCombatStats;
import com.example.skirmish.model.SkillType;
import com.example.skirmish.model.Vec2;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PlayerCharacter Tests")
public class PlayerCharacterTest {

    @Test
    @DisplayName("Equipping items updates the combined bonuses")
    void equipment() {
        PlayerCharacter hero = new PlayerCharacter("hero", new SkillSet(), Vec2.ZERO);
        hero.equip(EquipmentSlot.WEAPON, ItemCombatStats.weapon(10, 8, 5));
        hero.equip(EquipmentSlot.SHIELD, ItemCombatStats.armour(6, 7, 2));

        assertEquals(10, hero.getBonuses().getAttack());
        assertEquals(6, hero.getBonuses().getMeleeDefence());
        assertEquals(5, hero.getAttackStats().getAttackSpeedTicks());

        hero.unequip(EquipmentSlot.WEAPON);
        assertEquals(0, hero.getBonuses().getAttack());
        assertEquals(ItemCombatStats.DEFAULT_ATTACK_SPEED_TICKS, hero.getAttackStats().getAttackSpeedTicks());
    }

    @Test
    @DisplayName("Attack stats follow the chosen style and damage type")
    void attackStats() {
        SkillSet skills = new SkillSet();
        skills.setLevel(SkillType.ATTACK, 40);
        PlayerCharacter hero = new PlayerCharacter("hero", skills, Vec2.ZERO);
        hero.setStyle(CombatStyle.DEFENSIVE);
        hero.setAttackType(DamageType.MAGIC);

        CombatantStats stats = hero.getAttackStats();

        assertEquals(40, stats.getAttackLevel());
        assertEquals(CombatStyle.DEFENSIVE, stats.getStyle());
        assertEquals(DamageType.MAGIC, stats.getDamageType());

        hero.setStyle(null);
        assertEquals(CombatStyle.ACCURATE, hero.getStyle());
    }

    @Test
    @DisplayName("Max hitpoints follow the Hitpoints level")
    void hitpointsFollowLevel() {
        SkillSet skills = new SkillSet();
        PlayerCharacter hero = new PlayerCharacter("hero", skills, Vec2.ZERO);
        assertEquals(10, hero.getMaxHp());

        skills.setLevel(SkillType.HITPOINTS, 20);
        assertEquals(20, hero.getMaxHp());
        assertEquals(10, hero.getCurrentHp());

        hero.restoreHitpoints();
        assertEquals(20, hero.getCurrentHp());
    }

    @Test
    @DisplayName("Damage and healing")
    void damageAndHeal() {
        PlayerCharacter hero = new PlayerCharacter("hero", new SkillSet(), Vec2.ZERO);

        assertEquals(7, hero.applyDamage(7, DamageType.MELEE, null));
        assertEquals(3, hero.getCurrentHp());
        assertEquals(5, hero.heal(5));
        assertEquals(8, hero.getCurrentHp());
        assertEquals(8, hero.applyDamage(50, DamageType.MELEE, null));
        assertFalse(hero.isAlive());
    }
}
