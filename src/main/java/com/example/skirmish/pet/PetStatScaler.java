package com.example.skirmish.pet;

import com.example.skirmish.combat.CombatantStats;
import com.example.skirmish.config.CombatConfig;
import com.example.skirmish.model.CombatStyle;
import com.example.skirmish.model.DamageType;
import com.example.skirmish.model.EquipmentBonuses;
import com.example.skirmish.model.PetDefinition;

/**
 * Attack stats for a pet: the definition's levels and bonuses, scaled by the
 * pet-level multiplier tier and then by the owner's Beastmaster level.
 */
public final class PetStatScaler {

    private PetStatScaler() {
    }

    public static CombatantStats scale(PetDefinition def, int petLevel, int beastmasterLevel, CombatConfig config) {
        double mult = config.petStatMultiplier(petLevel);
        int attack = round(def.getAttackLevel() * mult);
        int strength = round(def.getStrengthLevel() * mult);
        int accuracy = round(def.getAccuracyBonus() * mult);
        int damage = round(def.getDamageBonus() * mult);

        int bm = Math.max(1, beastmasterLevel);
        if (def.getAttackLevelPerBeastmasterLevel() != 0) {
            attack = round(attack * (1.0 + def.getAttackLevelPerBeastmasterLevel() * bm));
        }
        if (def.getStrengthLevelPerBeastmasterLevel() != 0) {
            strength = round(strength * (1.0 + def.getStrengthLevelPerBeastmasterLevel() * bm));
        }

        EquipmentBonuses bonuses = new EquipmentBonuses(accuracy, damage, 0, 0, 0, 0, 0, def.getAttackSpeedTicks());
        CombatantStats stats = new CombatantStats(attack, strength, 1, bonuses, CombatStyle.ACCURATE, DamageType.MELEE);
        if (def.getMaxHitPerBeastmasterLevel() != 0) {
            stats = stats.withMaxHitMultiplier(1.0 + def.getMaxHitPerBeastmasterLevel() * bm);
        }
        return stats;
    }

    private static int round(double v) {
        return (int) Math.rint(v);
    }
}
