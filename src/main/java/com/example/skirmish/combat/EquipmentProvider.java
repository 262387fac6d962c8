package com.example.skirmish.combat;

import com.example.skirmish.model.EquipmentBonuses;

/**
 * Source of the combined bonuses of whatever is currently equipped.
 */
@FunctionalInterface
public interface EquipmentProvider {
    EquipmentBonuses getCombinedBonuses();
}
