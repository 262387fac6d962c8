package com.example.skirmish.model;

/**
 * Types of damage that can be dealt in combat.
 */
public enum DamageType {
    MELEE,
    RANGED,
    MAGIC,
    BURN,
    POISON;

    /**
     * Parse a damage type from a string, case-insensitive.
     */
    public static DamageType fromString(String str) {
        if (str == null || str.isEmpty()) return null;
        try {
            return DamageType.valueOf(str.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
