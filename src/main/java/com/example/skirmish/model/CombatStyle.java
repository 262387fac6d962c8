package com.example.skirmish.model;

/**
 * Melee combat styles. The style decides which effective level gets the style bonus
 * and which skill receives combat experience.
 */
public enum CombatStyle {

    /** Boosts effective attack */
    ACCURATE("Accurate"),

    /** Boosts effective strength */
    AGGRESSIVE("Aggressive"),

    /** Boosts effective defence */
    DEFENSIVE("Defensive"),

    /** Small boost to attack, strength and defence */
    CONTROLLED("Controlled");

    private final String displayName;

    CombatStyle(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static CombatStyle fromString(String str) {
        if (str == null || str.isEmpty()) return null;
        try {
            return CombatStyle.valueOf(str.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
