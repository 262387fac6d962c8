package com.example.skirmish.model;

/**
 * Faction or clan an NPC belongs to. NEUTRAL is friendly with every faction;
 * the goblin clans are mutual enemies.
 */
public enum Faction {
    NEUTRAL,
    GOBLIN_GREEN,
    GOBLIN_RED;

    // [mine][other] => hostile
    private static final boolean[][] HOSTILITY = {
        //               NEUTRAL, GREEN, RED
        /* NEUTRAL */  { false,   false, false },
        /* GREEN   */  { false,   false, true  },
        /* RED     */  { false,   true,  false },
    };

    public boolean isEnemy(Faction other) {
        if (other == null) return false;
        return HOSTILITY[ordinal()][other.ordinal()];
    }

    public static boolean areEnemies(Faction a, Faction b) {
        return a != null && a.isEnemy(b);
    }

    public static Faction fromString(String str) {
        if (str == null || str.isEmpty()) return NEUTRAL;
        try {
            return Faction.valueOf(str.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return NEUTRAL;
        }
    }
}
