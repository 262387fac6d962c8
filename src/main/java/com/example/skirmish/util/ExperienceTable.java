package com.example.skirmish.util;

/**
 * Level/experience lookup for skills and pets (levels 1-99).
 */
public final class ExperienceTable {

    public static final int MAX_LEVEL = 99;

    private static final int[] XP_FOR_LEVEL = new int[MAX_LEVEL + 1];

    static {
        double points = 0;
        XP_FOR_LEVEL[1] = 0;
        for (int lvl = 1; lvl < MAX_LEVEL; lvl++) {
            points += Math.floor(lvl + 300.0 * Math.pow(2.0, lvl / 7.0));
            XP_FOR_LEVEL[lvl + 1] = (int) Math.floor(points / 4.0);
        }
    }

    private ExperienceTable() {
    }

    /** Total XP needed to reach the given level. Level is clamped to 1-99. */
    public static int xpForLevel(int level) {
        if (level <= 1) return 0;
        if (level >= MAX_LEVEL) return XP_FOR_LEVEL[MAX_LEVEL];
        return XP_FOR_LEVEL[level];
    }

    /** Highest level whose XP threshold is at or below {@code xp}. */
    public static int levelForXp(double xp) {
        for (int lvl = MAX_LEVEL; lvl > 1; lvl--) {
            if (xp >= XP_FOR_LEVEL[lvl]) return lvl;
        }
        return 1;
    }
}
