package com.example.skirmish.player;

import com.example.skirmish.combat.ExperienceSink;
import com.example.skirmish.combat.SkillProvider;
import com.example.skirmish.model.SkillType;
import com.example.skirmish.util.ExperienceTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A character's skills. Levels are derived from XP; Hitpoints starts at level 10.
 */
public class SkillSet implements SkillProvider, ExperienceSink {

    private static final Logger logger = LoggerFactory.getLogger(SkillSet.class);

    public static final int STARTING_HITPOINTS_LEVEL = 10;

    /** Notified whenever a skill's level changes. */
    @FunctionalInterface
    public interface LevelListener {
        void onLevelChanged(SkillType skill, int newLevel);
    }

    private final Map<SkillType, Double> xp = new EnumMap<>(SkillType.class);
    private final Map<SkillType, Integer> levels = new EnumMap<>(SkillType.class);
    private final List<LevelListener> listeners = new CopyOnWriteArrayList<>();

    public SkillSet() {
        for (SkillType s : SkillType.values()) {
            xp.put(s, 0.0);
            levels.put(s, 1);
        }
        setLevel(SkillType.HITPOINTS, STARTING_HITPOINTS_LEVEL);
    }

    @Override
    public synchronized int getLevel(SkillType skill) {
        Integer l = levels.get(skill);
        return l != null ? l : 1;
    }

    public synchronized double getXp(SkillType skill) {
        Double v = xp.get(skill);
        return v != null ? v : 0.0;
    }

    @Override
    public void addXp(SkillType skill, double amount) {
        if (skill == null || amount <= 0) return;
        int oldLevel;
        int newLevel;
        synchronized (this) {
            double total = getXp(skill) + amount;
            xp.put(skill, total);
            oldLevel = getLevel(skill);
            newLevel = ExperienceTable.levelForXp(total);
            levels.put(skill, newLevel);
        }
        if (newLevel != oldLevel) {
            logger.info("[SkillSet] {} level {} -> {}", skill, oldLevel, newLevel);
            fireLevelChanged(skill, newLevel);
        }
    }

    /** Jump straight to a level, setting XP to that level's threshold. */
    public void setLevel(SkillType skill, int level) {
        int clamped = Math.max(1, Math.min(ExperienceTable.MAX_LEVEL, level));
        synchronized (this) {
            xp.put(skill, (double) ExperienceTable.xpForLevel(clamped));
            levels.put(skill, clamped);
        }
        fireLevelChanged(skill, clamped);
    }

    public void addLevelListener(LevelListener l) {
        if (l != null) listeners.add(l);
    }

    private void fireLevelChanged(SkillType skill, int level) {
        for (LevelListener l : listeners) {
            try {
                l.onLevelChanged(skill, level);
            } catch (Exception e) {
                logger.warn("[SkillSet] Level listener failed: {}", e.getMessage(), e);
            }
        }
    }
}
