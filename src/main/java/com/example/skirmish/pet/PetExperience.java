package com.example.skirmish.pet;

import com.example.skirmish.model.EvolutionTier;
import com.example.skirmish.model.PetDefinition;
import com.example.skirmish.util.ExperienceTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.IntConsumer;

/**
 * XP and level of one pet, plus the evolution tier that level unlocks.
 */
public class PetExperience {

    private static final Logger logger = LoggerFactory.getLogger(PetExperience.class);

    private final PetDefinition definition;
    private final List<IntConsumer> levelListeners = new CopyOnWriteArrayList<>();
    private double xp;
    private int level = 1;

    public PetExperience(PetDefinition definition) {
        this(definition, 0.0);
    }

    public PetExperience(PetDefinition definition, double startingXp) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.xp = Math.max(0.0, startingXp);
        this.level = ExperienceTable.levelForXp(this.xp);
    }

    public void addXp(double amount) {
        if (amount <= 0 || level >= ExperienceTable.MAX_LEVEL) return;
        xp += amount;
        int newLevel = ExperienceTable.levelForXp(xp);
        if (newLevel != level) {
            level = newLevel;
            logger.info("[PetExperience] {} reached level {}", definition.getDisplayName(), level);
            for (IntConsumer l : levelListeners) {
                try {
                    l.accept(level);
                } catch (Exception e) {
                    logger.warn("[PetExperience] Level listener failed: {}", e.getMessage(), e);
                }
            }
        }
    }

    public int getXpToNextLevel() {
        if (level >= ExperienceTable.MAX_LEVEL) return 0;
        return ExperienceTable.xpForLevel(level + 1) - (int) Math.floor(xp);
    }

    /** Highest evolution tier reached, or null before the first one. */
    public EvolutionTier getCurrentTier() {
        EvolutionTier current = null;
        for (EvolutionTier t : definition.getEvolutionTiers()) {
            if (level >= t.getLevel()) current = t;
        }
        return current;
    }

    public String getTierName() {
        EvolutionTier t = getCurrentTier();
        return t != null ? t.getTierName() : "";
    }

    public double getScale() {
        EvolutionTier t = getCurrentTier();
        return t != null ? t.getScale() : 1.0;
    }

    public void addLevelListener(IntConsumer listener) {
        if (listener != null) levelListeners.add(listener);
    }

    public double getXp() { return xp; }
    public int getLevel() { return level; }
    public PetDefinition getDefinition() { return definition; }
}
