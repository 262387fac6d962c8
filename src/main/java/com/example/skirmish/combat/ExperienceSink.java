package com.example.skirmish.combat;

import com.example.skirmish.model.SkillType;

/**
 * Receives experience awarded by combat.
 */
@FunctionalInterface
public interface ExperienceSink {
    void addXp(SkillType skill, double amount);
}
