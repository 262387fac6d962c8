package com.example.skirmish.combat;

import com.example.skirmish.model.SkillType;

/**
 * Source of skill levels for stat snapshots.
 */
@FunctionalInterface
public interface SkillProvider {
    int getLevel(SkillType skill);
}
