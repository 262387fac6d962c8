package com.example.skirmish.model;

/**
 * Skills that feed into or are trained by combat.
 */
public enum SkillType {
    ATTACK,
    STRENGTH,
    DEFENCE,
    HITPOINTS,
    BEASTMASTER
}
