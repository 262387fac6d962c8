package com.example.skirmish.combat;

/**
 * Told when an NPC swings at a target for the first time in an engagement.
 */
@FunctionalInterface
public interface GuardResponder {
    void onFirstAttack(CombatTarget victim, CombatTarget attacker);
}
