package com.example.skirmish.combat;

/**
 * Receives the visible side of an attack loop: target changes, resolved attacks
 * with their facing, kills and session ends.
 */
public interface AttackListener {

    default void onTargetChanged(CombatTarget previous, CombatTarget current) {
    }

    default void onAttackResolved(CombatResult result, Facing facing) {
    }

    default void onTargetKilled(CombatTarget target) {
    }

    default void onSessionEnded(CombatTarget target, AttackSession.EndReason reason) {
    }
}
