package com.example.skirmish.combat;

/**
 * Movement side of an attacking agent, driven by its {@link AttackController}.
 */
public interface CombatMovement {

    /** Start chasing the target. */
    void enterCombat(CombatTarget target);

    /** Called each tick of a session with whether the target is in melee range. */
    void setInMeleeRange(boolean inRange);

    /**
     * Stop chasing.
     * @param returnHome walk back to the origin instead of going idle in place
     */
    void exitCombat(boolean returnHome);

    /** False when the movement can never bring the agent within melee range of {@code target}. */
    default boolean canReach(CombatTarget target) {
        return true;
    }
}
