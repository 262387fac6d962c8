package com.example.skirmish.combat;

/**
 * Observer for a {@link CombatTarget}'s health. For any one hit,
 * {@link #onHealthChanged} is always delivered before {@link #onDeath}.
 */
public interface HealthListener {

    void onHealthChanged(CombatTarget target, int currentHp, int maxHp);

    /**
     * Fired exactly once per life, when hitpoints first reach zero.
     * @param killer whoever dealt the final hit, or null if unknown
     */
    default void onDeath(CombatTarget target, CombatTarget killer) {
    }
}
