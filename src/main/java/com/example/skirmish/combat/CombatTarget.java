package com.example.skirmish.combat;

import com.example.skirmish.model.DamageType;
import com.example.skirmish.model.Vec2;

/**
 * Anything that can be attacked: the player, an NPC or a pet.
 *
 * Hitpoints are only ever changed through {@link #applyDamage}; the owning
 * implementation keeps {@code 0 <= currentHp <= maxHp}.
 */
public interface CombatTarget {

    String getName();

    Vec2 getPosition();

    boolean isAlive();

    int getCurrentHp();

    int getMaxHp();

    /** Damage type used to pick a defence bonus when nothing better is known. */
    DamageType getPreferredDefenceType();

    /**
     * Snapshot used when this target defends against an attack of the given type.
     */
    CombatantStats getDefenceStats(DamageType incoming);

    /**
     * Subtract damage from current hitpoints, clamped at zero.
     * @param source the attacker, may be null
     * @return the amount actually removed, never negative
     */
    int applyDamage(int amount, DamageType type, CombatTarget source);

    void addHealthListener(HealthListener listener);

    void removeHealthListener(HealthListener listener);
}
