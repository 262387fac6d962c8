package com.example.skirmish.pet;

import com.example.skirmish.combat.CombatTarget;
import com.example.skirmish.combat.CombatantStats;
import com.example.skirmish.combat.HealthListener;
import com.example.skirmish.model.DamageType;
import com.example.skirmish.model.Vec2;

import java.util.function.Supplier;

/**
 * Combat face of a pet. Pets cannot be hurt: they are always alive at 1/1 HP
 * and absorb every hit.
 */
public class PetCombatant implements CombatTarget {

    private final String name;
    private final Supplier<Vec2> position;

    public PetCombatant(String name, Supplier<Vec2> position) {
        this.name = name;
        this.position = position;
    }

    @Override
    public String getName() { return name; }

    @Override
    public Vec2 getPosition() { return position.get(); }

    @Override
    public boolean isAlive() { return true; }

    @Override
    public int getCurrentHp() { return 1; }

    @Override
    public int getMaxHp() { return 1; }

    @Override
    public DamageType getPreferredDefenceType() { return DamageType.MELEE; }

    @Override
    public CombatantStats getDefenceStats(DamageType incoming) {
        return CombatantStats.fallback(DamageType.MELEE);
    }

    @Override
    public int applyDamage(int amount, DamageType type, CombatTarget source) {
        return 0;
    }

    // hitpoints never change, so there is nothing to observe
    @Override
    public void addHealthListener(HealthListener listener) {
    }

    @Override
    public void removeHealthListener(HealthListener listener) {
    }

    @Override
    public String toString() {
        return name;
    }
}
