package com.example.skirmish.npc;

import com.example.skirmish.combat.AttackController;
import com.example.skirmish.combat.CombatTarget;
import com.example.skirmish.combat.CombatantStats;
import com.example.skirmish.combat.HealthListener;
import com.example.skirmish.combat.Hitpoints;
import com.example.skirmish.model.DamageType;
import com.example.skirmish.model.Faction;
import com.example.skirmish.model.NpcCombatProfile;
import com.example.skirmish.model.Vec2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Combat face of a spawned NPC. Max HP is the profile's hitpoints level.
 * When hit by someone it fights back through its counter-attacker.
 */
public class NpcCombatant implements CombatTarget {

    private static final Logger logger = LoggerFactory.getLogger(NpcCombatant.class);

    private final String name;
    private final NpcCombatProfile profile;
    private final Supplier<Vec2> position;
    private final Hitpoints hitpoints;
    private AttackController counterAttacker;

    public NpcCombatant(String name, NpcCombatProfile profile, Supplier<Vec2> position) {
        this.profile = Objects.requireNonNull(profile, "profile");
        this.position = Objects.requireNonNull(position, "position");
        this.name = name != null ? name : profile.getName();
        this.hitpoints = new Hitpoints(this, profile.getHitpointsLevel());
    }

    public void setCounterAttacker(AttackController counterAttacker) {
        this.counterAttacker = counterAttacker;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Vec2 getPosition() {
        return position.get();
    }

    @Override
    public boolean isAlive() {
        return hitpoints.isAlive();
    }

    @Override
    public int getCurrentHp() {
        return hitpoints.getCurrent();
    }

    @Override
    public int getMaxHp() {
        return hitpoints.getMax();
    }

    @Override
    public DamageType getPreferredDefenceType() {
        return profile.getAttackType();
    }

    @Override
    public CombatantStats getDefenceStats(DamageType incoming) {
        return CombatantStats.forNpc(profile);
    }

    @Override
    public int applyDamage(int amount, DamageType type, CombatTarget source) {
        if (!isAlive()) return 0;
        int applied = hitpoints.applyDamage(amount, source);
        logger.debug("[NpcCombatant] {} took {} {} damage ({} / {})", name, applied, type,
            hitpoints.getCurrent(), hitpoints.getMax());
        if (source != null && source != this && isAlive() && source.isAlive() && counterAttacker != null) {
            counterAttacker.beginAttacking(source);
        }
        return applied;
    }

    /** Back to full health for a new life. */
    public void respawn() {
        hitpoints.restore();
    }

    @Override
    public void addHealthListener(HealthListener listener) {
        hitpoints.addListener(listener);
    }

    @Override
    public void removeHealthListener(HealthListener listener) {
        hitpoints.removeListener(listener);
    }

    public NpcCombatProfile getProfile() {
        return profile;
    }

    public Faction getFaction() {
        return profile.getFaction();
    }

    @Override
    public String toString() {
        return name;
    }
}
