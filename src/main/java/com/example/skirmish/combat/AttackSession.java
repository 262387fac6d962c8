package com.example.skirmish.combat;

/**
 * One attacker's ongoing attack loop against a single target.
 * A controller holds at most one of these at a time.
 */
public class AttackSession {

    public enum EndReason {
        TARGET_DIED,
        ATTACKER_DIED,
        OUT_OF_RANGE,
        LEASHED,
        CANCELLED,
        SUPERSEDED
    }

    private final CombatTarget attacker;
    private final CombatTarget target;
    private final long startedAtTick;
    private int cooldownRemainingTicks;
    private int attacksResolved;

    AttackSession(CombatTarget attacker, CombatTarget target, long startedAtTick, int cooldownRemainingTicks) {
        this.attacker = attacker;
        this.target = target;
        this.startedAtTick = startedAtTick;
        this.cooldownRemainingTicks = Math.max(0, cooldownRemainingTicks);
    }

    public CombatTarget getAttacker() { return attacker; }
    public CombatTarget getTarget() { return target; }
    public long getStartedAtTick() { return startedAtTick; }
    public int getCooldownRemainingTicks() { return cooldownRemainingTicks; }
    public int getAttacksResolved() { return attacksResolved; }

    public boolean isWaiting() {
        return cooldownRemainingTicks > 0;
    }

    /** Count down one tick; true while the wait is still running. */
    boolean tickCooldown() {
        if (cooldownRemainingTicks > 0) cooldownRemainingTicks--;
        return cooldownRemainingTicks > 0;
    }

    void startCooldown(int ticks) {
        cooldownRemainingTicks = Math.max(0, ticks);
    }

    void recordAttack() {
        attacksResolved++;
    }

    @Override
    public String toString() {
        return "AttackSession[" + (attacker != null ? attacker.getName() : "?") + " -> "
            + (target != null ? target.getName() : "?") + ", cooldown=" + cooldownRemainingTicks + "]";
    }
}
