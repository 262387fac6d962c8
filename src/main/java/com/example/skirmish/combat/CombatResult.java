package com.example.skirmish.combat;

/**
 * Result of one resolved attack, as reported to attack listeners.
 */
public class CombatResult {

    /** The type of result */
    private final ResultType type;

    /** Damage actually removed from the target (0 on a miss) */
    private final int damage;

    /** The attacker */
    private final CombatTarget attacker;

    /** The target */
    private final CombatTarget target;

    /** Roll values for display */
    private int maxHit;
    private int attackRoll;
    private int defenceRoll;
    private double chance;

    public enum ResultType {
        HIT,            // Landed, target survived
        MISS,           // Accuracy roll failed
        KILL            // Landed and the target died
    }

    private CombatResult(ResultType type, int damage, CombatTarget attacker, CombatTarget target) {
        this.type = type;
        this.damage = damage;
        this.attacker = attacker;
        this.target = target;
    }

    public static CombatResult hit(CombatTarget attacker, CombatTarget target, int damage) {
        return new CombatResult(ResultType.HIT, damage, attacker, target);
    }

    public static CombatResult miss(CombatTarget attacker, CombatTarget target) {
        return new CombatResult(ResultType.MISS, 0, attacker, target);
    }

    public static CombatResult kill(CombatTarget attacker, CombatTarget target, int finalDamage) {
        return new CombatResult(ResultType.KILL, finalDamage, attacker, target);
    }

    /** Build the result for a roll whose damage has already been applied. */
    static CombatResult from(CombatTarget attacker, CombatTarget target, CombatRoll roll, int applied) {
        CombatResult r;
        if (!roll.isHit()) {
            r = miss(attacker, target);
        } else if (!target.isAlive()) {
            r = kill(attacker, target, applied);
        } else {
            r = hit(attacker, target, applied);
        }
        r.maxHit = roll.getMaxHit();
        r.attackRoll = roll.getAttackRoll();
        r.defenceRoll = roll.getDefenceRoll();
        r.chance = roll.getChance();
        return r;
    }

    public ResultType getType() { return type; }
    public int getDamage() { return damage; }
    public CombatTarget getAttacker() { return attacker; }
    public CombatTarget getTarget() { return target; }

    public int getMaxHit() { return maxHit; }
    public int getAttackRoll() { return attackRoll; }
    public int getDefenceRoll() { return defenceRoll; }
    public double getChance() { return chance; }

    public boolean isHit() { return type == ResultType.HIT || type == ResultType.KILL; }
    public boolean isMiss() { return type == ResultType.MISS; }
    public boolean isKill() { return type == ResultType.KILL; }

    @Override
    public String toString() {
        String attackerName = attacker != null ? attacker.getName() : "?";
        String targetName = target != null ? target.getName() : "?";
        return String.format("CombatResult[%s %s -> %s, damage=%d, max=%d]",
            type, attackerName, targetName, damage, maxHit);
    }
}
