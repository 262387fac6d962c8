package com.example.skirmish.combat;

/**
 * Raw outcome of {@link CombatMath#roll}, before damage is applied to anyone.
 */
public final class CombatRoll {

    private final boolean hit;
    private final int damage;
    private final int maxHit;
    private final double chance;
    private final int attackRoll;
    private final int defenceRoll;

    public CombatRoll(boolean hit, int damage, int maxHit, double chance, int attackRoll, int defenceRoll) {
        this.hit = hit;
        this.damage = damage;
        this.maxHit = maxHit;
        this.chance = chance;
        this.attackRoll = attackRoll;
        this.defenceRoll = defenceRoll;
    }

    public boolean isHit() { return hit; }
    public int getDamage() { return damage; }
    public int getMaxHit() { return maxHit; }
    public double getChance() { return chance; }
    public int getAttackRoll() { return attackRoll; }
    public int getDefenceRoll() { return defenceRoll; }
}
