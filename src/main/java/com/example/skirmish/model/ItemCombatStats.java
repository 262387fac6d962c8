package com.example.skirmish.model;

/**
 * Combat bonuses carried by a single equippable item.
 * Attack speed is expressed in ticks and only matters for the weapon slot.
 */
public class ItemCombatStats {

    public static final int DEFAULT_ATTACK_SPEED_TICKS = 4;

    private final int attack;
    private final int strength;
    private final int range;
    private final int magic;
    private final int meleeDefence;
    private final int rangeDefence;
    private final int magicDefence;
    private final int attackSpeedTicks;   // 0 = not a weapon / use default

    public ItemCombatStats(int attack, int strength, int range, int magic,
                           int meleeDefence, int rangeDefence, int magicDefence,
                           int attackSpeedTicks) {
        this.attack = attack;
        this.strength = strength;
        this.range = range;
        this.magic = magic;
        this.meleeDefence = meleeDefence;
        this.rangeDefence = rangeDefence;
        this.magicDefence = magicDefence;
        this.attackSpeedTicks = attackSpeedTicks;
    }

    /**
     * A weapon with only offensive bonuses.
     */
    public static ItemCombatStats weapon(int attack, int strength, int attackSpeedTicks) {
        return new ItemCombatStats(attack, strength, 0, 0, 0, 0, 0, attackSpeedTicks);
    }

    /**
     * A piece of armour with only defensive bonuses.
     */
    public static ItemCombatStats armour(int meleeDefence, int rangeDefence, int magicDefence) {
        return new ItemCombatStats(0, 0, 0, 0, meleeDefence, rangeDefence, magicDefence, 0);
    }

    public int getAttack() { return attack; }
    public int getStrength() { return strength; }
    public int getRange() { return range; }
    public int getMagic() { return magic; }
    public int getMeleeDefence() { return meleeDefence; }
    public int getRangeDefence() { return rangeDefence; }
    public int getMagicDefence() { return magicDefence; }
    public int getAttackSpeedTicks() { return attackSpeedTicks; }
}
