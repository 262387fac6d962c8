package com.example.skirmish.model;

import java.util.Map;

/**
 * Combined combat bonuses of everything a combatant has equipped.
 * Immutable; build one with {@link #aggregate(Map)} or the constructor.
 */
public final class EquipmentBonuses {

    public static final EquipmentBonuses NONE =
        new EquipmentBonuses(0, 0, 0, 0, 0, 0, 0, ItemCombatStats.DEFAULT_ATTACK_SPEED_TICKS);

    private final int attack;
    private final int strength;
    private final int range;
    private final int magic;
    private final int meleeDefence;
    private final int rangeDefence;
    private final int magicDefence;
    private final int attackSpeedTicks;

    public EquipmentBonuses(int attack, int strength, int range, int magic,
                            int meleeDefence, int rangeDefence, int magicDefence,
                            int attackSpeedTicks) {
        this.attack = attack;
        this.strength = strength;
        this.range = range;
        this.magic = magic;
        this.meleeDefence = meleeDefence;
        this.rangeDefence = rangeDefence;
        this.magicDefence = magicDefence;
        this.attackSpeedTicks = attackSpeedTicks > 0 ? attackSpeedTicks : ItemCombatStats.DEFAULT_ATTACK_SPEED_TICKS;
    }

    /**
     * Sum the bonuses of all equipped items. Attack speed is taken from the weapon slot
     * and falls back to the default when no weapon (or a weapon without a speed) is worn.
     */
    public static EquipmentBonuses aggregate(Map<EquipmentSlot, ItemCombatStats> equipped) {
        if (equipped == null || equipped.isEmpty()) return NONE;

        int attack = 0, strength = 0, range = 0, magic = 0;
        int meleeDef = 0, rangeDef = 0, magicDef = 0;
        int speed = ItemCombatStats.DEFAULT_ATTACK_SPEED_TICKS;

        for (Map.Entry<EquipmentSlot, ItemCombatStats> e : equipped.entrySet()) {
            ItemCombatStats item = e.getValue();
            if (item == null) continue;
            attack += item.getAttack();
            strength += item.getStrength();
            range += item.getRange();
            magic += item.getMagic();
            meleeDef += item.getMeleeDefence();
            rangeDef += item.getRangeDefence();
            magicDef += item.getMagicDefence();
            if (e.getKey() == EquipmentSlot.WEAPON && item.getAttackSpeedTicks() > 0) {
                speed = item.getAttackSpeedTicks();
            }
        }
        return new EquipmentBonuses(attack, strength, range, magic, meleeDef, rangeDef, magicDef, speed);
    }

    /**
     * Defence bonus against an incoming damage type. Burn and poison use melee defence.
     */
    public int defenceAgainst(DamageType type) {
        if (type == DamageType.MAGIC) return magicDefence;
        if (type == DamageType.RANGED) return rangeDefence;
        return meleeDefence;
    }

    public EquipmentBonuses withAttackAndStrength(int newAttack, int newStrength) {
        return new EquipmentBonuses(newAttack, newStrength, range, magic,
            meleeDefence, rangeDefence, magicDefence, attackSpeedTicks);
    }

    public int getAttack() { return attack; }
    public int getStrength() { return strength; }
    public int getRange() { return range; }
    public int getMagic() { return magic; }
    public int getMeleeDefence() { return meleeDefence; }
    public int getRangeDefence() { return rangeDefence; }
    public int getMagicDefence() { return magicDefence; }
    public int getAttackSpeedTicks() { return attackSpeedTicks; }

    @Override
    public String toString() {
        return String.format("EquipmentBonuses[att=%d, str=%d, def=%d/%d/%d, speed=%d]",
            attack, strength, meleeDefence, rangeDefence, magicDefence, attackSpeedTicks);
    }
}
