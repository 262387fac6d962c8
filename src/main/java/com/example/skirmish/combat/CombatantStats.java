package com.example.skirmish.combat;

import com.example.skirmish.model.CombatStyle;
import com.example.skirmish.model.DamageType;
import com.example.skirmish.model.EquipmentBonuses;
import com.example.skirmish.model.NpcCombatProfile;
import com.example.skirmish.model.SkillType;

/**
 * Snapshot of one combatant's stats at the moment an attack is resolved.
 * Built fresh for every resolution and never cached.
 */
public final class CombatantStats {

    private final int attackLevel;
    private final int strengthLevel;
    private final int defenceLevel;
    private final EquipmentBonuses bonuses;
    private final CombatStyle style;
    private final DamageType damageType;
    private final double maxHitMultiplier;

    public CombatantStats(int attackLevel, int strengthLevel, int defenceLevel,
                          EquipmentBonuses bonuses, CombatStyle style, DamageType damageType) {
        this(attackLevel, strengthLevel, defenceLevel, bonuses, style, damageType, 1.0);
    }

    private CombatantStats(int attackLevel, int strengthLevel, int defenceLevel,
                           EquipmentBonuses bonuses, CombatStyle style, DamageType damageType,
                           double maxHitMultiplier) {
        this.attackLevel = Math.max(1, attackLevel);
        this.strengthLevel = Math.max(1, strengthLevel);
        this.defenceLevel = Math.max(1, defenceLevel);
        this.bonuses = bonuses != null ? bonuses : EquipmentBonuses.NONE;
        this.style = style != null ? style : CombatStyle.ACCURATE;
        this.damageType = damageType != null ? damageType : DamageType.MELEE;
        this.maxHitMultiplier = maxHitMultiplier > 0 ? maxHitMultiplier : 1.0;
    }

    /**
     * Player stats from skill levels and equipped items. Missing providers count as
     * level 1 and no equipment.
     */
    public static CombatantStats forPlayer(SkillProvider skills, EquipmentProvider equipment,
                                           CombatStyle style, DamageType type) {
        int att = skills != null ? skills.getLevel(SkillType.ATTACK) : 1;
        int str = skills != null ? skills.getLevel(SkillType.STRENGTH) : 1;
        int def = skills != null ? skills.getLevel(SkillType.DEFENCE) : 1;
        EquipmentBonuses bonuses = equipment != null ? equipment.getCombinedBonuses() : EquipmentBonuses.NONE;
        return new CombatantStats(att, str, def, bonuses, style, type);
    }

    public static CombatantStats forNpc(NpcCombatProfile profile) {
        if (profile == null) return fallback(DamageType.MELEE);
        EquipmentBonuses bonuses = new EquipmentBonuses(0, 0, 0, 0,
            profile.getMeleeDefence(), profile.getRangeDefence(), profile.getMagicDefence(),
            profile.getAttackSpeedTicks());
        return new CombatantStats(profile.getAttackLevel(), profile.getStrengthLevel(), profile.getDefenceLevel(),
            bonuses, profile.getStyle(), profile.getAttackType());
    }

    /** Level 1 defensive stand-in for targets with nothing better to offer. */
    public static CombatantStats fallback(DamageType type) {
        return new CombatantStats(1, 1, 1, EquipmentBonuses.NONE, CombatStyle.DEFENSIVE, type);
    }

    public CombatantStats withMaxHitMultiplier(double multiplier) {
        return new CombatantStats(attackLevel, strengthLevel, defenceLevel, bonuses, style, damageType, multiplier);
    }

    public CombatantStats withDamageType(DamageType type) {
        return new CombatantStats(attackLevel, strengthLevel, defenceLevel, bonuses, style, type, maxHitMultiplier);
    }

    public int getAttackLevel() { return attackLevel; }
    public int getStrengthLevel() { return strengthLevel; }
    public int getDefenceLevel() { return defenceLevel; }
    public EquipmentBonuses getBonuses() { return bonuses; }
    public CombatStyle getStyle() { return style; }
    public DamageType getDamageType() { return damageType; }
    public double getMaxHitMultiplier() { return maxHitMultiplier; }
    public int getAttackSpeedTicks() { return bonuses.getAttackSpeedTicks(); }

    @Override
    public String toString() {
        return "CombatantStats[att=" + attackLevel + " str=" + strengthLevel + " def=" + defenceLevel
            + " style=" + style + " type=" + damageType + " " + bonuses + "]";
    }
}
