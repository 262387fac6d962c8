package com.example.skirmish.player;

import com.example.skirmish.combat.CombatTarget;
import com.example.skirmish.combat.CombatantStats;
import com.example.skirmish.combat.HealthListener;
import com.example.skirmish.combat.Hitpoints;
import com.example.skirmish.model.CombatStyle;
import com.example.skirmish.model.DamageType;
import com.example.skirmish.model.EquipmentBonuses;
import com.example.skirmish.model.EquipmentSlot;
import com.example.skirmish.model.ItemCombatStats;
import com.example.skirmish.model.SkillType;
import com.example.skirmish.model.Vec2;
import com.example.skirmish.pet.PetOwner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The player as seen by combat. Position is driven from outside (input and
 * movement are not simulated here). Max HP follows the Hitpoints level.
 */
public class PlayerCharacter implements CombatTarget, PetOwner {

    private static final Logger logger = LoggerFactory.getLogger(PlayerCharacter.class);

    private final String name;
    private final SkillSet skills;
    private final Hitpoints hitpoints;
    private final Map<EquipmentSlot, ItemCombatStats> equipped = new EnumMap<>(EquipmentSlot.class);

    private volatile Vec2 position;
    private volatile CombatStyle style = CombatStyle.ACCURATE;
    private volatile DamageType attackType = DamageType.MELEE;
    private volatile EquipmentBonuses bonuses = EquipmentBonuses.NONE;

    public PlayerCharacter(String name, SkillSet skills, Vec2 position) {
        this.name = Objects.requireNonNull(name, "name");
        this.skills = Objects.requireNonNull(skills, "skills");
        this.position = Objects.requireNonNull(position, "position");
        this.hitpoints = new Hitpoints(this, skills.getLevel(SkillType.HITPOINTS));
        skills.addLevelListener((skill, level) -> {
            if (skill == SkillType.HITPOINTS) hitpoints.setMax(level);
        });
    }

    // --- equipment ---

    public synchronized void equip(EquipmentSlot slot, ItemCombatStats item) {
        if (slot == null) return;
        if (item == null) equipped.remove(slot);
        else equipped.put(slot, item);
        bonuses = EquipmentBonuses.aggregate(equipped);
    }

    public synchronized void unequip(EquipmentSlot slot) {
        equip(slot, null);
    }

    public EquipmentBonuses getBonuses() {
        return bonuses;
    }

    /** Stats for this player's own swing, using the selected style. */
    public CombatantStats getAttackStats() {
        return CombatantStats.forPlayer(skills, this::getBonuses, style, attackType);
    }

    // --- CombatTarget ---

    @Override
    public String getName() { return name; }

    @Override
    public Vec2 getPosition() { return position; }

    public void setPosition(Vec2 position) {
        this.position = Objects.requireNonNull(position, "position");
    }

    @Override
    public boolean isAlive() { return hitpoints.isAlive(); }

    @Override
    public int getCurrentHp() { return hitpoints.getCurrent(); }

    @Override
    public int getMaxHp() { return hitpoints.getMax(); }

    @Override
    public DamageType getPreferredDefenceType() { return DamageType.MELEE; }

    @Override
    public CombatantStats getDefenceStats(DamageType incoming) {
        return CombatantStats.forPlayer(skills, this::getBonuses, style, incoming);
    }

    @Override
    public int applyDamage(int amount, DamageType type, CombatTarget source) {
        int applied = hitpoints.applyDamage(amount, source);
        if (applied > 0) {
            logger.debug("[PlayerCharacter] {} took {} from {} ({} / {})", name, applied,
                source != null ? source.getName() : "?", hitpoints.getCurrent(), hitpoints.getMax());
        }
        return applied;
    }

    public int heal(int amount) {
        return hitpoints.heal(amount);
    }

    /** Back to full health, e.g. after respawning at home. */
    public void restoreHitpoints() {
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

    // --- PetOwner ---

    @Override
    public int getLevel(SkillType skill) {
        return skills.getLevel(skill);
    }

    @Override
    public void addXp(SkillType skill, double amount) {
        skills.addXp(skill, amount);
    }

    public SkillSet getSkills() { return skills; }

    public CombatStyle getStyle() { return style; }

    public void setStyle(CombatStyle style) {
        this.style = style != null ? style : CombatStyle.ACCURATE;
    }

    public DamageType getAttackType() { return attackType; }

    public void setAttackType(DamageType attackType) {
        this.attackType = attackType != null ? attackType : DamageType.MELEE;
    }

    @Override
    public String toString() {
        return name;
    }
}
