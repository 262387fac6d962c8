package com.example.skirmish.pet;

import com.example.skirmish.combat.AttackController;
import com.example.skirmish.combat.CombatMath;
import com.example.skirmish.combat.CombatResult;
import com.example.skirmish.combat.CombatTarget;
import com.example.skirmish.combat.CombatantStats;
import com.example.skirmish.config.CombatConfig;
import com.example.skirmish.model.PetDefinition;
import com.example.skirmish.model.SkillType;

import java.util.Objects;

/**
 * Pet attack loop. Only pets that can fight will engage, and a pet lets go of a
 * target that gets farther away than the leash range.
 */
public class PetAttackController extends AttackController {

    private final PetDefinition definition;
    private final PetExperience experience;
    private final PetOwner owner;
    private PetDamageHook damageHook;

    public PetAttackController(PetCombatant pet, PetDefinition definition, PetExperience experience,
                               PetOwner owner, CombatMath math, CombatConfig config) {
        super(pet, math, config);
        this.definition = Objects.requireNonNull(definition, "definition");
        this.experience = Objects.requireNonNull(experience, "experience");
        this.owner = owner;
    }

    public void setDamageHook(PetDamageHook damageHook) {
        this.damageHook = damageHook;
    }

    @Override
    protected CombatantStats attackerStats(CombatTarget target) {
        int bm = owner != null ? owner.getLevel(SkillType.BEASTMASTER) : 1;
        return PetStatScaler.scale(definition, experience.getLevel(), bm, config);
    }

    @Override
    protected boolean canEngage(CombatTarget target) {
        return definition.canFight();
    }

    @Override
    protected boolean shouldDisengage(CombatTarget target) {
        return self.getPosition().distanceTo(target.getPosition()) > config.getPetLeashRange();
    }

    @Override
    protected void afterAttack(CombatResult result) {
        if (result.isHit() && result.getDamage() > 0 && damageHook != null) {
            damageHook.onPetDamage(owner, result.getDamage());
        }
    }
}
