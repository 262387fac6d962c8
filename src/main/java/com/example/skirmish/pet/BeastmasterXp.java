package com.example.skirmish.pet;

import com.example.skirmish.config.CombatConfig;
import com.example.skirmish.model.SkillType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Splits experience from a pet's damage between the owner's Beastmaster skill
 * and the pet itself.
 */
public class BeastmasterXp {

    private static final Logger logger = LoggerFactory.getLogger(BeastmasterXp.class);

    private final CombatConfig config;

    public BeastmasterXp(CombatConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public void grantFromPetDamage(PetOwner owner, PetExperience pet, int damage) {
        if (damage <= 0) return;
        if (pet != null) {
            pet.addXp(damage * config.getBeastmasterPetXpPerDamage());
        }
        if (owner == null) return;
        double xp = damage * config.getBeastmasterXpPerDamage();
        owner.addXp(SkillType.BEASTMASTER, xp);
        logger.debug("[BeastmasterXp] {} gains {} Beastmaster xp", owner.getName(), xp);
    }

    /** Hook for one pet, ready to hand to its attack controller. */
    public PetDamageHook hookFor(PetExperience pet) {
        return (owner, damage) -> grantFromPetDamage(owner, pet, damage);
    }
}
