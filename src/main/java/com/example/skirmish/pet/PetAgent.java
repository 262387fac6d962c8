package com.example.skirmish.pet;

import com.example.skirmish.behavior.BehaviorState;
import com.example.skirmish.combat.CombatMath;
import com.example.skirmish.combat.CombatTarget;
import com.example.skirmish.config.CombatConfig;
import com.example.skirmish.model.PetDefinition;
import com.example.skirmish.model.Vec2;
import com.example.skirmish.util.Tickable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * An active pet: follows its owner and, if it can fight, attacks on command.
 */
public class PetAgent implements Tickable {

    private static final Logger logger = LoggerFactory.getLogger(PetAgent.class);

    private final PetDefinition definition;
    private final PetCombatant combatant;
    private final PetFollower follower;
    private final PetExperience experience;
    private final PetAttackController controller;

    public PetAgent(PetDefinition definition, PetExperience experience, PetOwner owner, Vec2 start,
                    CombatMath math, CombatConfig config, BeastmasterXp beastmasterXp) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.experience = experience != null ? experience : new PetExperience(definition);
        double speed = definition.getMoveSpeed() > 0 ? definition.getMoveSpeed() : config.getPetMoveSpeed();
        this.follower = new PetFollower(owner, start, speed, config.getPetFollowDistance(),
            config.getMeleeRange(), config.getTickDurationMs());
        this.combatant = new PetCombatant(definition.getDisplayName(), follower::getPosition);
        this.controller = new PetAttackController(combatant, definition, this.experience, owner, math, config);
        this.controller.setMovement(follower);
        if (beastmasterXp != null) {
            controller.setDamageHook(beastmasterXp.hookFor(this.experience));
        }
    }

    @Override
    public void onTick(long tick) {
        controller.onTick(tick);
        follower.onTick(tick);
    }

    /**
     * Order the pet onto {@code target}. Ignored for pets that cannot fight and for
     * missing or dead targets; repeating the order for the current target changes nothing.
     */
    public boolean commandAttack(CombatTarget target) {
        if (target == null) return false;
        if (!definition.canFight()) {
            logger.debug("[PetAgent] {} cannot fight", definition.getDisplayName());
            return false;
        }
        return controller.commandAttack(target);
    }

    public boolean canFight() { return definition.canFight(); }
    public PetDefinition getDefinition() { return definition; }
    public PetCombatant getCombatant() { return combatant; }
    public PetFollower getFollower() { return follower; }
    public PetExperience getExperience() { return experience; }
    public PetAttackController getController() { return controller; }
    public BehaviorState getState() { return follower.getState(); }
    public Vec2 getPosition() { return follower.getPosition(); }
}
