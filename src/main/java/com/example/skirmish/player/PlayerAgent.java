package com.example.skirmish.player;

import com.example.skirmish.combat.CombatMath;
import com.example.skirmish.combat.CombatTarget;
import com.example.skirmish.combat.GuardResponder;
import com.example.skirmish.config.CombatConfig;
import com.example.skirmish.pet.PetAgent;
import com.example.skirmish.util.Tickable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Ties the player to their attack loop and active pet.
 *
 * With guard mode on, the pet joins whatever fight the player starts and
 * answers the first swing any NPC takes at the player.
 */
public class PlayerAgent implements Tickable, GuardResponder {

    private static final Logger logger = LoggerFactory.getLogger(PlayerAgent.class);

    private final PlayerCharacter player;
    private final PlayerAttackController controller;
    private volatile PetAgent activePet;
    private volatile boolean guardMode;

    public PlayerAgent(PlayerCharacter player, CombatMath math, CombatConfig config) {
        this.player = Objects.requireNonNull(player, "player");
        this.controller = new PlayerAttackController(player, math, config);
    }

    @Override
    public void onTick(long tick) {
        controller.onTick(tick);
    }

    /**
     * Player clicked {@code target}.
     * @return true if an attack started
     */
    public boolean attack(CombatTarget target) {
        boolean started = controller.tryAttackTarget(target);
        PetAgent pet = activePet;
        if (started && guardMode && pet != null) {
            pet.commandAttack(target);
        }
        return started;
    }

    @Override
    public void onFirstAttack(CombatTarget victim, CombatTarget attacker) {
        PetAgent pet = activePet;
        if (victim != player || !guardMode || pet == null || !pet.canFight()) return;
        if (attacker == null || !attacker.isAlive()) return;
        logger.debug("[PlayerAgent] guard mode: {} retaliates against {}", pet.getDefinition().getDisplayName(),
            attacker.getName());
        pet.commandAttack(attacker);
    }

    public void setActivePet(PetAgent pet) {
        this.activePet = pet;
    }

    public PetAgent getActivePet() {
        return activePet;
    }

    public boolean isGuardMode() {
        return guardMode;
    }

    public void setGuardMode(boolean guardMode) {
        this.guardMode = guardMode;
    }

    public boolean toggleGuardMode() {
        guardMode = !guardMode;
        return guardMode;
    }

    public PlayerCharacter getPlayer() { return player; }
    public PlayerAttackController getController() { return controller; }
}
