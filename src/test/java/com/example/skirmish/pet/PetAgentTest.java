package com.example.skirmish.pet;

import com.example.skirmish.behavior.BehaviorState;
import com.example.skirmish.combat.AttackListener;
import com.example.skirmish.combat.AttackSession;
import com.example.skirmish.combat.CombatMath;
import com.example.skirmish.combat.CombatTarget;
import com.example.skirmish.combat.MaxRollRandom;
import com.example.skirmish.combat.StubTarget;
import com.example.skirmish.config.CombatConfig;
import com.example.skirmish.model.DamageType;
import com.example.skirmish.model.PetDefinition;
import com.example.skirmish.model.SkillType;
import com.example.skirmish.model.Vec2;
import com.example.skirmish.player.PlayerCharacter;
import com.example.skirmish.player.SkillSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Pets at 5 tiles/s with 600ms ticks (3 tiles per tick); leash range 7.5.
 */
@DisplayName("PetAgent Tests")
public class PetAgentTest {

    private CombatConfig config;
    private CombatMath math;
    private PlayerCharacter owner;
    private PetDefinition wolf;
    private long tick;

    @BeforeEach
    void setUp() {
        config = CombatConfig.defaults();
        math = new CombatMath(config, new MaxRollRandom());
        owner = new PlayerCharacter("owner", new SkillSet(), Vec2.ZERO);
        wolf = PetDefinition.builder("wolf_pup")
            .displayName("Wolf Pup").canFight(true)
            .attackLevel(10).strengthLevel(10).accuracyBonus(8).damageBonus(6)
            .maxHitPerBeastmasterLevel(0.005)
            .build();
        tick = 0;
    }

    private PetAgent newPet(PetDefinition def, Vec2 at) {
        return new PetAgent(def, new PetExperience(def), owner, at, math, config, new BeastmasterXp(config));
    }

    private void runTicks(PetAgent pet, int n) {
        for (int i = 0; i < n; i++) pet.onTick(++tick);
    }

    @Test
    @DisplayName("A null attack order is declined and the current fight goes on")
    void nullCommandKeepsSession() {
        PetAgent pet = newPet(wolf, Vec2.ZERO);
        StubTarget rat = new StubTarget("rat", 30, Vec2.of(1, 0));
        assertTrue(pet.commandAttack(rat));
        AttackSession session = pet.getController().getSession();

        assertFalse(pet.commandAttack(null));
        assertFalse(pet.getController().commandAttack(null));

        assertSame(session, pet.getController().getSession());
        runTicks(pet, 1);
        assertEquals(1, rat.getHitsTaken());
    }

    @Test
    @DisplayName("Commanding the same target twice produces one session")
    void doubleCommand() {
        PetAgent pet = newPet(wolf, Vec2.ZERO);
        StubTarget rat = new StubTarget("rat", 30, Vec2.of(1, 0));
        List<CombatTarget> changes = new ArrayList<>();
        pet.getController().addListener(new AttackListener() {
            @Override
            public void onTargetChanged(CombatTarget previous, CombatTarget current) {
                changes.add(current);
            }
        });

        assertTrue(pet.commandAttack(rat));
        AttackSession session = pet.getController().getSession();
        assertTrue(pet.commandAttack(rat));

        assertSame(session, pet.getController().getSession());
        assertEquals(1, changes.size());
        runTicks(pet, 1);
        assertEquals(1, rat.getHitsTaken());
    }

    @Test
    @DisplayName("Pets that cannot fight ignore attack commands")
    void nonFighter() {
        PetDefinition pebble = PetDefinition.builder("pebble").canFight(false).build();
        PetAgent pet = newPet(pebble, Vec2.ZERO);

        assertFalse(pet.commandAttack(new StubTarget("rat", 5, Vec2.of(1, 0))));
        assertFalse(pet.getController().isAttacking());
        assertFalse(pet.canFight());
    }

    @Test
    @DisplayName("Pet hits grant Beastmaster and pet XP")
    void damageGrantsXp() {
        PetAgent pet = newPet(wolf, Vec2.ZERO);
        StubTarget rat = new StubTarget("rat", 30, Vec2.of(1, 0));
        pet.commandAttack(rat);

        runTicks(pet, 1);

        assertEquals(29, rat.getCurrentHp());
        assertSame(pet.getCombatant(), rat.getLastSource());
        assertEquals(4.0, owner.getSkills().getXp(SkillType.BEASTMASTER), 1e-9);
        assertEquals(12.0, pet.getExperience().getXp(), 1e-9);
    }

    @Test
    @DisplayName("Pet chases its target to melee range")
    void chase() {
        PetAgent pet = newPet(wolf, Vec2.ZERO);
        StubTarget rat = new StubTarget("rat", 30, Vec2.of(5, 0));
        pet.commandAttack(rat);

        runTicks(pet, 1);
        assertEquals(BehaviorState.APPROACHING, pet.getState());
        assertEquals(3.0, pet.getPosition().getX(), 1e-9);

        runTicks(pet, 1);
        assertEquals(1.5, pet.getPosition().distanceTo(rat.getPosition()), 1e-9);
        runTicks(pet, 1);
        assertEquals(BehaviorState.ATTACKING, pet.getState());
        assertEquals(1, rat.getHitsTaken());
    }

    @Test
    @DisplayName("Pet lets go of targets beyond the leash range")
    void leash() {
        PetAgent pet = newPet(wolf, Vec2.ZERO);
        StubTarget rat = new StubTarget("rat", 30, Vec2.of(1, 0));
        pet.commandAttack(rat);
        runTicks(pet, 1);

        rat.setPosition(Vec2.of(10, 0));
        runTicks(pet, 1);

        assertFalse(pet.getController().isAttacking());
        assertFalse(pet.getState().isInCombat());
    }

    @Test
    @DisplayName("Out of combat the pet trails its owner")
    void followOwner() {
        PetAgent pet = newPet(wolf, Vec2.ZERO);
        owner.setPosition(Vec2.of(10, 0));

        runTicks(pet, 1);
        assertEquals(BehaviorState.WANDERING, pet.getState());
        assertEquals(3.0, pet.getPosition().getX(), 1e-9);

        runTicks(pet, 2);
        assertEquals(Vec2.of(9, 0), pet.getPosition());
        assertEquals(BehaviorState.IDLE, pet.getState());
    }

    @Test
    @DisplayName("Pets cannot be hurt")
    void invulnerable() {
        PetAgent pet = newPet(wolf, Vec2.ZERO);
        PetCombatant body = pet.getCombatant();

        assertEquals(0, body.applyDamage(50, DamageType.MELEE, null));
        assertTrue(body.isAlive());
        assertEquals(1, body.getCurrentHp());
        assertEquals("Wolf Pup", body.getName());
    }
}
