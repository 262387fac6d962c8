package com.example.skirmish.player;

import com.example.skirmish.behavior.WanderBounds;
import com.example.skirmish.combat.CombatMath;
import com.example.skirmish.combat.MaxRollRandom;
import com.example.skirmish.combat.StubTarget;
import com.example.skirmish.combat.TargetRegistry;
import com.example.skirmish.config.CombatConfig;
import com.example.skirmish.model.Faction;
import com.example.skirmish.model.NpcCombatProfile;
import com.example.skirmish.model.PetDefinition;
import com.example.skirmish.model.SkillType;
import com.example.skirmish.model.Vec2;
import com.example.skirmish.npc.NpcAgent;
import com.example.skirmish.pet.BeastmasterXp;
import com.example.skirmish.pet.PetAgent;
import com.example.skirmish.pet.PetExperience;
import com.example.skirmish.util.TickScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PlayerAgent Tests")
public class PlayerAgentTest {

    private CombatConfig config;
    private CombatMath math;
    private PlayerCharacter player;
    private PlayerAgent agent;
    private PetAgent pet;

    @BeforeEach
    void setUp() {
        config = CombatConfig.defaults();
        math = new CombatMath(config, new MaxRollRandom());
        SkillSet skills = new SkillSet();
        skills.setLevel(SkillType.STRENGTH, 10);
        player = new PlayerCharacter("hero", skills, Vec2.ZERO);
        agent = new PlayerAgent(player, math, config);
        PetDefinition wolf = PetDefinition.builder("wolf").canFight(true).attackLevel(10).strengthLevel(10).build();
        pet = new PetAgent(wolf, new PetExperience(wolf), player, Vec2.of(-1, 0), math, config, new BeastmasterXp(config));
        agent.setActivePet(pet);
    }

    @Test
    @DisplayName("In guard mode the pet joins the player's attack")
    void petJoinsAttack() {
        agent.setGuardMode(true);
        StubTarget rat = new StubTarget("rat", 10, Vec2.of(1, 0));

        assertTrue(agent.attack(rat));

        assertSame(rat, agent.getController().getTarget());
        assertSame(rat, pet.getController().getTarget());
    }

    @Test
    @DisplayName("Without guard mode the pet stays out of it")
    void noGuardMode() {
        StubTarget rat = new StubTarget("rat", 10, Vec2.of(1, 0));

        assertTrue(agent.attack(rat));
        agent.onFirstAttack(player, rat);

        assertFalse(pet.getController().isAttacking());
    }

    @Test
    @DisplayName("Guard mode answers the first swing at the player")
    void guardAnswersFirstSwing() {
        agent.setGuardMode(true);
        StubTarget goblin = new StubTarget("goblin", 10, Vec2.of(2, 0));
        StubTarget bystander = new StubTarget("bystander", 10, Vec2.of(3, 0));

        agent.onFirstAttack(bystander, goblin);
        assertFalse(pet.getController().isAttacking());

        agent.onFirstAttack(player, goblin);
        assertSame(goblin, pet.getController().getTarget());
    }

    @Test
    @DisplayName("Dead attackers are not chased")
    void deadAttackerIgnored() {
        agent.setGuardMode(true);
        StubTarget goblin = new StubTarget("goblin", 10, Vec2.of(2, 0));
        goblin.kill();

        agent.onFirstAttack(player, goblin);

        assertFalse(pet.getController().isAttacking());
    }

    @Test
    @DisplayName("Toggling guard mode flips the flag")
    void toggle() {
        assertFalse(agent.isGuardMode());
        assertTrue(agent.toggleGuardMode());
        assertFalse(agent.toggleGuardMode());
    }

    @Test
    @DisplayName("An NPC's first swing brings the guarding pet in on the next tick")
    void guardModeEndToEnd() {
        TickScheduler scheduler = new TickScheduler(config.getTickDurationMs());
        TargetRegistry registry = new TargetRegistry();
        registry.registerPlayer(player);
        NpcCombatProfile goblin = NpcCombatProfile.builder("goblin_red")
            .attackLevel(5).strengthLevel(5).hitpointsLevel(20)
            .aggressive(true).aggroRange(5).faction(Faction.GOBLIN_RED)
            .build();
        NpcAgent npc = NpcAgent.wandering("Red Goblin", goblin, Vec2.of(1, 0), WanderBounds.area(4, 4), 2.0,
            new Random(5), math, config, registry, scheduler);
        npc.getController().setGuardResponder(agent);
        agent.setGuardMode(true);
        scheduler.subscribe(agent);
        scheduler.subscribe(pet);
        scheduler.subscribe(npc);

        scheduler.runTick();
        assertTrue(player.getCurrentHp() < player.getMaxHp());
        assertFalse(pet.getController().isAttacking());

        scheduler.runTick();
        assertSame(npc.getCombatant(), pet.getController().getTarget());
    }
}
