package com.example.skirmish;

import com.example.skirmish.behavior.WanderBounds;
import com.example.skirmish.combat.CombatMath;
import com.example.skirmish.combat.TargetRegistry;
import com.example.skirmish.config.CombatConfig;
import com.example.skirmish.model.CombatStyle;
import com.example.skirmish.model.EquipmentSlot;
import com.example.skirmish.model.ItemCombatStats;
import com.example.skirmish.model.NpcCombatProfile;
import com.example.skirmish.model.PetDefinition;
import com.example.skirmish.model.SkillType;
import com.example.skirmish.model.Vec2;
import com.example.skirmish.npc.NpcAgent;
import com.example.skirmish.pet.BeastmasterXp;
import com.example.skirmish.pet.PetAgent;
import com.example.skirmish.pet.PetExperience;
import com.example.skirmish.persistence.DefinitionLoader;
import com.example.skirmish.player.PlayerAgent;
import com.example.skirmish.player.PlayerCharacter;
import com.example.skirmish.player.SkillSet;
import com.example.skirmish.util.TickScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Runs a small goblin skirmish on the real-time tick loop and logs how it went.
 *
 * Usage: {@code SkirmishMain [ticks]} (default 100).
 */
public class SkirmishMain {

    private static final Logger logger = LoggerFactory.getLogger(SkirmishMain.class);

    private static final int DEFAULT_TICKS = 100;

    public static void main(String[] args) throws InterruptedException {
        int ticks = DEFAULT_TICKS;
        if (args.length > 0) {
            try {
                ticks = Math.max(1, Integer.parseInt(args[0].trim()));
            } catch (NumberFormatException e) {
                logger.warn("[SkirmishMain] Bad tick count '{}', using {}", args[0], DEFAULT_TICKS);
            }
        }

        CombatConfig config = CombatConfig.load();
        DefinitionLoader loader = new DefinitionLoader();
        Map<String, NpcCombatProfile> npcs = loader.loadNpcProfiles();
        Map<String, PetDefinition> pets = loader.loadPets();

        TickScheduler scheduler = new TickScheduler(config.getTickDurationMs());
        TargetRegistry registry = new TargetRegistry();
        Random random = new Random();
        CombatMath math = new CombatMath(config, random);

        SkillSet skills = new SkillSet();
        skills.setLevel(SkillType.ATTACK, 20);
        skills.setLevel(SkillType.STRENGTH, 20);
        skills.setLevel(SkillType.DEFENCE, 15);
        skills.setLevel(SkillType.HITPOINTS, 25);
        PlayerCharacter player = new PlayerCharacter("Adventurer", skills, Vec2.of(0, 0));
        player.equip(EquipmentSlot.WEAPON, ItemCombatStats.weapon(10, 9, 4));
        player.setStyle(CombatStyle.CONTROLLED);
        registry.registerPlayer(player);

        PlayerAgent playerAgent = new PlayerAgent(player, math, config);
        scheduler.subscribe(playerAgent);

        PetDefinition wolf = pets.get("wolf_pup");
        if (wolf != null) {
            PetAgent pet = new PetAgent(wolf, new PetExperience(wolf), player, Vec2.of(-1, 0), math, config,
                new BeastmasterXp(config));
            playerAgent.setActivePet(pet);
            playerAgent.setGuardMode(true);
            scheduler.subscribe(pet);
        } else {
            logger.warn("[SkirmishMain] No wolf_pup pet defined - fighting alone");
        }

        List<NpcAgent> agents = new ArrayList<>();
        spawn(agents, npcs.get("goblin_green"), "Green Goblin", Vec2.of(3, 0), WanderBounds.area(4, 4), random, math, config, registry, scheduler);
        spawn(agents, npcs.get("goblin_red"), "Red Goblin", Vec2.of(6, 1), WanderBounds.area(4, 4), random, math, config, registry, scheduler);
        spawn(agents, npcs.get("chicken"), "Chicken", Vec2.of(-4, -3), WanderBounds.circle(2), random, math, config, registry, scheduler);
        for (NpcAgent a : agents) {
            a.getController().setGuardResponder(playerAgent);
            scheduler.subscribe(a);
        }

        logger.info("[SkirmishMain] Running {} ticks of {}ms with {} NPCs", ticks, config.getTickDurationMs(), agents.size());
        scheduler.start();
        try {
            Thread.sleep(ticks * config.getTickDurationMs());
        } finally {
            scheduler.shutdown();
        }

        logger.info("[SkirmishMain] {} ends at {}/{} HP (Attack {} Strength {} Defence {} Beastmaster {})",
            player.getName(), player.getCurrentHp(), player.getMaxHp(),
            skills.getLevel(SkillType.ATTACK), skills.getLevel(SkillType.STRENGTH),
            skills.getLevel(SkillType.DEFENCE), skills.getLevel(SkillType.BEASTMASTER));
        PetAgent pet = playerAgent.getActivePet();
        if (pet != null) {
            logger.info("[SkirmishMain] {} is level {} ({})", pet.getDefinition().getDisplayName(),
                pet.getExperience().getLevel(), pet.getExperience().getTierName());
        }
        for (NpcAgent a : agents) {
            logger.info("[SkirmishMain] {}: {}/{} HP, {} deaths, {}", a.getCombatant().getName(),
                a.getCombatant().getCurrentHp(), a.getCombatant().getMaxHp(), a.getDeaths(),
                a.getState().getDisplayName());
        }
    }

    private static void spawn(List<NpcAgent> agents, NpcCombatProfile profile, String name, Vec2 at,
                              WanderBounds bounds, Random random, CombatMath math, CombatConfig config,
                              TargetRegistry registry, TickScheduler scheduler) {
        if (profile == null) {
            logger.warn("[SkirmishMain] No profile for {} - not spawned", name);
            return;
        }
        agents.add(NpcAgent.wandering(name, profile, at, bounds, 2.0, random, math, config,
            registry, scheduler));
    }
}
