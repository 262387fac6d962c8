package com.example.skirmish.npc;

import com.example.skirmish.behavior.AggroState;
import com.example.skirmish.behavior.BehaviorState;
import com.example.skirmish.behavior.TickMover;
import com.example.skirmish.behavior.WanderBounds;
import com.example.skirmish.behavior.Wanderer;
import com.example.skirmish.combat.CombatMath;
import com.example.skirmish.combat.CombatMovement;
import com.example.skirmish.combat.CombatTarget;
import com.example.skirmish.combat.HealthListener;
import com.example.skirmish.combat.TargetRegistry;
import com.example.skirmish.config.CombatConfig;
import com.example.skirmish.model.NpcCombatProfile;
import com.example.skirmish.model.Vec2;
import com.example.skirmish.util.TickScheduler;
import com.example.skirmish.util.Tickable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Random;

/**
 * A spawned NPC: combatant, attack controller and movement driven by one tick
 * callback. Each tick runs the aggro scan, then the attack loop, then movement.
 * Dead NPCs do nothing until their respawn comes due.
 */
public class NpcAgent implements Tickable {

    private static final Logger logger = LoggerFactory.getLogger(NpcAgent.class);

    private final NpcCombatant combatant;
    private final NpcAttackController controller;
    private final TickMover mover;
    private final AggroState aggro;
    private final TargetRegistry registry;
    private final TickScheduler scheduler;

    private int deaths;

    public NpcAgent(String name, NpcCombatProfile profile, TickMover mover, AggroState aggro,
                    CombatMath math, CombatConfig config, TargetRegistry registry, TickScheduler scheduler) {
        this.mover = Objects.requireNonNull(mover, "mover");
        this.aggro = Objects.requireNonNull(aggro, "aggro");
        this.registry = registry;
        this.scheduler = scheduler;
        this.combatant = new NpcCombatant(name, profile, mover::getPosition);
        this.controller = new NpcAttackController(combatant, aggro, math, config, scheduler);
        this.combatant.setCounterAttacker(controller);
        if (mover instanceof CombatMovement) {
            controller.setMovement((CombatMovement) mover);
        }
        combatant.addHealthListener(new HealthListener() {
            @Override
            public void onHealthChanged(CombatTarget target, int currentHp, int maxHp) {
            }

            @Override
            public void onDeath(CombatTarget target, CombatTarget killer) {
                handleDeath(killer);
            }
        });
        if (registry != null) {
            registry.registerNpc(combatant, profile.getFaction());
        }
    }

    /**
     * NPC that wanders inside {@code bounds} around {@code spawn}.
     */
    public static NpcAgent wandering(String name, NpcCombatProfile profile, Vec2 spawn, WanderBounds bounds,
                                     double moveSpeed, Random random, CombatMath math, CombatConfig config,
                                     TargetRegistry registry, TickScheduler scheduler) {
        Wanderer wanderer = new Wanderer(spawn, bounds, moveSpeed, config.getMeleeRange(),
            config.getTickDurationMs(), random);
        AggroState aggro = AggroState.forNpc(spawn, profile, bounds);
        return new NpcAgent(name, profile, wanderer, aggro, math, config, registry, scheduler);
    }

    @Override
    public void onTick(long tick) {
        if (!combatant.isAlive()) return;
        scanForTargets();
        controller.onTick(tick);
        mover.onTick(tick);
    }

    private void scanForTargets() {
        NpcCombatProfile profile = combatant.getProfile();
        if (!profile.isAggressive() || controller.isAttacking() || registry == null) return;
        // walking home after a leash break; scanning resumes once idle
        if (mover.getState() == BehaviorState.RETURNING) return;
        Vec2 here = combatant.getPosition();
        if (!aggro.isWithin(here)) return;

        CombatTarget player = registry.findPlayerNear(aggro.getSpawn(), aggro.getRadius());
        if (player != null && controller.beginAttacking(player)) {
            logger.debug("[NpcAgent] {} aggroes on {}", combatant.getName(), player.getName());
            return;
        }
        CombatTarget enemy = registry.findHostileNpc(combatant, profile.getFaction(), here, aggro.getRadius());
        if (enemy != null && controller.beginAttacking(enemy)) {
            logger.debug("[NpcAgent] {} aggroes on rival {}", combatant.getName(), enemy.getName());
        }
    }

    private void handleDeath(CombatTarget killer) {
        deaths++;
        controller.cancel();
        logger.info("[NpcAgent] {} was killed by {}", combatant.getName(), killer != null ? killer.getName() : "unknown");
        int respawnTicks = combatant.getProfile().getRespawnTicks();
        if (respawnTicks > 0 && scheduler != null) {
            scheduler.scheduleOnce(respawnTicks, this::respawn);
        }
    }

    /** Restore full health at the spawn point. No effect while alive. */
    public void respawn() {
        if (combatant.isAlive()) return;
        controller.cancel();
        if (mover instanceof Wanderer) {
            ((Wanderer) mover).reset();
        } else {
            mover.teleport(aggro.getSpawn());
        }
        combatant.respawn();
        logger.info("[NpcAgent] {} respawned at {}", combatant.getName(), aggro.getSpawn());
    }

    public NpcCombatant getCombatant() { return combatant; }
    public NpcAttackController getController() { return controller; }
    public TickMover getMover() { return mover; }
    public AggroState getAggro() { return aggro; }
    public int getDeaths() { return deaths; }

    public BehaviorState getState() {
        return mover.getState();
    }

    public Vec2 getPosition() {
        return mover.getPosition();
    }
}
