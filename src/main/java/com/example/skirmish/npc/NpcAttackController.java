package com.example.skirmish.npc;

import com.example.skirmish.behavior.AggroState;
import com.example.skirmish.combat.AttackController;
import com.example.skirmish.combat.AttackSession;
import com.example.skirmish.combat.CombatMath;
import com.example.skirmish.combat.CombatMovement;
import com.example.skirmish.combat.CombatResult;
import com.example.skirmish.combat.CombatTarget;
import com.example.skirmish.combat.CombatantStats;
import com.example.skirmish.combat.GuardResponder;
import com.example.skirmish.config.CombatConfig;
import com.example.skirmish.util.TickScheduler;

import java.util.Objects;

/**
 * NPC attack loop. Gives up once either the NPC or its target is outside the
 * NPC's aggro radius, or once its movement can no longer reach the target. Tells
 * the guard responder about its first swing in each engagement.
 */
public class NpcAttackController extends AttackController {

    private final NpcCombatant npc;
    private final AggroState aggro;
    private final TickScheduler scheduler;
    private GuardResponder guardResponder;
    private boolean firstSwingReported;

    public NpcAttackController(NpcCombatant npc, AggroState aggro, CombatMath math, CombatConfig config,
                               TickScheduler scheduler) {
        super(npc, math, config);
        this.npc = npc;
        this.aggro = Objects.requireNonNull(aggro, "aggro");
        this.scheduler = scheduler;
    }

    public void setGuardResponder(GuardResponder guardResponder) {
        this.guardResponder = guardResponder;
    }

    @Override
    protected CombatantStats attackerStats(CombatTarget target) {
        return CombatantStats.forNpc(npc.getProfile());
    }

    @Override
    protected boolean canEngage(CombatTarget target) {
        return isReachable(target);
    }

    @Override
    protected boolean shouldDisengage(CombatTarget target) {
        if (!aggro.isWithin(npc.getPosition()) || !aggro.isWithin(target.getPosition())) return true;
        return !isReachable(target);
    }

    private boolean isReachable(CombatTarget target) {
        CombatMovement movement = getMovement();
        return movement == null || movement.canReach(target);
    }

    @Override
    protected void onSessionStarted(AttackSession session) {
        firstSwingReported = false;
    }

    @Override
    protected void afterAttack(CombatResult result) {
        if (firstSwingReported) return;
        firstSwingReported = true;
        GuardResponder responder = guardResponder;
        if (responder == null) return;
        CombatTarget victim = result.getTarget();
        if (scheduler != null) {
            scheduler.scheduleOnce(1, () -> responder.onFirstAttack(victim, npc));
        } else {
            responder.onFirstAttack(victim, npc);
        }
    }

    public AggroState getAggro() {
        return aggro;
    }
}
