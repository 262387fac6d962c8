package com.example.skirmish.pet;

import com.example.skirmish.behavior.BehaviorState;
import com.example.skirmish.behavior.TickMover;
import com.example.skirmish.combat.CombatMovement;
import com.example.skirmish.combat.CombatTarget;
import com.example.skirmish.model.Vec2;

import java.util.Objects;

/**
 * Pet movement: trails the owner at a fixed distance, or chases its combat target
 * to melee range.
 */
public class PetFollower extends TickMover implements CombatMovement {

    private static final double ARRIVE_EPSILON = 0.05;

    private final PetOwner owner;
    private final double moveSpeed;
    private final double followDistance;
    private final double meleeRange;

    private BehaviorState state = BehaviorState.IDLE;
    private CombatTarget combatTarget;

    public PetFollower(PetOwner owner, Vec2 start, double moveSpeed, double followDistance,
                       double meleeRange, long tickDurationMs) {
        super(start, tickDurationMs);
        this.owner = Objects.requireNonNull(owner, "owner");
        this.moveSpeed = Math.max(0.0, moveSpeed);
        this.followDistance = Math.max(0.0, followDistance);
        this.meleeRange = Math.max(0.0, meleeRange);
    }

    @Override
    protected Vec2 nextPosition(long tick) {
        Vec2 current = getPosition();
        double step = moveSpeed * tickSeconds();

        if (combatTarget != null) {
            Vec2 targetPos = combatTarget.getPosition();
            if (current.distanceTo(targetPos) <= meleeRange) return null;
            Vec2 dir = targetPos.subtract(current).normalized();
            return current.moveTowards(targetPos.subtract(dir.scale(meleeRange)), step);
        }

        Vec2 ownerPos = owner.getPosition();
        double dist = current.distanceTo(ownerPos);
        if (dist <= followDistance + ARRIVE_EPSILON) {
            state = BehaviorState.IDLE;
            return null;
        }
        if (state != BehaviorState.RETURNING) state = BehaviorState.WANDERING;
        Vec2 dir = ownerPos.subtract(current).normalized();
        Vec2 next = current.moveTowards(ownerPos.subtract(dir.scale(followDistance)), step);
        if (next.distanceTo(ownerPos) <= followDistance + ARRIVE_EPSILON) {
            state = BehaviorState.IDLE;
        }
        return next;
    }

    @Override
    public void enterCombat(CombatTarget target) {
        if (target == null) return;
        combatTarget = target;
        state = BehaviorState.APPROACHING;
    }

    @Override
    public void setInMeleeRange(boolean inRange) {
        if (combatTarget == null) return;
        state = inRange ? BehaviorState.ATTACKING : BehaviorState.APPROACHING;
    }

    @Override
    public void exitCombat(boolean returnHome) {
        combatTarget = null;
        state = returnHome ? BehaviorState.RETURNING : BehaviorState.IDLE;
    }

    @Override
    public BehaviorState getState() {
        return state;
    }

    public PetOwner getOwner() { return owner; }
    public CombatTarget getCombatTarget() { return combatTarget; }
}
