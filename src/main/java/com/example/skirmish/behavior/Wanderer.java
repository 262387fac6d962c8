package com.example.skirmish.behavior;

import com.example.skirmish.combat.CombatMovement;
import com.example.skirmish.combat.CombatTarget;
import com.example.skirmish.model.Vec2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Random;

/**
 * Bounded wandering with chase and return.
 *
 * Out of combat the agent idles for a random time, walks to a random point inside its
 * bounds, and idles again. In combat it closes to melee range of the live target,
 * clamped to the bounds. After a leash break it walks back to its origin.
 */
public class Wanderer extends TickMover implements CombatMovement {

    private static final Logger logger = LoggerFactory.getLogger(Wanderer.class);

    public static final double DEFAULT_ARRIVE_DISTANCE = 0.05;

    private final Vec2 origin;
    private final WanderBounds bounds;
    private final double moveSpeed;           // Tiles per second
    private final double meleeRange;
    private final Random random;

    private double arriveDistance = DEFAULT_ARRIVE_DISTANCE;
    private double minIdleSeconds = 0.5;
    private double maxIdleSeconds = 2.0;

    private BehaviorState state = BehaviorState.IDLE;
    private double idleRemaining;
    private Vec2 wanderTarget;
    private CombatTarget combatTarget;

    public Wanderer(Vec2 origin, WanderBounds bounds, double moveSpeed, double meleeRange,
                    long tickDurationMs, Random random) {
        super(origin, tickDurationMs);
        this.origin = Objects.requireNonNull(origin, "origin");
        this.bounds = Objects.requireNonNull(bounds, "bounds");
        this.moveSpeed = Math.max(0.0, moveSpeed);
        this.meleeRange = Math.max(0.0, meleeRange);
        this.random = Objects.requireNonNull(random, "random");
        beginIdle();
    }

    public void setIdleTime(double minSeconds, double maxSeconds) {
        double lo = Math.max(0.0, Math.min(minSeconds, maxSeconds));
        double hi = Math.max(0.0, Math.max(minSeconds, maxSeconds));
        this.minIdleSeconds = lo;
        this.maxIdleSeconds = hi;
        if (state == BehaviorState.IDLE) beginIdle();
    }

    public void setArriveDistance(double arriveDistance) {
        this.arriveDistance = Math.max(0.0, arriveDistance);
    }

    private void beginIdle() {
        state = BehaviorState.IDLE;
        wanderTarget = null;
        idleRemaining = minIdleSeconds + random.nextDouble() * (maxIdleSeconds - minIdleSeconds);
    }

    @Override
    protected Vec2 nextPosition(long tick) {
        Vec2 current = getPosition();
        switch (state) {
            case APPROACHING:
            case ATTACKING:
                return chaseStep(current);
            case RETURNING: {
                Vec2 next = current.moveTowards(origin, moveSpeed * tickSeconds());
                if (next.distanceTo(origin) <= arriveDistance) {
                    beginIdle();
                }
                return next;
            }
            case WANDERING: {
                Vec2 next = current.moveTowards(wanderTarget, moveSpeed * tickSeconds());
                if (next.distanceTo(wanderTarget) <= arriveDistance) {
                    beginIdle();
                }
                return next;
            }
            case IDLE:
            default:
                idleRemaining -= tickSeconds();
                if (idleRemaining <= 0) {
                    wanderTarget = bounds.randomPoint(origin, random);
                    state = BehaviorState.WANDERING;
                }
                return null;
        }
    }

    private Vec2 chaseStep(Vec2 current) {
        if (combatTarget == null) return null;
        Vec2 targetPos = combatTarget.getPosition();
        double dist = current.distanceTo(targetPos);
        if (dist <= meleeRange) return null;
        Vec2 direction = targetPos.subtract(current).normalized();
        Vec2 desired = targetPos.subtract(direction.scale(meleeRange));
        Vec2 step = current.moveTowards(desired, moveSpeed * tickSeconds());
        return bounds.clamp(step, origin);
    }

    @Override
    public void enterCombat(CombatTarget target) {
        if (target == null) return;
        combatTarget = target;
        wanderTarget = null;
        state = BehaviorState.APPROACHING;
        logger.debug("[Wanderer] chasing {}", target.getName());
    }

    @Override
    public void setInMeleeRange(boolean inRange) {
        if (combatTarget == null) return;
        state = inRange ? BehaviorState.ATTACKING : BehaviorState.APPROACHING;
    }

    @Override
    public void exitCombat(boolean returnHome) {
        combatTarget = null;
        if (returnHome && getPosition().distanceTo(origin) > arriveDistance) {
            state = BehaviorState.RETURNING;
            wanderTarget = null;
        } else {
            beginIdle();
        }
    }

    /**
     * Chasing stops at the edge of the bounds, so a target is reachable only when the
     * closest in-bounds point is within melee range of it.
     */
    @Override
    public boolean canReach(CombatTarget target) {
        if (target == null) return false;
        Vec2 targetPos = target.getPosition();
        return bounds.clamp(targetPos, origin).distanceTo(targetPos) <= meleeRange;
    }

    /** Walk straight back to the origin, dropping any wander target. */
    public void returnToOrigin() {
        exitCombat(true);
    }

    /** Snap back to the origin and idle. */
    public void reset() {
        combatTarget = null;
        teleport(origin);
        beginIdle();
    }

    @Override
    public BehaviorState getState() {
        return state;
    }

    public Vec2 getOrigin() { return origin; }
    public WanderBounds getBounds() { return bounds; }
    public Vec2 getWanderTarget() { return wanderTarget; }
    public CombatTarget getCombatTarget() { return combatTarget; }
    public double getMoveSpeed() { return moveSpeed; }
    public double getIdleRemaining() { return idleRemaining; }
}
