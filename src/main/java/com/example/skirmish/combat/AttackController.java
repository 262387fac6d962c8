package com.example.skirmish.combat;

import com.example.skirmish.config.CombatConfig;
import com.example.skirmish.util.Tickable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Drives one agent's attack loop, one {@link AttackSession} at a time.
 *
 * The loop is an explicit state machine advanced by {@link #onTick(long)}: a session
 * waits out its cooldown tick by tick, resolves an attack once the target is in melee
 * range, then starts the next cooldown. Nothing blocks; the scheduler keeps serving
 * other agents while a session waits.
 *
 * Subclasses supply the attacker's stats and decide when to give up on a target.
 */
public abstract class AttackController implements Tickable {

    private static final Logger logger = LoggerFactory.getLogger(AttackController.class);

    protected final CombatTarget self;
    protected final CombatMath math;
    protected final CombatConfig config;

    private final List<AttackListener> listeners = new CopyOnWriteArrayList<>();
    private CombatMovement movement;

    private AttackSession session;
    private Facing facing = Facing.DOWN;
    private long currentTick = 0;
    private long nextReadyTick = 0;     // Cooldown carried across sessions

    protected AttackController(CombatTarget self, CombatMath math, CombatConfig config) {
        this.self = Objects.requireNonNull(self, "self");
        this.math = Objects.requireNonNull(math, "math");
        this.config = Objects.requireNonNull(config, "config");
    }

    public void setMovement(CombatMovement movement) {
        this.movement = movement;
    }

    public void addListener(AttackListener l) {
        if (l != null) listeners.add(l);
    }

    public void removeListener(AttackListener l) {
        listeners.remove(l);
    }

    /**
     * Start attacking {@code target}. Attacking the current target again is a no-op;
     * a different target replaces the current session. A null target cancels.
     *
     * @return true when a session against {@code target} is running afterwards
     */
    public boolean beginAttacking(CombatTarget target) {
        if (target == null) {
            cancel();
            return false;
        }
        if (session != null && session.getTarget() == target) {
            return true;
        }
        if (target == self || !target.isAlive() || !self.isAlive() || !canEngage(target)) {
            return false;
        }

        CombatTarget previous = null;
        if (session != null) {
            previous = session.getTarget();
            session = null;
            if (movement != null) movement.exitCombat(false);
            fireSessionEnded(previous, AttackSession.EndReason.SUPERSEDED);
        }

        int carried = (int) Math.max(0, nextReadyTick - currentTick);
        session = new AttackSession(self, target, currentTick, carried);
        onSessionStarted(session);
        if (movement != null) movement.enterCombat(target);
        logger.debug("[AttackController] {} engages {} (cooldown {})", self.getName(), target.getName(), carried);
        fireTargetChanged(previous, target);
        return true;
    }

    /**
     * Entry point for external commands (a click, a guard-mode order). Same
     * re-entrancy rules as {@link #beginAttacking}, except that a null target is
     * declined and leaves the running session alone.
     */
    public boolean commandAttack(CombatTarget target) {
        if (target == null) return false;
        return beginAttacking(target);
    }

    /** Stop the active session, if any, and go idle in place. */
    public void cancel() {
        endSession(AttackSession.EndReason.CANCELLED, false);
    }

    @Override
    public void onTick(long tick) {
        currentTick = tick;
        AttackSession s = session;
        if (s == null) return;
        CombatTarget target = s.getTarget();

        if (!self.isAlive()) {
            endSession(AttackSession.EndReason.ATTACKER_DIED, false);
            return;
        }
        if (!target.isAlive()) {
            endSession(AttackSession.EndReason.TARGET_DIED, false);
            return;
        }
        if (shouldDisengage(target)) {
            endSession(AttackSession.EndReason.LEASHED, true);
            return;
        }

        boolean inRange = self.getPosition().distanceTo(target.getPosition()) <= config.getMeleeRange();
        if (movement != null) movement.setInMeleeRange(inRange);
        if (!inRange && !continueOutOfRange(target)) {
            endSession(AttackSession.EndReason.OUT_OF_RANGE, false);
            return;
        }

        if (s.isWaiting() && s.tickCooldown()) return;
        if (!inRange) return;

        resolveAttack(s, target, tick);
    }

    private void resolveAttack(AttackSession s, CombatTarget target, long tick) {
        CombatantStats attacker = attackerStats(target);
        CombatantStats defender = target.getDefenceStats(attacker.getDamageType());
        if (defender == null) defender = CombatantStats.fallback(target.getPreferredDefenceType());

        CombatRoll roll = math.roll(attacker, defender);
        int applied = roll.isHit() ? target.applyDamage(roll.getDamage(), attacker.getDamageType(), self) : 0;
        CombatResult result = CombatResult.from(self, target, roll, applied);
        s.recordAttack();

        facing = Facing.toward(self.getPosition(), target.getPosition());
        logger.debug("[AttackController] {}", result);
        for (AttackListener l : listeners) {
            try {
                l.onAttackResolved(result, facing);
            } catch (Exception e) {
                logger.warn("[AttackController] Listener failed for {}: {}", self.getName(), e.getMessage(), e);
            }
        }
        afterAttack(result);

        int speed = Math.max(1, attackSpeedTicks(attacker));
        if (!target.isAlive()) {
            nextReadyTick = tick + Math.max(0, cooldownAfterKill(speed));
            for (AttackListener l : listeners) {
                try {
                    l.onTargetKilled(target);
                } catch (Exception e) {
                    logger.warn("[AttackController] Listener failed for {}: {}", self.getName(), e.getMessage(), e);
                }
            }
            if (session == s) endSession(AttackSession.EndReason.TARGET_DIED, false);
            return;
        }
        nextReadyTick = tick + speed;
        // a listener or hook may have ended or replaced the session
        if (session == s) s.startCooldown(speed);
    }

    private void endSession(AttackSession.EndReason reason, boolean returnHome) {
        AttackSession s = session;
        if (s == null) return;
        session = null;
        onSessionEnded(s, reason);
        if (movement != null) movement.exitCombat(returnHome);
        logger.debug("[AttackController] {} stops attacking {} ({})", self.getName(), s.getTarget().getName(), reason);
        fireSessionEnded(s.getTarget(), reason);
        fireTargetChanged(s.getTarget(), null);
    }

    private void fireTargetChanged(CombatTarget previous, CombatTarget current) {
        for (AttackListener l : listeners) {
            try {
                l.onTargetChanged(previous, current);
            } catch (Exception e) {
                logger.warn("[AttackController] Listener failed for {}: {}", self.getName(), e.getMessage(), e);
            }
        }
    }

    private void fireSessionEnded(CombatTarget target, AttackSession.EndReason reason) {
        for (AttackListener l : listeners) {
            try {
                l.onSessionEnded(target, reason);
            } catch (Exception e) {
                logger.warn("[AttackController] Listener failed for {}: {}", self.getName(), e.getMessage(), e);
            }
        }
    }

    /** Stats for this agent attacking {@code target}, built fresh for each swing. */
    protected abstract CombatantStats attackerStats(CombatTarget target);

    protected int attackSpeedTicks(CombatantStats attacker) {
        int speed = attacker.getAttackSpeedTicks();
        return speed > 0 ? speed : config.getDefaultAttackSpeedTicks();
    }

    /** Wait before the next session may swing after a kill. */
    protected int cooldownAfterKill(int attackSpeedTicks) {
        return Math.min(attackSpeedTicks, config.getDeathExitWaitTicks());
    }

    protected boolean canEngage(CombatTarget target) {
        return true;
    }

    /** True when the agent should give up and head home. Checked every tick. */
    protected boolean shouldDisengage(CombatTarget target) {
        return false;
    }

    /** False ends the session when the target steps out of melee range. */
    protected boolean continueOutOfRange(CombatTarget target) {
        return true;
    }

    protected void onSessionStarted(AttackSession session) {
    }

    protected void onSessionEnded(AttackSession session, AttackSession.EndReason reason) {
    }

    protected void afterAttack(CombatResult result) {
    }

    public boolean isAttacking() {
        return session != null;
    }

    public CombatTarget getTarget() {
        return session != null ? session.getTarget() : null;
    }

    public AttackSession getSession() {
        return session;
    }

    public Facing getFacing() {
        return facing;
    }

    public CombatTarget getSelf() {
        return self;
    }

    protected CombatMovement getMovement() {
        return movement;
    }

    protected long getCurrentTick() {
        return currentTick;
    }

    /** Ticks until this agent may swing again, counted from the last tick seen. */
    public int getCooldownRemainingTicks() {
        if (session != null) return session.getCooldownRemainingTicks();
        return (int) Math.max(0, nextReadyTick - currentTick);
    }
}
