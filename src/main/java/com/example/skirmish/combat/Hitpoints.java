package com.example.skirmish.combat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Hitpoint pool shared by the {@link CombatTarget} adapters. Owns the observer
 * list and guarantees health-changed before death, and one death per life.
 */
public class Hitpoints {

    private static final Logger logger = LoggerFactory.getLogger(Hitpoints.class);

    private final CombatTarget owner;
    private final List<HealthListener> listeners = new CopyOnWriteArrayList<>();
    private int max;
    private int current;
    private boolean deathFired;

    public Hitpoints(CombatTarget owner, int max) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.max = Math.max(1, max);
        this.current = this.max;
    }

    public int getCurrent() { return current; }
    public int getMax() { return max; }
    public boolean isAlive() { return current > 0; }

    /**
     * @return the amount actually removed
     */
    public int applyDamage(int amount, CombatTarget source) {
        if (current <= 0) return 0;
        int applied = Math.max(0, Math.min(amount, current));
        current -= applied;
        fireHealthChanged();
        if (current == 0 && !deathFired) {
            deathFired = true;
            fireDeath(source);
        }
        return applied;
    }

    public int heal(int amount) {
        if (current <= 0 || amount <= 0) return 0;
        int healed = Math.min(amount, max - current);
        if (healed > 0) {
            current += healed;
            fireHealthChanged();
        }
        return healed;
    }

    /** Back to full health; starts a new life. */
    public void restore() {
        current = max;
        deathFired = false;
        fireHealthChanged();
    }

    /** Change the maximum, keeping the current value within range. */
    public void setMax(int newMax) {
        int clamped = Math.max(1, newMax);
        if (clamped == max) return;
        max = clamped;
        if (current > max) current = max;
        fireHealthChanged();
    }

    public void addListener(HealthListener l) {
        if (l != null && !listeners.contains(l)) listeners.add(l);
    }

    public void removeListener(HealthListener l) {
        listeners.remove(l);
    }

    private void fireHealthChanged() {
        for (HealthListener l : listeners) {
            try {
                l.onHealthChanged(owner, current, max);
            } catch (Exception e) {
                logger.warn("[Hitpoints] Health listener failed for {}: {}", owner.getName(), e.getMessage(), e);
            }
        }
    }

    private void fireDeath(CombatTarget killer) {
        for (HealthListener l : listeners) {
            try {
                l.onDeath(owner, killer);
            } catch (Exception e) {
                logger.warn("[Hitpoints] Death listener failed for {}: {}", owner.getName(), e.getMessage(), e);
            }
        }
    }
}
