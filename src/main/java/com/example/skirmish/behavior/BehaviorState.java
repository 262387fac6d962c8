package com.example.skirmish.behavior;

/**
 * What an agent is doing this tick.
 */
public enum BehaviorState {
    IDLE("idle"),
    WANDERING("wandering"),
    APPROACHING("approaching"),
    ATTACKING("attacking"),
    RETURNING("returning");

    private final String displayName;

    BehaviorState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isInCombat() {
        return this == APPROACHING || this == ATTACKING;
    }
}
