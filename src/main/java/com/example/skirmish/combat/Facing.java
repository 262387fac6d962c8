package com.example.skirmish.combat;

import com.example.skirmish.model.Vec2;

/**
 * Four-way facing used by the sprite layer. The index is the animation row.
 */
public enum Facing {
    DOWN(0),
    LEFT(1),
    RIGHT(2),
    UP(3);

    private final int index;

    Facing(int index) {
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    /**
     * Facing along the dominant axis of {@code to - from}. Ties go to the vertical axis.
     */
    public static Facing toward(Vec2 from, Vec2 to) {
        double dx = to.getX() - from.getX();
        double dy = to.getY() - from.getY();
        if (Math.abs(dx) > Math.abs(dy)) {
            return dx < 0 ? LEFT : RIGHT;
        }
        return dy < 0 ? DOWN : UP;
    }

    public static Facing fromIndex(int index) {
        for (Facing f : values()) {
            if (f.index == index) return f;
        }
        return DOWN;
    }
}
