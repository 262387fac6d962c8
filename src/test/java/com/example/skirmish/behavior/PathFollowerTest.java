package com.example.skirmish.behavior;

import com.example.skirmish.model.Vec2;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Paths over a three-point L: (0,0), (3,0), (3,3). At 10 tiles/s and 600ms
 * ticks every leg takes exactly one tick, so the index moves on every tick.
 */
@DisplayName("PathFollower Tests")
public class PathFollowerTest {

    private static WaypointPath lPath(Vec2 anchor) {
        return new WaypointPath(anchor, List.of(
            new Waypoint(Vec2.of(0, 0)),
            new Waypoint(Vec2.of(3, 0)),
            new Waypoint(Vec2.of(3, 3))));
    }

    /** Index after each tick, with consecutive repeats dropped. */
    private static List<Integer> indexTrail(PathFollower f, int ticks) {
        List<Integer> trail = new ArrayList<>();
        for (int t = 1; t <= ticks; t++) {
            f.onTick(t);
            int idx = f.getCurrentIndex();
            if (trail.isEmpty() || trail.get(trail.size() - 1) != idx) trail.add(idx);
        }
        return trail;
    }

    @Test
    @DisplayName("LOOP wraps from the last point back to the first")
    void loop() {
        PathFollower f = new PathFollower(Vec2.of(9, 9), lPath(Vec2.ZERO), LoopType.LOOP, 10, 600);
        f.start(false, false, true);
        assertEquals(Vec2.ZERO, f.getPosition());

        assertEquals(List.of(2, 0, 1, 2, 0, 1, 2, 0), indexTrail(f, 8));
        assertFalse(f.isFinished());
    }

    @Test
    @DisplayName("PING_PONG reverses at both ends")
    void pingPong() {
        PathFollower f = new PathFollower(Vec2.ZERO, lPath(Vec2.ZERO), LoopType.PING_PONG, 10, 600);
        f.start(false, false, true);

        assertEquals(List.of(2, 1, 0, 1, 2, 1, 0, 1, 2, 1), indexTrail(f, 10));
    }

    @Test
    @DisplayName("ONCE stops on the last point")
    void once() {
        PathFollower f = new PathFollower(Vec2.ZERO, lPath(Vec2.ZERO), LoopType.ONCE, 10, 600);
        f.start(false, false, true);

        for (int t = 1; t <= 8; t++) f.onTick(t);

        assertTrue(f.isFinished());
        assertEquals(Vec2.of(3, 3), f.getPosition());
        assertEquals(BehaviorState.IDLE, f.getState());
        assertEquals(2, f.getCurrentIndex());
    }

    @Test
    @DisplayName("Moving is reported as wandering")
    void movingState() {
        PathFollower f = new PathFollower(Vec2.ZERO, lPath(Vec2.ZERO), LoopType.LOOP, 10, 600);
        f.start(false, false, true);
        f.onTick(1);

        assertEquals(BehaviorState.WANDERING, f.getState());
        assertEquals(Vec2.of(3, 0), f.getPosition());
        assertTrue(f.getWindow().isMoving());
    }

    @Test
    @DisplayName("Waypoints hold the follower for their wait time")
    void waits() {
        WaypointPath path = new WaypointPath(Vec2.ZERO, List.of(
            new Waypoint(Vec2.of(0, 0)),
            new Waypoint(Vec2.of(3, 0), 1.0, 1.0),
            new Waypoint(Vec2.of(3, 3))));
        PathFollower f = new PathFollower(Vec2.ZERO, path, LoopType.LOOP, 10, 600);
        f.start(false, false, true);

        f.onTick(1);
        assertTrue(f.isWaiting());
        assertEquals(Vec2.of(3, 0), f.getPosition());

        f.onTick(2);
        assertTrue(f.isWaiting());
        assertEquals(BehaviorState.IDLE, f.getState());
        f.onTick(3);
        assertFalse(f.isWaiting());
        assertEquals(2, f.getCurrentIndex());
        assertEquals(Vec2.of(3, 0), f.getPosition());

        f.onTick(4);
        assertEquals(Vec2.of(3, 3), f.getPosition());
    }

    @Test
    @DisplayName("Speed multiplier of the next point scales the step")
    void speedMultiplier() {
        WaypointPath path = new WaypointPath(Vec2.ZERO, List.of(
            new Waypoint(Vec2.of(0, 0)),
            new Waypoint(Vec2.of(3, 0), 0.0, 0.5)));
        PathFollower f = new PathFollower(Vec2.ZERO, path, LoopType.LOOP, 1, 600);
        f.start(false, false, true);

        f.onTick(1);

        assertEquals(0.3, f.getPosition().getX(), 1e-9);
    }

    @Test
    @DisplayName("A snapshot ignores later anchor moves")
    void snapshot() {
        WaypointPath path = lPath(Vec2.ZERO);
        PathFollower frozen = new PathFollower(Vec2.ZERO, path, LoopType.LOOP, 10, 600);
        PathFollower live = new PathFollower(Vec2.ZERO, path, LoopType.LOOP, 10, 600);
        frozen.start(false, true, true);
        live.start(false, false, true);

        path.setAnchor(Vec2.of(100, 0));
        frozen.onTick(1);
        live.onTick(1);

        assertEquals(Vec2.of(3, 0), frozen.getPosition());
        assertNotEquals(Vec2.of(3, 0), live.getPosition());
    }

    @Test
    @DisplayName("Reaching a point without a wait heads for the next one on the same tick")
    void noIdleTickOnArrival() {
        PathFollower f = new PathFollower(Vec2.ZERO, lPath(Vec2.ZERO), LoopType.LOOP, 5, 600);
        f.start(false, false, true);

        f.onTick(1);
        assertEquals(Vec2.of(3, 0), f.getPosition());
        assertEquals(2, f.getCurrentIndex());

        f.onTick(2);
        assertEquals(Vec2.of(3, 3), f.getPosition());
    }

    @Test
    @DisplayName("Starting at the nearest point skips earlier ones")
    void startAtNearest() {
        PathFollower f = new PathFollower(Vec2.of(3.2, 2.5), lPath(Vec2.ZERO), LoopType.LOOP, 10, 600);
        f.start(true, false, false);

        assertEquals(2, f.getCurrentIndex());
        assertEquals(Vec2.of(3.2, 2.5), f.getPosition());
    }

    @Test
    @DisplayName("An empty path stays idle in place")
    void emptyPath() {
        PathFollower f = new PathFollower(Vec2.of(1, 1), new WaypointPath(Vec2.ZERO, List.of()), LoopType.LOOP, 10, 600);
        f.start(true, true, true);
        f.onTick(1);

        assertEquals(Vec2.of(1, 1), f.getPosition());
        assertEquals(BehaviorState.IDLE, f.getState());
    }

    @Test
    @DisplayName("Loop type names parse leniently")
    void loopTypeParsing() {
        assertEquals(LoopType.PING_PONG, LoopType.fromString("ping-pong"));
        assertEquals(LoopType.PING_PONG, LoopType.fromString("PingPong"));
        assertEquals(LoopType.ONCE, LoopType.fromString(" once "));
        assertEquals(LoopType.LOOP, LoopType.fromString("spiral"));
        assertEquals(LoopType.LOOP, LoopType.fromString(null));
    }
}
