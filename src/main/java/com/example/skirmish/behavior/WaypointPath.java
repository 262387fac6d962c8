package com.example.skirmish.behavior;

import com.example.skirmish.model.Vec2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered waypoints placed relative to a movable anchor. Moving the anchor moves
 * every point; followers that snapshot at start are unaffected.
 */
public class WaypointPath {

    private final List<Waypoint> points;
    private volatile Vec2 anchor;

    public WaypointPath(Vec2 anchor, List<Waypoint> points) {
        this.anchor = Objects.requireNonNull(anchor, "anchor");
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    /** World position of point {@code i}; the index is clamped to the path. */
    public Vec2 getPoint(int i) {
        if (points.isEmpty()) return anchor;
        int idx = Math.max(0, Math.min(points.size() - 1, i));
        return anchor.add(points.get(idx).getOffset());
    }

    public double getWaitSeconds(int i) {
        if (i < 0 || i >= points.size()) return 0.0;
        return points.get(i).getWaitSeconds();
    }

    public double getSpeedMultiplier(int i) {
        if (i < 0 || i >= points.size()) return 1.0;
        return points.get(i).getSpeedMultiplier();
    }

    public List<Vec2> worldPoints() {
        List<Vec2> out = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) out.add(getPoint(i));
        return out;
    }

    public Vec2 getAnchor() {
        return anchor;
    }

    public void setAnchor(Vec2 anchor) {
        this.anchor = Objects.requireNonNull(anchor, "anchor");
    }
}
