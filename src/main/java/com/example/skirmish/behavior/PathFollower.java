package com.example.skirmish.behavior;

import com.example.skirmish.model.Vec2;

import java.util.List;
import java.util.Objects;

/**
 * Walks a {@link WaypointPath}, honouring per-point waits and speed multipliers.
 *
 * The follower is {@link BehaviorState#WANDERING} while moving and
 * {@link BehaviorState#IDLE} while waiting at a point or after a ONCE path ends.
 */
public class PathFollower extends TickMover {

    private final WaypointPath path;
    private final LoopType loopType;
    private final double moveSpeed;
    private double arriveDistance = Wanderer.DEFAULT_ARRIVE_DISTANCE;

    private List<Vec2> snapshot;            // Frozen world points, when snapshotting
    private int index;
    private int step = 1;                   // PING_PONG direction
    private double waitRemaining;
    private boolean finished;
    private BehaviorState state = BehaviorState.IDLE;

    public PathFollower(Vec2 start, WaypointPath path, LoopType loopType, double moveSpeed, long tickDurationMs) {
        super(start, tickDurationMs);
        this.path = Objects.requireNonNull(path, "path");
        this.loopType = loopType != null ? loopType : LoopType.LOOP;
        this.moveSpeed = Math.max(0.0, moveSpeed);
    }

    public void setArriveDistance(double arriveDistance) {
        this.arriveDistance = Math.max(0.0, arriveDistance);
    }

    /**
     * Prepare for traversal.
     * @param startAtNearest begin at the point closest to the current position
     * @param snapshotAtStart freeze the path's world positions now
     * @param snapToFirst place the agent on the starting point immediately
     */
    public void start(boolean startAtNearest, boolean snapshotAtStart, boolean snapToFirst) {
        snapshot = snapshotAtStart ? path.worldPoints() : null;
        index = 0;
        step = 1;
        waitRemaining = 0;
        finished = false;
        if (pointCount() == 0) return;
        if (startAtNearest) index = nearestIndex(getPosition());
        if (snapToFirst) teleport(point(index));
    }

    @Override
    protected Vec2 nextPosition(long tick) {
        int n = pointCount();
        if (n == 0 || finished) {
            state = BehaviorState.IDLE;
            return null;
        }

        if (waitRemaining > 0) {
            state = BehaviorState.IDLE;
            waitRemaining -= tickSeconds();
            if (waitRemaining <= 0) {
                waitRemaining = 0;
                advance();
            }
            return null;
        }

        Vec2 current = getPosition();
        if (current.distanceTo(point(index)) <= arriveDistance && arrive()) {
            state = BehaviorState.IDLE;
            return null;
        }

        state = BehaviorState.WANDERING;
        Vec2 target = point(index);
        double speed = moveSpeed * path.getSpeedMultiplier(index);
        Vec2 next = current.moveTowards(target, speed * tickSeconds());
        if (next.distanceTo(target) <= arriveDistance) {
            arrive();
        }
        return next;
    }

    /**
     * Handle reaching the current point: start its wait or move on to the next one.
     * @return true when the follower has to stay put (waiting, or a ONCE path is done)
     */
    private boolean arrive() {
        double wait = path.getWaitSeconds(index);
        if (wait > 0) {
            waitRemaining = wait;
            return true;
        }
        advance();
        return finished;
    }

    private void advance() {
        int n = pointCount();
        if (n == 0) return;
        switch (loopType) {
            case ONCE:
                if (index >= n - 1) {
                    finished = true;
                    state = BehaviorState.IDLE;
                    return;
                }
                index++;
                break;
            case PING_PONG:
                if (n == 1) return;
                index += step;
                if (index >= n) {
                    index = n - 2;
                    step = -1;
                } else if (index < 0) {
                    index = 1;
                    step = 1;
                }
                break;
            case LOOP:
            default:
                index = (index + 1) % n;
                break;
        }
    }

    private int pointCount() {
        return snapshot != null ? snapshot.size() : path.size();
    }

    private Vec2 point(int i) {
        if (snapshot != null) {
            if (snapshot.isEmpty()) return getPosition();
            return snapshot.get(Math.max(0, Math.min(snapshot.size() - 1, i)));
        }
        return path.getPoint(i);
    }

    private int nearestIndex(Vec2 from) {
        int best = 0;
        double bestDist = Double.MAX_VALUE;
        for (int i = 0; i < pointCount(); i++) {
            double d = from.distanceTo(point(i));
            if (d < bestDist) {
                bestDist = d;
                best = i;
            }
        }
        return best;
    }

    @Override
    public BehaviorState getState() {
        return state;
    }

    public int getCurrentIndex() { return index; }
    public boolean isFinished() { return finished; }
    public boolean isWaiting() { return waitRemaining > 0; }
    public LoopType getLoopType() { return loopType; }
}
