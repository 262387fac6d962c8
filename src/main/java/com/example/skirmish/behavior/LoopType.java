package com.example.skirmish.behavior;

/**
 * How a {@link PathFollower} continues after the last waypoint.
 */
public enum LoopType {
    LOOP,       // wrap to the first point
    PING_PONG,  // reverse direction at either end
    ONCE;       // stop at the last point

    public static LoopType fromString(String str) {
        if (str == null) return LOOP;
        String s = str.trim().toUpperCase().replace('-', '_').replace(' ', '_');
        if (s.equals("PINGPONG")) return PING_PONG;
        try {
            return LoopType.valueOf(s);
        } catch (IllegalArgumentException e) {
            return LOOP;
        }
    }
}
