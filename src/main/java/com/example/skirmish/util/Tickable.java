package com.example.skirmish.util;

/**
 * Something driven by the {@link TickScheduler}. All simulation state changes
 * happen inside {@link #onTick(long)}.
 */
@FunctionalInterface
public interface Tickable {

    /**
     * @param tick the tick number, starting at 1 and increasing by one per call
     */
    void onTick(long tick);
}
