package com.example.skirmish.combat;

import com.example.skirmish.model.Faction;
import com.example.skirmish.model.Vec2;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Everything an aggressive NPC can look for: players and faction-tagged NPCs.
 * Iteration follows registration order.
 */
public class TargetRegistry {

    private final List<CombatTarget> players = new CopyOnWriteArrayList<>();
    private final List<CombatTarget> npcs = new CopyOnWriteArrayList<>();
    private final Map<CombatTarget, Faction> factions = new ConcurrentHashMap<>();

    public void registerPlayer(CombatTarget player) {
        if (player != null && !players.contains(player)) players.add(player);
    }

    public void registerNpc(CombatTarget npc, Faction faction) {
        if (npc == null) return;
        if (!npcs.contains(npc)) npcs.add(npc);
        factions.put(npc, faction != null ? faction : Faction.NEUTRAL);
    }

    public void unregister(CombatTarget target) {
        if (target == null) return;
        players.remove(target);
        npcs.remove(target);
        factions.remove(target);
    }

    public List<CombatTarget> getPlayers() {
        return new ArrayList<>(players);
    }

    public List<CombatTarget> getNpcs() {
        return new ArrayList<>(npcs);
    }

    public Faction getFaction(CombatTarget target) {
        Faction f = factions.get(target);
        return f != null ? f : Faction.NEUTRAL;
    }

    /**
     * First living player within {@code range} of {@code point}, or null.
     */
    public CombatTarget findPlayerNear(Vec2 point, double range) {
        for (CombatTarget p : players) {
            if (!p.isAlive()) continue;
            if (p.getPosition().distanceTo(point) <= range) return p;
        }
        return null;
    }

    /**
     * First living NPC hostile to {@code faction} within {@code range} of {@code point}, or null.
     */
    public CombatTarget findHostileNpc(CombatTarget self, Faction faction, Vec2 point, double range) {
        for (CombatTarget npc : npcs) {
            if (npc == self || !npc.isAlive()) continue;
            if (!Faction.areEnemies(faction, getFaction(npc))) continue;
            if (npc.getPosition().distanceTo(point) <= range) return npc;
        }
        return null;
    }
}
