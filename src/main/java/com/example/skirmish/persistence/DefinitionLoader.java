package com.example.skirmish.persistence;

import com.example.skirmish.model.CombatStyle;
import com.example.skirmish.model.DamageType;
import com.example.skirmish.model.EvolutionTier;
import com.example.skirmish.model.Faction;
import com.example.skirmish.model.NpcCombatProfile;
import com.example.skirmish.model.PetDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads NPC combat profiles and pet definitions from YAML resources.
 *
 * Entries without a key/id are skipped with a warning; a missing resource yields
 * an empty map.
 */
public class DefinitionLoader {

    private static final Logger logger = LoggerFactory.getLogger(DefinitionLoader.class);

    public static final String NPCS_RESOURCE = "/data/npcs.yaml";
    public static final String PETS_RESOURCE = "/data/pets.yaml";

    /**
     * Load NPC profiles keyed by their {@code key}, in file order.
     */
    public Map<String, NpcCombatProfile> loadNpcProfiles(String resourcePath) {
        Map<String, NpcCombatProfile> out = new LinkedHashMap<>();
        for (Map<String, Object> npc : readList(resourcePath, "npcs")) {
            String key = str(npc.get("key"));
            if (key == null || key.isEmpty()) {
                logger.warn("[DefinitionLoader] NPC entry without key in {} - skipped", resourcePath);
                continue;
            }
            NpcCombatProfile profile = NpcCombatProfile.builder(key)
                .name(str(npc.get("name")))
                .attackLevel(parseIntSafe(npc.get("attack_level"), 1))
                .strengthLevel(parseIntSafe(npc.get("strength_level"), 1))
                .defenceLevel(parseIntSafe(npc.get("defence_level"), 1))
                .hitpointsLevel(parseIntSafe(npc.get("hitpoints_level"), 10))
                .meleeDefence(parseIntSafe(npc.get("melee_defence"), 0))
                .rangeDefence(parseIntSafe(npc.get("range_defence"), 0))
                .magicDefence(parseIntSafe(npc.get("magic_defence"), 0))
                .attackSpeedTicks(parseIntSafe(npc.get("attack_speed_ticks"), 4))
                .attackType(DamageType.fromString(str(npc.get("attack_type"))))
                .style(CombatStyle.fromString(str(npc.get("style"))))
                .aggressive(parseBool(npc.get("aggressive")))
                .aggroRange(parseDoubleSafe(npc.get("aggro_range"), 0.0))
                .faction(Faction.fromString(str(npc.get("faction"))))
                .respawnTicks(parseIntSafe(npc.get("respawn_ticks"), 0))
                .build();
            if (out.put(key, profile) != null) {
                logger.warn("[DefinitionLoader] Duplicate NPC key '{}' in {} - later entry wins", key, resourcePath);
            }
        }
        logger.info("[DefinitionLoader] Loaded {} NPC profiles from {}", out.size(), resourcePath);
        return out;
    }

    public Map<String, NpcCombatProfile> loadNpcProfiles() {
        return loadNpcProfiles(NPCS_RESOURCE);
    }

    /**
     * Load pet definitions keyed by {@code id}, in file order.
     */
    @SuppressWarnings("unchecked")
    public Map<String, PetDefinition> loadPets(String resourcePath) {
        Map<String, PetDefinition> out = new LinkedHashMap<>();
        for (Map<String, Object> pet : readList(resourcePath, "pets")) {
            String id = str(pet.get("id"));
            if (id == null || id.isEmpty()) {
                logger.warn("[DefinitionLoader] Pet entry without id in {} - skipped", resourcePath);
                continue;
            }
            PetDefinition.Builder b = PetDefinition.builder(id)
                .displayName(str(pet.get("display_name")))
                .canFight(parseBool(pet.get("can_fight")))
                .attackLevel(parseIntSafe(pet.get("attack_level"), 1))
                .strengthLevel(parseIntSafe(pet.get("strength_level"), 1))
                .attackSpeedTicks(parseIntSafe(pet.get("attack_speed_ticks"), 4))
                .accuracyBonus(parseIntSafe(pet.get("accuracy_bonus"), 0))
                .damageBonus(parseIntSafe(pet.get("damage_bonus"), 0))
                .moveSpeed(parseDoubleSafe(pet.get("move_speed"), 0.0))
                .attackLevelPerBeastmasterLevel(parseDoubleSafe(pet.get("attack_per_beastmaster_level"), 0.0))
                .strengthLevelPerBeastmasterLevel(parseDoubleSafe(pet.get("strength_per_beastmaster_level"), 0.0))
                .maxHitPerBeastmasterLevel(parseDoubleSafe(pet.get("max_hit_per_beastmaster_level"), 0.0));

            Object tiers = pet.get("evolution_tiers");
            if (tiers instanceof List) {
                for (Object o : (List<Object>) tiers) {
                    if (!(o instanceof Map)) continue;
                    Map<String, Object> t = (Map<String, Object>) o;
                    b.evolutionTier(new EvolutionTier(parseIntSafe(t.get("level"), 1), str(t.get("name")),
                        parseDoubleSafe(t.get("scale"), 1.0)));
                }
            }
            out.put(id, b.build());
        }
        logger.info("[DefinitionLoader] Loaded {} pet definitions from {}", out.size(), resourcePath);
        return out;
    }

    public Map<String, PetDefinition> loadPets() {
        return loadPets(PETS_RESOURCE);
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> readList(String resourcePath, String rootKey) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is == null) {
                logger.warn("[DefinitionLoader] Resource not found: {}", resourcePath);
                return Collections.emptyList();
            }
            Yaml yaml = new Yaml();
            Object root = yaml.load(is);
            if (!(root instanceof Map)) return Collections.emptyList();
            Object list = ((Map<String, Object>) root).get(rootKey);
            if (!(list instanceof List)) return Collections.emptyList();
            List<Map<String, Object>> out = new ArrayList<>();
            for (Object o : (List<Object>) list) {
                if (o instanceof Map) out.add((Map<String, Object>) o);
            }
            return out;
        } catch (Exception e) {
            logger.warn("[DefinitionLoader] Failed to read {}: {}", resourcePath, e.getMessage());
            return Collections.emptyList();
        }
    }

    private static String str(Object o) {
        return o == null ? null : o.toString().trim();
    }

    private static int parseIntSafe(Object o, int def) {
        if (o == null) return def;
        if (o instanceof Number) return ((Number) o).intValue();
        try {
            return Integer.parseInt(o.toString().trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    private static double parseDoubleSafe(Object o, double def) {
        if (o == null) return def;
        if (o instanceof Number) return ((Number) o).doubleValue();
        try {
            return Double.parseDouble(o.toString().trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    private static boolean parseBool(Object o) {
        if (o instanceof Boolean) return (Boolean) o;
        return o != null && Boolean.parseBoolean(o.toString().trim());
    }
}
