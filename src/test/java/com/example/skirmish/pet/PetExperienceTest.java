package com.example.skirmish.pet;

import com.example.skirmish.model.EvolutionTier;
import com.example.skirmish.model.PetDefinition;
import com.example.skirmish.util.ExperienceTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PetExperience Tests")
public class PetExperienceTest {

    private final PetDefinition hawk = PetDefinition.builder("hawk")
        .evolutionTier(new EvolutionTier(40, "Falcon", 1.5))
        .evolutionTier(new EvolutionTier(1, "Chick", 0.5))
        .build();

    @Test
    @DisplayName("Gaining XP raises the level and notifies listeners")
    void levelUp() {
        PetExperience exp = new PetExperience(hawk);
        List<Integer> levels = new ArrayList<>();
        exp.addLevelListener(levels::add);
        assertEquals(83, exp.getXpToNextLevel());

        exp.addXp(50);
        exp.addXp(33);

        assertEquals(2, exp.getLevel());
        assertEquals(List.of(2), levels);
        assertEquals(ExperienceTable.xpForLevel(3) - 83, exp.getXpToNextLevel());
    }

    @Test
    @DisplayName("Evolution tier follows the level")
    void tiers() {
        PetExperience young = new PetExperience(hawk);
        assertEquals("Chick", young.getTierName());
        assertEquals(0.5, young.getScale(), 1e-9);

        PetExperience grown = new PetExperience(hawk, ExperienceTable.xpForLevel(40));
        assertEquals(40, grown.getLevel());
        assertEquals("Falcon", grown.getTierName());
        assertEquals(1.5, grown.getScale(), 1e-9);
    }

    @Test
    @DisplayName("No tier before the first tier level")
    void noTierYet() {
        PetDefinition late = PetDefinition.builder("late").evolutionTier(new EvolutionTier(5, "Adult", 2.0)).build();
        PetExperience exp = new PetExperience(late);

        assertNull(exp.getCurrentTier());
        assertEquals("", exp.getTierName());
        assertEquals(1.0, exp.getScale(), 1e-9);
    }

    @Test
    @DisplayName("Max level pets stop gaining XP")
    void maxLevel() {
        PetExperience exp = new PetExperience(hawk, ExperienceTable.xpForLevel(99));
        double before = exp.getXp();

        exp.addXp(1000);
        exp.addXp(-5);

        assertEquals(before, exp.getXp(), 1e-9);
        assertEquals(0, exp.getXpToNextLevel());
    }
}
