package com.example.skirmish.pet;

import com.example.skirmish.combat.ExperienceSink;
import com.example.skirmish.combat.SkillProvider;
import com.example.skirmish.model.Vec2;

/**
 * Whoever a pet follows and fights for. Its Beastmaster level scales the pet.
 */
public interface PetOwner extends SkillProvider, ExperienceSink {

    String getName();

    Vec2 getPosition();
}
