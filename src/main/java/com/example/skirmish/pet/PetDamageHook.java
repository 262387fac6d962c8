package com.example.skirmish.pet;

/**
 * Called each time a pet's hit removes hitpoints.
 */
@FunctionalInterface
public interface PetDamageHook {
    void onPetDamage(PetOwner owner, int damage);
}
