package com.example.skirmish.model;

public enum EquipmentSlot {
    HEAD("head", "Head"),
    CAPE("cape", "Cape"),
    AMULET("amulet", "Amulet"),
    AMMO("ammo", "Ammo"),
    WEAPON("weapon", "Weapon"),
    BODY("body", "Body"),
    SHIELD("shield", "Shield"),
    LEGS("legs", "Legs"),
    HANDS("hands", "Hands"),
    FEET("feet", "Feet"),
    RING("ring", "Ring");

    private final String key;
    private final String displayName;

    EquipmentSlot(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String getKey() { return key; }
    public String getDisplayName() { return displayName; }

    public static EquipmentSlot fromString(String str) {
        if (str == null) return null;
        String k = str.trim().toLowerCase();
        for (EquipmentSlot s : values()) if (s.key.equals(k)) return s;
        return null;
    }
}
