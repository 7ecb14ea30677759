package me.baddcamden.runnersheet.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything a character owns. Lists are defensively copied and unmodifiable; additions go
 * through the {@code with...} functions, which return a new value.
 */
public record Equipment(List<Weapon> weapons,
                        List<Armor> armor,
                        List<Cyberware> cyberware,
                        List<Bioware> bioware,
                        List<Gear> gear,
                        List<Vehicle> vehicles,
                        Lifestyle lifestyle) {

    public static final Equipment EMPTY = new Equipment(List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), null);

    public Equipment {
        weapons = weapons == null ? List.of() : List.copyOf(weapons);
        armor = armor == null ? List.of() : List.copyOf(armor);
        cyberware = cyberware == null ? List.of() : List.copyOf(cyberware);
        bioware = bioware == null ? List.of() : List.copyOf(bioware);
        gear = gear == null ? List.of() : List.copyOf(gear);
        vehicles = vehicles == null ? List.of() : List.copyOf(vehicles);
    }

    public Equipment withWeapons(List<Weapon> newWeapons) {
        return new Equipment(newWeapons, armor, cyberware, bioware, gear, vehicles, lifestyle);
    }

    public Equipment withArmor(List<Armor> newArmor) {
        return new Equipment(weapons, newArmor, cyberware, bioware, gear, vehicles, lifestyle);
    }

    public Equipment withCyberware(List<Cyberware> newCyberware) {
        return new Equipment(weapons, armor, newCyberware, bioware, gear, vehicles, lifestyle);
    }

    public Equipment withBioware(List<Bioware> newBioware) {
        return new Equipment(weapons, armor, cyberware, newBioware, gear, vehicles, lifestyle);
    }

    public Equipment withGear(List<Gear> newGear) {
        return new Equipment(weapons, armor, cyberware, bioware, newGear, vehicles, lifestyle);
    }

    public Equipment withVehicles(List<Vehicle> newVehicles) {
        return new Equipment(weapons, armor, cyberware, bioware, gear, newVehicles, lifestyle);
    }

    public Equipment withLifestyle(Lifestyle newLifestyle) {
        return new Equipment(weapons, armor, cyberware, bioware, gear, vehicles, newLifestyle);
    }

    public Equipment addCyberware(Cyberware implant) {
        List<Cyberware> updated = new ArrayList<>(cyberware);
        updated.add(implant);
        return withCyberware(updated);
    }

    public Equipment addBioware(Bioware implant) {
        List<Bioware> updated = new ArrayList<>(bioware);
        updated.add(implant);
        return withBioware(updated);
    }

    public Equipment addArmor(Armor piece) {
        List<Armor> updated = new ArrayList<>(armor);
        updated.add(piece);
        return withArmor(updated);
    }

    /**
     * Flattens every purchasable item subject to availability checks: weapons, armor, cyberware
     * (subsystems included) and gear. Bioware and vehicles are not part of the legality sweep.
     */
    public List<Purchasable> availabilityCheckedItems() {
        List<Purchasable> items = new ArrayList<>(weapons);
        items.addAll(armor);
        collectCyberware(cyberware, items);
        items.addAll(gear);
        return items;
    }

    private static void collectCyberware(List<Cyberware> implants, List<Purchasable> sink) {
        for (Cyberware implant : implants) {
            sink.add(implant);
            collectCyberware(implant.subsystems(), sink);
        }
    }
}
