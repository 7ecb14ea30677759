package me.baddcamden.runnersheet.model;

import java.util.List;
import java.util.Objects;

/**
 * A cyberware implant, either a catalog candidate awaiting installation or an installed piece.
 *
 * @param id           unique identifier; assigned on installation when blank
 * @param name         display name, possibly carrying an embedded rating ("Wired Reflexes 2")
 * @param category     catalog category (Headware, Bodyware, ...)
 * @param grade        grade whose multipliers apply to essence and cost
 * @param rating       explicit rating, or {@code 0} when the name carries it
 * @param essence      base essence cost at Standard grade
 * @param cost         base nuyen cost at Standard grade
 * @param availability availability text, e.g. {@code "8R"}
 * @param subsystems   nested implants (cyberlimb enhancements, eyeware options, ...)
 * @param effectKey    stable effect-catalog key; {@code null} falls back to the display name
 */
public record Cyberware(String id,
                        String name,
                        String category,
                        CyberwareGrade grade,
                        int rating,
                        double essence,
                        int cost,
                        String availability,
                        List<Cyberware> subsystems,
                        String effectKey) implements Purchasable {

    public Cyberware {
        Objects.requireNonNull(name, "name");
        grade = grade == null ? CyberwareGrade.STANDARD : grade;
        subsystems = subsystems == null ? List.of() : List.copyOf(subsystems);
        if (!Double.isFinite(essence) || essence < 0) {
            throw new IllegalArgumentException("Essence cost must be a finite, non-negative number");
        }
        if (cost < 0) {
            throw new IllegalArgumentException("Cost cannot be negative");
        }
    }

    public static Cyberware of(String name, int rating, double essence, int cost, String availability) {
        return new Cyberware(null, name, "Bodyware", CyberwareGrade.STANDARD, rating, essence, cost, availability, List.of(), null);
    }

    /**
     * Grade-adjusted essence of this implant alone, subsystems excluded.
     */
    public double gradedEssence() {
        return essence * grade.essenceMultiplier();
    }

    /**
     * Grade-adjusted nuyen cost of this implant alone.
     */
    public int gradedCost() {
        return grade.adjustCost(cost);
    }

    @Override
    public int availabilityModifier() {
        return grade.availabilityModifier();
    }

    public Cyberware withId(String newId) {
        return new Cyberware(newId, name, category, grade, rating, essence, cost, availability, subsystems, effectKey);
    }

    public Cyberware withGrade(CyberwareGrade newGrade) {
        return new Cyberware(id, name, category, newGrade, rating, essence, cost, availability, subsystems, effectKey);
    }

    public Cyberware withSubsystems(List<Cyberware> newSubsystems) {
        return new Cyberware(id, name, category, grade, rating, essence, cost, availability, newSubsystems, effectKey);
    }
}
