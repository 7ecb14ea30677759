package me.baddcamden.runnersheet.model;

import java.util.Objects;

/**
 * A bioware implant. Shares the essence budget with cyberware but uses its own grade table.
 */
public record Bioware(String id,
                      String name,
                      String category,
                      BiowareGrade grade,
                      int rating,
                      double essence,
                      int cost,
                      String availability,
                      String effectKey) implements Purchasable {

    public Bioware {
        Objects.requireNonNull(name, "name");
        grade = grade == null ? BiowareGrade.STANDARD : grade;
        if (!Double.isFinite(essence) || essence < 0) {
            throw new IllegalArgumentException("Essence cost must be a finite, non-negative number");
        }
        if (cost < 0) {
            throw new IllegalArgumentException("Cost cannot be negative");
        }
    }

    public static Bioware of(String name, int rating, double essence, int cost, String availability) {
        return new Bioware(null, name, "Basic", BiowareGrade.STANDARD, rating, essence, cost, availability, null);
    }

    public double gradedEssence() {
        return essence * grade.essenceMultiplier();
    }

    public int gradedCost() {
        return grade.adjustCost(cost);
    }

    public Bioware withId(String newId) {
        return new Bioware(newId, name, category, grade, rating, essence, cost, availability, effectKey);
    }

    public Bioware withGrade(BiowareGrade newGrade) {
        return new Bioware(id, name, category, newGrade, rating, essence, cost, availability, effectKey);
    }
}
