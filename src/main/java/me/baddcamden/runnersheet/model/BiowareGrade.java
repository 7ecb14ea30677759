package me.baddcamden.runnersheet.model;

/**
 * Bioware grades. Cultured bioware is grown for its recipient and costs less essence.
 */
public enum BiowareGrade {
    STANDARD("Standard", 1.0d, 1.0d, 0),
    CULTURED("Cultured", 0.75d, 4.0d, 4);

    private final String displayName;
    private final double essenceMultiplier;
    private final double costMultiplier;
    private final int availabilityModifier;

    BiowareGrade(String displayName, double essenceMultiplier, double costMultiplier, int availabilityModifier) {
        this.displayName = displayName;
        this.essenceMultiplier = essenceMultiplier;
        this.costMultiplier = costMultiplier;
        this.availabilityModifier = availabilityModifier;
    }

    public String displayName() {
        return displayName;
    }

    public double essenceMultiplier() {
        return essenceMultiplier;
    }

    public double costMultiplier() {
        return costMultiplier;
    }

    public int availabilityModifier() {
        return availabilityModifier;
    }

    public int adjustCost(int baseCost) {
        return (int) Math.floor(baseCost * costMultiplier);
    }
}
