package me.baddcamden.runnersheet.model;

/**
 * Cyberware grades trading essence cost against nuyen cost.
 */
public enum CyberwareGrade {
    STANDARD("Standard", 1.0d, 1.0d, 0),
    ALPHAWARE("Alphaware", 0.8d, 2.0d, 0),
    BETAWARE("Betaware", 0.7d, 4.0d, 0),
    DELTAWARE("Deltaware", 0.5d, 10.0d, 0),
    USED("Used", 1.2d, 0.5d, -1);

    private final String displayName;
    private final double essenceMultiplier;
    private final double costMultiplier;
    private final int availabilityModifier;

    CyberwareGrade(String displayName, double essenceMultiplier, double costMultiplier, int availabilityModifier) {
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

    /**
     * Grade-adjusted nuyen cost, rounded down to whole nuyen.
     */
    public int adjustCost(int baseCost) {
        return (int) Math.floor(baseCost * costMultiplier);
    }
}
