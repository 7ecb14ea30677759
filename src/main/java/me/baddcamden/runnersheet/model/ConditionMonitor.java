package me.baddcamden.runnersheet.model;

/**
 * Damage currently marked on the character and remaining Edge points.
 */
public record ConditionMonitor(int physicalDamage, int stunDamage, int edgeCurrent) {

    public static final ConditionMonitor UNHARMED = new ConditionMonitor(0, 0, 0);

    public ConditionMonitor {
        if (physicalDamage < 0 || stunDamage < 0) {
            throw new IllegalArgumentException("Damage cannot be negative");
        }
    }

    public static ConditionMonitor damaged(int physicalDamage, int stunDamage) {
        return new ConditionMonitor(physicalDamage, stunDamage, 0);
    }
}
