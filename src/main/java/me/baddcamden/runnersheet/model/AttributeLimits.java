package me.baddcamden.runnersheet.model;

/**
 * Metatype boundaries for one attribute.
 * <p>
 * {@code min} and {@code max} bound the natural value bought with build points or karma, while
 * {@code aug} is the ceiling for the augmented value once cyberware, bioware and powers are
 * applied. Out-of-range values are reported as validation issues, never forced into range.
 */
public record AttributeLimits(int min, int max, int aug) {

    /** Baseline human range for physical and mental attributes. */
    public static final AttributeLimits STANDARD = new AttributeLimits(1, 6, 9);

    /** Edge, Magic and Resonance cannot be augmented beyond their natural maximum. */
    public static final AttributeLimits SPECIAL = new AttributeLimits(1, 6, 6);

    /**
     * Limits assumed for an attribute that the metatype does not list explicitly.
     */
    public static AttributeLimits defaultFor(AttributeCode code) {
        return code == AttributeCode.EDG || code.isSpecial() ? SPECIAL : STANDARD;
    }

    public AttributeLimits {
        if (max < min) {
            throw new IllegalArgumentException("Max must be greater than or equal to min");
        }
        if (aug < max) {
            throw new IllegalArgumentException("Augmented max must be greater than or equal to max");
        }
    }

    /**
     * Same range with the natural and augmented maximums lifted by {@code amount}.
     */
    public AttributeLimits raisedBy(int amount) {
        return new AttributeLimits(min, max + amount, aug + amount);
    }
}
