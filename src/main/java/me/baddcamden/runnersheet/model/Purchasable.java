package me.baddcamden.runnersheet.model;

/**
 * Anything bought with nuyen that carries an availability rating and is therefore subject to
 * creation-mode legality checks.
 */
public interface Purchasable {

    String id();

    String name();

    /**
     * Raw availability text as printed in game data, e.g. {@code "12R"} or {@code "8+2F"}.
     */
    String availability();

    /**
     * Adjustment added to the parsed availability rating, e.g. from an augmentation grade.
     */
    default int availabilityModifier() {
        return 0;
    }
}
