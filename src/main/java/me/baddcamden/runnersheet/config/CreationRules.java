package me.baddcamden.runnersheet.config;

import me.baddcamden.runnersheet.model.CharacterSettings;

/**
 * Character creation budget and caps.
 *
 * @param maxAvailability        default availability cap for new characters
 * @param allowForbidden         whether new characters may buy forbidden items
 * @param buildPoints            build point budget for new characters
 * @param startingEssence        essence before any augmentation
 * @param positiveQualityCap     most build points spendable on positive qualities
 * @param negativeQualityCap     most build points gainable from negative qualities
 * @param resourcesCap           most build points convertible into nuyen
 * @param skillRatingCap         highest active skill rating during creation
 */
public record CreationRules(int maxAvailability,
                            boolean allowForbidden,
                            int buildPoints,
                            double startingEssence,
                            int positiveQualityCap,
                            int negativeQualityCap,
                            int resourcesCap,
                            int skillRatingCap) {

    public static final CreationRules DEFAULTS = new CreationRules(12, false, 400, 6.0d, 35, 35, 50, 6);

    public CreationRules {
        if (maxAvailability < 0 || buildPoints < 0 || startingEssence < 0) {
            throw new IllegalArgumentException("Creation budget values cannot be negative");
        }
        if (positiveQualityCap < 0 || negativeQualityCap < 0 || resourcesCap < 0 || skillRatingCap < 0) {
            throw new IllegalArgumentException("Creation caps cannot be negative");
        }
    }

    public CharacterSettings defaultSettings() {
        return new CharacterSettings(maxAvailability, allowForbidden);
    }
}
