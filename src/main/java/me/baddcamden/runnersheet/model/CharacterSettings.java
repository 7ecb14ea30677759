package me.baddcamden.runnersheet.model;

/**
 * Per-character creation settings.
 *
 * @param maxAvailability highest availability rating purchasable during creation
 * @param allowForbidden  whether forbidden ({@code F}) items may be bought during creation
 */
public record CharacterSettings(int maxAvailability, boolean allowForbidden) {

    public static final CharacterSettings DEFAULT = new CharacterSettings(12, false);

    public CharacterSettings {
        if (maxAvailability < 0) {
            throw new IllegalArgumentException("Max availability cannot be negative");
        }
    }
}
