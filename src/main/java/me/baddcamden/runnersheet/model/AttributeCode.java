package me.baddcamden.runnersheet.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Attribute codes used throughout the engine. The lowercase {@link #code()} matches the short
 * names used in game data and improvement targets ({@code bod}, {@code agi}, ...).
 */
public enum AttributeCode {
    BOD("Body"),
    AGI("Agility"),
    REA("Reaction"),
    STR("Strength"),
    CHA("Charisma"),
    INT("Intuition"),
    LOG("Logic"),
    WIL("Willpower"),
    EDG("Edge"),
    MAG("Magic"),
    RES("Resonance");

    /** Physical and mental attributes every metatype carries; special attributes excluded. */
    public static final Set<AttributeCode> CORE = EnumSet.of(BOD, AGI, REA, STR, CHA, INT, LOG, WIL);

    private final String displayName;

    AttributeCode(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Short lowercase code, e.g. {@code "wil"}.
     */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether this attribute only exists on awakened or emerged characters.
     */
    public boolean isSpecial() {
        return this == MAG || this == RES;
    }

    /**
     * Case-insensitive lookup by short code. Returns empty for {@code null} or unknown codes.
     */
    public static Optional<AttributeCode> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (AttributeCode candidate : values()) {
            if (candidate.name().equals(normalized)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
