package me.baddcamden.runnersheet.model;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Stat an improvement modifies. Attribute targets map one-to-one onto {@link AttributeCode}.
 */
public enum ImprovementTarget {
    BOD,
    AGI,
    REA,
    STR,
    CHA,
    INT,
    LOG,
    WIL,
    EDG,
    MAG,
    RES,
    INITIATIVE,
    INITIATIVE_DICE,
    ARMOR_BALLISTIC,
    ARMOR_IMPACT,
    PHYSICAL_CM,
    STUN_CM,
    SKILL,
    PHYSICAL_LIMIT,
    MENTAL_LIMIT,
    SOCIAL_LIMIT,
    DAMAGE_RESISTANCE,
    SPELL_RESISTANCE,
    MEMORY,
    COMPOSURE,
    JUDGE_INTENTIONS;

    private static final Map<AttributeCode, ImprovementTarget> BY_ATTRIBUTE = new EnumMap<>(AttributeCode.class);

    static {
        for (AttributeCode code : AttributeCode.values()) {
            BY_ATTRIBUTE.put(code, valueOf(code.name()));
        }
    }

    public static ImprovementTarget forAttribute(AttributeCode code) {
        return BY_ATTRIBUTE.get(code);
    }

    /**
     * Lowercase identifier, e.g. {@code initiative_dice}.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ImprovementTarget> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = key.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ImprovementTarget target : values()) {
            if (target.name().equals(normalized)) {
                return Optional.of(target);
            }
        }
        return Optional.empty();
    }
}
