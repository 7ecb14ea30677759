package me.baddcamden.runnersheet.compute;

import me.baddcamden.runnersheet.model.AttributeCode;
import me.baddcamden.runnersheet.model.AttributeValue;
import me.baddcamden.runnersheet.model.Character;
import me.baddcamden.runnersheet.model.Improvement;
import me.baddcamden.runnersheet.model.ImprovementTarget;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves attribute values from a character plus its improvements.
 * <p>
 * The resolved value is the purchased base plus the stacked improvement total for the
 * attribute. It is deliberately not clamped to the metatype's augmented maximum; exceeding it is
 * a validation issue, not something the resolver hides. Magic and Resonance resolve to zero when
 * the character lacks the matching sub-record, whatever the attribute block holds.
 */
public class AttributeResolver {

    private final ImprovementAggregator aggregator;

    public AttributeResolver(ImprovementAggregator aggregator) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    }

    /**
     * Resolves one attribute, aggregating improvements from scratch.
     */
    public int resolveAttribute(Character character, AttributeCode code) {
        return stages(character, aggregator.aggregate(character), code).resolved();
    }

    /**
     * Resolves one attribute against improvements the caller already aggregated.
     */
    public int resolveAttribute(Character character, List<Improvement> improvements, AttributeCode code) {
        return stages(character, improvements, code).resolved();
    }

    /**
     * Natural value {@code base + bonus}, used for creation limit checks. Special attributes read
     * as zero when the character lacks the matching capability.
     */
    public int resolveNatural(Character character, AttributeCode code) {
        if (!present(character, code)) {
            return 0;
        }
        return character.attributes().get(code).total();
    }

    /**
     * Full staged breakdown for one attribute.
     *
     * @param character    character to read
     * @param improvements improvements aggregated from the same character
     * @param code         attribute to resolve
     * @return stages ending in the resolved value
     */
    public AttributeStages stages(Character character, List<Improvement> improvements, AttributeCode code) {
        Objects.requireNonNull(character, "character");
        Objects.requireNonNull(code, "code");
        if (!present(character, code)) {
            return AttributeStages.absent(code);
        }

        AttributeValue value = character.attributes().get(code);
        int improvementBonus = StackResolver.intTotalFor(improvements, ImprovementTarget.forAttribute(code));
        return new AttributeStages(
                code,
                value.base(),
                value.bonus(),
                value.total(),
                improvementBonus,
                value.base() + improvementBonus);
    }

    /**
     * Resolves every attribute code in one pass.
     */
    public Map<AttributeCode, AttributeStages> resolveAll(Character character, List<Improvement> improvements) {
        Map<AttributeCode, AttributeStages> resolved = new EnumMap<>(AttributeCode.class);
        for (AttributeCode code : AttributeCode.values()) {
            resolved.put(code, stages(character, improvements, code));
        }
        return resolved;
    }

    private static boolean present(Character character, AttributeCode code) {
        return switch (code) {
            case MAG -> character.magic() != null;
            case RES -> character.resonance() != null;
            default -> true;
        };
    }
}
