package me.baddcamden.runnersheet.effect;

import me.baddcamden.runnersheet.model.ImprovementSource;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Catalog entry describing everything one item grants.
 *
 * @param key     normalized lookup key, lowercase without a trailing rating
 * @param source  source the improvements are filed under; wins over where the item is installed
 * @param effects formulas evaluated in declaration order
 */
public record ItemEffect(String key, ImprovementSource source, List<EffectFormula> effects) {

    public ItemEffect {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(source, "source");
        key = key.trim().toLowerCase(Locale.ROOT);
        effects = effects == null ? List.of() : List.copyOf(effects);
    }

    public static ItemEffect of(String key, ImprovementSource source, EffectFormula... effects) {
        return new ItemEffect(key, source, List.of(effects));
    }
}
