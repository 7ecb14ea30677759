package me.baddcamden.runnersheet.effect;

import java.util.Collection;
import java.util.Optional;

/**
 * Lookup table from stable item keys to the effects those items grant.
 */
public interface EffectCatalog {

    /**
     * Finds the entry for a normalized key.
     *
     * @param key lowercase key without a trailing rating, see {@link CatalogKey}
     * @return the entry, or empty when the item grants nothing the engine models
     */
    Optional<ItemEffect> find(String key);

    /**
     * Every registered entry, in registration order.
     */
    Collection<ItemEffect> entries();

    /**
     * Catalog holding the built-in ruleset effects.
     */
    static EffectCatalog standard() {
        return new MapEffectCatalog(StandardEffects.definitions());
    }
}
