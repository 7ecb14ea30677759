package me.baddcamden.runnersheet.effect;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@link EffectCatalog} backed by an ordered map. Keys are normalized to lower case so lookups
 * are insensitive to caller casing.
 */
public final class MapEffectCatalog implements EffectCatalog {

    private final Map<String, ItemEffect> entries;

    public MapEffectCatalog(Map<String, ItemEffect> entries) {
        Map<String, ItemEffect> normalized = new LinkedHashMap<>();
        if (entries != null) {
            for (ItemEffect entry : entries.values()) {
                normalized.put(entry.key(), entry);
            }
        }
        this.entries = Collections.unmodifiableMap(normalized);
    }

    /**
     * Returns a new catalog holding this catalog's entries plus {@code additions}; an addition
     * replaces an existing entry with the same key.
     */
    public MapEffectCatalog merge(Collection<ItemEffect> additions) {
        Map<String, ItemEffect> merged = new LinkedHashMap<>(entries);
        for (ItemEffect addition : additions) {
            merged.put(addition.key(), addition);
        }
        return new MapEffectCatalog(merged);
    }

    @Override
    public Optional<ItemEffect> find(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(key.trim().toLowerCase(Locale.ROOT)));
    }

    @Override
    public Collection<ItemEffect> entries() {
        return entries.values();
    }
}
