package me.baddcamden.runnersheet.config;

import me.baddcamden.runnersheet.model.Character;
import me.baddcamden.runnersheet.model.Metatype;
import me.baddcamden.runnersheet.model.Result;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Metatypes known to the engine, looked up case-insensitively by name.
 */
public final class MetatypeCatalog {

    private final Map<String, Metatype> metatypes;

    public MetatypeCatalog(Collection<Metatype> metatypes) {
        Map<String, Metatype> byName = new LinkedHashMap<>();
        for (Metatype metatype : metatypes) {
            byName.put(normalize(metatype.name()), metatype);
        }
        this.metatypes = Collections.unmodifiableMap(byName);
    }

    public Optional<Metatype> find(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(metatypes.get(normalize(name)));
    }

    public Collection<Metatype> all() {
        return metatypes.values();
    }

    /**
     * Applies the named metatype to a character: name, attribute limits and metatype BP cost.
     *
     * @return the updated character, or a failure carrying the unchanged character when the
     * name is unknown
     */
    public Result<Character> apply(Character character, String name) {
        Objects.requireNonNull(character, "character");
        return find(name)
                .map(metatype -> Result.ok(character.withMetatype(metatype)))
                .orElseGet(() -> Result.failure(character, "Unknown metatype: " + name));
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
