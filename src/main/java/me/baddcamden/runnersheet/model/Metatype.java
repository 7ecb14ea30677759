package me.baddcamden.runnersheet.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Metatype reference entry: build point cost and per-attribute limits. Attributes the entry does
 * not list fall back to {@link AttributeLimits#defaultFor(AttributeCode)}.
 */
public record Metatype(String name, int bp, Map<AttributeCode, AttributeLimits> limits) {

    public Metatype {
        Objects.requireNonNull(name, "name");
        EnumMap<AttributeCode, AttributeLimits> copy = new EnumMap<>(AttributeCode.class);
        if (limits != null) {
            copy.putAll(limits);
        }
        limits = Collections.unmodifiableMap(copy);
    }

    public AttributeLimits limitsFor(AttributeCode code) {
        return limits.getOrDefault(code, AttributeLimits.defaultFor(code));
    }

    /**
     * Full limit table with every attribute code present.
     */
    public Map<AttributeCode, AttributeLimits> completeLimits() {
        EnumMap<AttributeCode, AttributeLimits> complete = new EnumMap<>(AttributeCode.class);
        for (AttributeCode code : AttributeCode.values()) {
            complete.put(code, limitsFor(code));
        }
        return complete;
    }
}
