package me.baddcamden.runnersheet.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of attribute values keyed by {@link AttributeCode}. Magic and Resonance are
 * simply absent on mundane characters; every other code reads as {@link AttributeValue#ZERO}
 * when missing.
 */
public final class AttributeBlock {

    private final Map<AttributeCode, AttributeValue> values;

    private AttributeBlock(Map<AttributeCode, AttributeValue> values) {
        EnumMap<AttributeCode, AttributeValue> copy = new EnumMap<>(AttributeCode.class);
        copy.putAll(values);
        this.values = Collections.unmodifiableMap(copy);
    }

    public static AttributeBlock empty() {
        return new AttributeBlock(Map.of());
    }

    /**
     * Seeds every core attribute and Edge with the same base value.
     */
    public static AttributeBlock uniform(int base) {
        EnumMap<AttributeCode, AttributeValue> seeded = new EnumMap<>(AttributeCode.class);
        for (AttributeCode code : AttributeCode.CORE) {
            seeded.put(code, AttributeValue.of(base));
        }
        seeded.put(AttributeCode.EDG, AttributeValue.of(base));
        return new AttributeBlock(seeded);
    }

    public static AttributeBlock of(Map<AttributeCode, AttributeValue> values) {
        return new AttributeBlock(values);
    }

    /**
     * Returns the stored value, or {@link AttributeValue#ZERO} when the code is absent.
     */
    public AttributeValue get(AttributeCode code) {
        return values.getOrDefault(code, AttributeValue.ZERO);
    }

    public Optional<AttributeValue> find(AttributeCode code) {
        return Optional.ofNullable(values.get(code));
    }

    public boolean has(AttributeCode code) {
        return values.containsKey(code);
    }

    public AttributeBlock with(AttributeCode code, AttributeValue value) {
        EnumMap<AttributeCode, AttributeValue> updated = new EnumMap<>(AttributeCode.class);
        updated.putAll(values);
        updated.put(code, value);
        return new AttributeBlock(updated);
    }

    public AttributeBlock withBase(AttributeCode code, int base) {
        return with(code, get(code).withBase(base));
    }

    public Map<AttributeCode, AttributeValue> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof AttributeBlock block)) {
            return false;
        }
        return values.equals(block.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "AttributeBlock" + values;
    }
}
