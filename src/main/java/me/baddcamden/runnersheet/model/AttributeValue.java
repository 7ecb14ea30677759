package me.baddcamden.runnersheet.model;

/**
 * Purchased value of a single attribute.
 *
 * @param base  points bought during creation or raised in career play
 * @param bonus flat bonus recorded on the sheet (imported or manually entered)
 * @param karma karma spent on the attribute; provenance only, never added to the total
 */
public record AttributeValue(int base, int bonus, int karma) {

    public static final AttributeValue ZERO = new AttributeValue(0, 0, 0);

    public static AttributeValue of(int base) {
        return new AttributeValue(base, 0, 0);
    }

    /**
     * Natural total used for limit checks: {@code base + bonus}.
     */
    public int total() {
        return base + bonus;
    }

    public AttributeValue withBase(int newBase) {
        return new AttributeValue(newBase, bonus, karma);
    }

    /**
     * Raises the base by one and records the karma paid for it.
     */
    public AttributeValue advance(int karmaSpent) {
        return new AttributeValue(base + 1, bonus, karma + karmaSpent);
    }
}
