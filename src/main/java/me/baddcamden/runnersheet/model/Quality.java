package me.baddcamden.runnersheet.model;

import java.util.Objects;

/**
 * A positive or negative quality.
 *
 * @param bp     build points paid (positive) or gained (negative, stored as a negative number)
 * @param rating level for rated qualities such as Will to Live; {@code 1} otherwise
 */
public record Quality(String id, String name, Category category, int bp, int rating) {

    public enum Category {
        POSITIVE,
        NEGATIVE
    }

    public Quality {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
    }

    public static Quality positive(String name, int bp) {
        return new Quality(null, name, Category.POSITIVE, bp, 1);
    }

    public static Quality negative(String name, int bp) {
        return new Quality(null, name, Category.NEGATIVE, -Math.abs(bp), 1);
    }

    public Quality withRating(int newRating) {
        return new Quality(id, name, category, bp, newRating);
    }
}
