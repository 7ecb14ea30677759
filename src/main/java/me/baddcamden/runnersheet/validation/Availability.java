package me.baddcamden.runnersheet.validation;

/**
 * Parsed availability: numeric rating plus legality restriction.
 */
public record Availability(int rating, Restriction restriction) {

    public static final Availability NONE = new Availability(0, Restriction.NONE);

    public enum Restriction {
        NONE,
        RESTRICTED,
        FORBIDDEN
    }

    public Availability {
        restriction = restriction == null ? Restriction.NONE : restriction;
    }

    public boolean isForbidden() {
        return restriction == Restriction.FORBIDDEN;
    }

    public boolean isRestricted() {
        return restriction == Restriction.RESTRICTED;
    }

    public Availability withModifier(int modifier) {
        return new Availability(Math.max(0, rating + modifier), restriction);
    }
}
