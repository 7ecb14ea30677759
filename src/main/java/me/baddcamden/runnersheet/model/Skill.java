package me.baddcamden.runnersheet.model;

import java.util.Locale;
import java.util.Objects;

/**
 * An active skill.
 *
 * @param name           skill name, matched case-insensitively
 * @param attribute      linked attribute used for dice pools
 * @param rating         purchased rating
 * @param bonus          flat dice bonus from the sheet
 * @param specialization optional specialization, {@code null} when none
 */
public record Skill(String name, AttributeCode attribute, int rating, int bonus, String specialization) {

    public Skill {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(attribute, "attribute");
    }

    public static Skill of(String name, AttributeCode attribute, int rating) {
        return new Skill(name, attribute, rating, 0, null);
    }

    public boolean matches(String skillName) {
        return skillName != null && name.toLowerCase(Locale.ROOT).equals(skillName.trim().toLowerCase(Locale.ROOT));
    }

    public Skill withRating(int newRating) {
        return new Skill(name, attribute, newRating, bonus, specialization);
    }

    public Skill withSpecialization(String newSpecialization) {
        return new Skill(name, attribute, rating, bonus, newSpecialization);
    }
}
