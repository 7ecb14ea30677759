package me.baddcamden.runnersheet.model;

import java.util.Locale;
import java.util.Objects;

public record KnowledgeSkill(String name, String category, int rating) {

    public KnowledgeSkill {
        Objects.requireNonNull(name, "name");
    }

    public boolean matches(String skillName) {
        return skillName != null && name.toLowerCase(Locale.ROOT).equals(skillName.trim().toLowerCase(Locale.ROOT));
    }

    public KnowledgeSkill withRating(int newRating) {
        return new KnowledgeSkill(name, category, newRating);
    }
}
