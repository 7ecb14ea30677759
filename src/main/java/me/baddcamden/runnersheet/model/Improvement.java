package me.baddcamden.runnersheet.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A sourced bonus to one derived stat. Improvements are always computed from the character's
 * installed items, qualities and powers and are never stored on the character.
 *
 * @param id          {@code <itemId>-<suffix>}, unique per emitting item and effect
 * @param source      origin category used for stacking
 * @param sourceName  display name of the emitting item
 * @param target      stat being modified
 * @param value       bonus amount
 * @param conditional situational note, or {@code null} when the bonus always applies
 */
public record Improvement(String id,
                          ImprovementSource source,
                          String sourceName,
                          ImprovementTarget target,
                          double value,
                          String conditional) {

    public Improvement {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        sourceName = sourceName == null ? "" : sourceName;
    }

    public static Improvement of(String id, ImprovementSource source, ImprovementTarget target, double value) {
        return new Improvement(id, source, id, target, value, null);
    }

    public Optional<String> conditionalNote() {
        return Optional.ofNullable(conditional);
    }

    public boolean isConditional() {
        return conditional != null;
    }
}
