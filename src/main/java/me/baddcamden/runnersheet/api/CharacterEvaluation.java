package me.baddcamden.runnersheet.api;

import me.baddcamden.runnersheet.model.DerivedStats;
import me.baddcamden.runnersheet.model.Improvement;
import me.baddcamden.runnersheet.validation.ValidationResult;

import java.util.List;
import java.util.Objects;

/**
 * Everything the engine computes for one character snapshot.
 *
 * @param derived      derived statistics
 * @param validation   validation findings
 * @param improvements improvements aggregated from the character's items, qualities and powers
 */
public record CharacterEvaluation(DerivedStats derived, ValidationResult validation, List<Improvement> improvements) {

    public CharacterEvaluation {
        Objects.requireNonNull(derived, "derived");
        Objects.requireNonNull(validation, "validation");
        improvements = improvements == null ? List.of() : List.copyOf(improvements);
    }

    public boolean isValid() {
        return validation.valid();
    }
}
