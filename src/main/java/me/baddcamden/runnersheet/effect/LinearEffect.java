package me.baddcamden.runnersheet.effect;

import me.baddcamden.runnersheet.model.ImprovementTarget;

import java.util.Objects;

/**
 * Bonus proportional to rating: {@code rating * perRating}.
 */
public record LinearEffect(ImprovementTarget target, String suffix, double perRating, String conditional)
        implements EffectFormula {

    public LinearEffect {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(suffix, "suffix");
    }

    public static LinearEffect of(ImprovementTarget target, String suffix, double perRating) {
        return new LinearEffect(target, suffix, perRating, null);
    }

    @Override
    public double valueFor(int rating) {
        return rating * perRating;
    }
}
