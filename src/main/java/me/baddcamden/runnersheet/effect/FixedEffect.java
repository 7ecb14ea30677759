package me.baddcamden.runnersheet.effect;

import me.baddcamden.runnersheet.model.ImprovementTarget;

import java.util.Objects;

/**
 * Bonus that ignores rating.
 */
public record FixedEffect(ImprovementTarget target, String suffix, double value, String conditional)
        implements EffectFormula {

    public FixedEffect {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(suffix, "suffix");
    }

    public static FixedEffect of(ImprovementTarget target, String suffix, double value) {
        return new FixedEffect(target, suffix, value, null);
    }

    @Override
    public double valueFor(int rating) {
        return value;
    }
}
