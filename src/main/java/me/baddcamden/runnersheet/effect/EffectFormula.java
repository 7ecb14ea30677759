package me.baddcamden.runnersheet.effect;

import me.baddcamden.runnersheet.model.ImprovementTarget;

/**
 * One bonus an item grants, parameterized by the item's rating.
 */
public interface EffectFormula {

    /**
     * Stat the bonus applies to.
     */
    ImprovementTarget target();

    /**
     * Suffix appended to the emitting item's id to form the improvement id.
     */
    String suffix();

    /**
     * Bonus granted at the given rating.
     *
     * @param rating resolved item rating, at least {@code 1}
     * @return bonus value
     */
    double valueFor(int rating);

    /**
     * Situational note, or {@code null} when the bonus always applies.
     */
    String conditional();
}
