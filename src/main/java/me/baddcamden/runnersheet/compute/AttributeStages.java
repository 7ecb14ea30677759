package me.baddcamden.runnersheet.compute;

import me.baddcamden.runnersheet.model.AttributeCode;

/**
 * Checkpoints produced while resolving one attribute.
 *
 * @param code             attribute resolved
 * @param base             purchased base value
 * @param bonus            flat bonus recorded on the sheet
 * @param natural          {@code base + bonus}, used for creation limit checks
 * @param improvementBonus stacked improvement total for the attribute
 * @param resolved         {@code base + improvementBonus}; not clamped by limits
 */
public record AttributeStages(AttributeCode code,
                              int base,
                              int bonus,
                              int natural,
                              int improvementBonus,
                              int resolved) {

    static AttributeStages absent(AttributeCode code) {
        return new AttributeStages(code, 0, 0, 0, 0, 0);
    }
}
