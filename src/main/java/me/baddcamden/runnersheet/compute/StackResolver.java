package me.baddcamden.runnersheet.compute;

import me.baddcamden.runnersheet.model.Improvement;
import me.baddcamden.runnersheet.model.ImprovementSource;
import me.baddcamden.runnersheet.model.ImprovementTarget;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Applies the stacking rule to a set of improvements: bonuses from the same source do not stack
 * (the highest one counts) while bonuses from different sources add up.
 * <p>
 * Two wired reflexes cannot both add initiative, but wired reflexes and an improved reflexes
 * power can. Grouping always finishes before any reduction, so the result does not depend on the
 * order of the input.
 */
public final class StackResolver {

    private StackResolver() {
    }

    /**
     * Stacked total for one target.
     *
     * @param improvements candidate improvements; entries for other targets are ignored
     * @param target       stat to total
     * @return sum over sources of the highest value per source, {@code 0} when nothing applies
     */
    public static double totalFor(Collection<Improvement> improvements, ImprovementTarget target) {
        if (improvements == null || improvements.isEmpty()) {
            return 0.0d;
        }

        Map<ImprovementSource, Double> bestBySource = new EnumMap<>(ImprovementSource.class);
        for (Improvement improvement : improvements) {
            if (improvement.target() != target) {
                continue;
            }
            bestBySource.merge(improvement.source(), improvement.value(), Math::max);
        }

        double total = 0.0d;
        for (double best : bestBySource.values()) {
            total += best;
        }
        return total;
    }

    /**
     * Integer view of {@link #totalFor(Collection, ImprovementTarget)}, rounded down.
     */
    public static int intTotalFor(Collection<Improvement> improvements, ImprovementTarget target) {
        return (int) Math.floor(totalFor(improvements, target));
    }
}
