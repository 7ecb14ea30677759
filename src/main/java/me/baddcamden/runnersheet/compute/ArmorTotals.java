package me.baddcamden.runnersheet.compute;

import me.baddcamden.runnersheet.model.Armor;

import java.util.Comparator;
import java.util.List;

/**
 * Worn armor ratings after layering.
 * <p>
 * Equipped pieces are ordered by ballistic rating, highest first. The top piece counts in full
 * and the second piece at half, rounded down; any further piece is ignored. Impact follows the
 * same pieces in the same order, so a piece's impact always pairs with its own ballistic rank.
 *
 * @param ballistic layered ballistic rating
 * @param impact    layered impact rating
 */
public record ArmorTotals(int ballistic, int impact) {

    public static final ArmorTotals NONE = new ArmorTotals(0, 0);

    public static ArmorTotals worn(List<Armor> armor) {
        List<Armor> equipped = armor.stream()
                .filter(Armor::equipped)
                .sorted(Comparator.comparingInt(Armor::ballistic).reversed())
                .toList();
        if (equipped.isEmpty()) {
            return NONE;
        }

        Armor primary = equipped.get(0);
        if (equipped.size() == 1) {
            return new ArmorTotals(primary.ballistic(), primary.impact());
        }
        Armor secondary = equipped.get(1);
        return new ArmorTotals(
                primary.ballistic() + Math.floorDiv(secondary.ballistic(), 2),
                primary.impact() + Math.floorDiv(secondary.impact(), 2));
    }

    public ArmorTotals plus(int ballisticBonus, int impactBonus) {
        return new ArmorTotals(ballistic + ballisticBonus, impact + impactBonus);
    }
}
