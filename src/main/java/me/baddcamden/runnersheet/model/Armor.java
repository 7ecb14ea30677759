package me.baddcamden.runnersheet.model;

import java.util.Objects;

/**
 * A piece of armor. Only equipped pieces contribute to worn armor totals.
 */
public record Armor(String id,
                    String name,
                    int ballistic,
                    int impact,
                    boolean equipped,
                    int cost,
                    String availability) implements Purchasable {

    public Armor {
        Objects.requireNonNull(name, "name");
    }

    public Armor withEquipped(boolean nowEquipped) {
        return new Armor(id, name, ballistic, impact, nowEquipped, cost, availability);
    }
}
