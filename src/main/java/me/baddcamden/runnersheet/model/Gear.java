package me.baddcamden.runnersheet.model;

import java.util.Objects;

/**
 * General gear. {@code cost} is per unit.
 */
public record Gear(String id,
                   String name,
                   String category,
                   int rating,
                   int quantity,
                   int cost,
                   String availability) implements Purchasable {

    public Gear {
        Objects.requireNonNull(name, "name");
        if (quantity < 0) {
            throw new IllegalArgumentException("Quantity cannot be negative");
        }
    }
}
