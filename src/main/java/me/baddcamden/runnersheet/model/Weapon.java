package me.baddcamden.runnersheet.model;

import java.util.Objects;

public record Weapon(String id, String name, String category, int cost, String availability) implements Purchasable {

    public Weapon {
        Objects.requireNonNull(name, "name");
    }
}
