package me.baddcamden.runnersheet.model;

import java.util.Objects;

public record Vehicle(String id, String name, String category, int cost, String availability) {

    public Vehicle {
        Objects.requireNonNull(name, "name");
    }
}
