package me.baddcamden.runnersheet.model;

import java.util.Objects;

public record Lifestyle(String id, String name, int monthlyCost, int monthsPrepaid) {

    public Lifestyle {
        Objects.requireNonNull(name, "name");
    }
}
