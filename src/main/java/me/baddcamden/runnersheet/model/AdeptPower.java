package me.baddcamden.runnersheet.model;

import java.util.Objects;

public record AdeptPower(String id, String name, int level, double pointCost, String effectKey) {

    public AdeptPower {
        Objects.requireNonNull(name, "name");
    }

    public static AdeptPower of(String name, int level, double pointCost) {
        return new AdeptPower(null, name, level, pointCost, null);
    }
}
