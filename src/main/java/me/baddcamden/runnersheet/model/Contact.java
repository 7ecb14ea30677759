package me.baddcamden.runnersheet.model;

import java.util.Objects;

/**
 * A contact in the character's network. Ratings are valid in {@code 1..6}; the validator reports
 * anything outside that range rather than rejecting it here.
 */
public record Contact(String id, String name, int connection, int loyalty) {

    public Contact {
        Objects.requireNonNull(name, "name");
    }
}
