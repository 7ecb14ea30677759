package me.baddcamden.runnersheet.model;

import java.util.Objects;

/**
 * One line of the career expense log. Positive amounts are gains, negative amounts are spends.
 */
public record ExpenseEntry(Type type, int amount, String reason) {

    public enum Type {
        KARMA,
        NUYEN
    }

    public ExpenseEntry {
        Objects.requireNonNull(type, "type");
        reason = reason == null ? "" : reason;
    }

    public static ExpenseEntry karma(int amount, String reason) {
        return new ExpenseEntry(Type.KARMA, amount, reason);
    }

    public static ExpenseEntry nuyen(int amount, String reason) {
        return new ExpenseEntry(Type.NUYEN, amount, reason);
    }
}
