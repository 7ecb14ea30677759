package me.baddcamden.runnersheet.validation;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parses availability text such as {@code "12"}, {@code "8R"}, {@code "14F"} or {@code "6+2R"}.
 * <p>
 * A trailing {@code R} or {@code F} (either case) sets the restriction. What remains is summed
 * when it consists only of non-negative integers joined by {@code +}. Anything else, including
 * blank text, {@code "-"} and formulas referencing a rating, yields rating {@code 0}; a
 * recognised restriction suffix is still kept in that case.
 */
public final class AvailabilityParser {

    private static final Pattern SUM = Pattern.compile("\\d+(\\s*\\+\\s*\\d+)*");

    private AvailabilityParser() {
    }

    public static Availability parse(String text) {
        if (text == null) {
            return Availability.NONE;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty() || trimmed.equals("-")) {
            return Availability.NONE;
        }

        Availability.Restriction restriction = Availability.Restriction.NONE;
        char last = trimmed.toUpperCase(Locale.ROOT).charAt(trimmed.length() - 1);
        if (last == 'R') {
            restriction = Availability.Restriction.RESTRICTED;
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        } else if (last == 'F') {
            restriction = Availability.Restriction.FORBIDDEN;
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }

        return new Availability(sum(trimmed), restriction);
    }

    private static int sum(String expression) {
        if (!SUM.matcher(expression).matches()) {
            return 0;
        }
        int total = 0;
        try {
            for (String term : expression.split("\\+")) {
                total = Math.addExact(total, Integer.parseInt(term.trim()));
            }
        } catch (NumberFormatException | ArithmeticException overflow) {
            return 0;
        }
        return total;
    }
}
