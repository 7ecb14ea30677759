package me.baddcamden.runnersheet.effect;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalized catalog key split from an item's display name.
 * <p>
 * "Wired Reflexes 2", "Wired Reflexes (2)" and "Wired Reflexes (Rating 2)" all parse to key
 * {@code wired reflexes} with embedded rating {@code 2}. Names without a trailing number keep
 * their full lowercased text and report an embedded rating of {@code 0}.
 *
 * @param key            lowercase name with the trailing rating stripped
 * @param embeddedRating rating found in the name, or {@code 0}
 */
public record CatalogKey(String key, int embeddedRating) {

    private static final Pattern TRAILING_RATING = Pattern.compile(
            "^(.*?)\\s*(?:\\(\\s*(?:rating\\s*)?(\\d+)\\s*\\)|(\\d+))$",
            Pattern.CASE_INSENSITIVE);

    public static CatalogKey parse(String displayName) {
        if (displayName == null) {
            return new CatalogKey("", 0);
        }
        String normalized = displayName.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        Matcher matcher = TRAILING_RATING.matcher(normalized);
        if (matcher.matches() && !matcher.group(1).isBlank()) {
            String digits = matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
            try {
                return new CatalogKey(matcher.group(1).trim(), Integer.parseInt(digits));
            } catch (NumberFormatException overflow) {
                return new CatalogKey(matcher.group(1).trim(), 0);
            }
        }
        return new CatalogKey(normalized, 0);
    }

    /**
     * Picks the rating used to evaluate effects: an explicit item rating above zero wins, then
     * the rating embedded in the name, then {@code 1}.
     */
    public int resolveRating(int explicitRating) {
        if (explicitRating > 0) {
            return explicitRating;
        }
        return embeddedRating > 0 ? embeddedRating : 1;
    }
}
