package de.mirkosertic.talentmatch.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Cleans free text and tag values supplied with proposers and reviewers.
 *
 * <p>Profile texts and briefs often arrive pasted from other tools and carry
 * characters that must not influence similarity:</p>
 * <ul>
 *   <li>Unicode replacement characters from failed decoding</li>
 *   <li>Control characters other than tab, line feed and carriage return</li>
 *   <li>Zero-width characters and the byte order mark</li>
 * </ul>
 */
public final class TextCleaner {

    private static final Pattern INVALID_CHARS = Pattern.compile(
        "[" +
        "\u0000-\u0008" +
        "\u000B-\u000C" +
        "\u000E-\u001F" +
        "\u200B-\u200D" +
        "\uFEFF" +
        "\uFFFD" +
        "]"
    );

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private TextCleaner() {
        // Utility class, no instances
    }

    /**
     * Removes invalid characters and collapses whitespace runs into a single space.
     *
     * @param text the text to clean (may be null)
     * @return cleaned and trimmed text, or null if input was null
     */
    public static String clean(final String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        final String cleaned = INVALID_CHARS.matcher(text).replaceAll("");
        return WHITESPACE_RUN.matcher(cleaned).replaceAll(" ").trim();
    }

    /**
     * Normalizes a city, category or tag for comparison: cleaned, lower-cased, trimmed.
     *
     * @return the normalized key, or an empty string for null or blank input
     */
    public static String normalizeKey(final String value) {
        final String cleaned = clean(value);
        if (cleaned == null) {
            return "";
        }
        return cleaned.toLowerCase(Locale.ROOT);
    }

    /**
     * Normalizes each tag with {@link #normalizeKey(String)}, dropping blanks and duplicates
     * while keeping the first occurrence order.
     */
    public static List<String> normalizeTags(final List<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return List.of();
        }
        final Set<String> result = new LinkedHashSet<>();
        for (final String tag : tags) {
            final String key = normalizeKey(tag);
            if (!key.isEmpty()) {
                result.add(key);
            }
        }
        return new ArrayList<>(result);
    }
}
