package com.cors.handler.util;

/**
 * A single-wildcard pattern split into the text before and after its {@code *}.
 *
 * <p>{@code "http://*.example.com"} becomes prefix {@code "http://"} and suffix
 * {@code ".example.com"}. Only the first {@code *} is treated as a wildcard; any later one
 * stays literal in the suffix.</p>
 *
 * @param prefix text the candidate must start with
 * @param suffix text the candidate must end with
 */
public record Wildcard(String prefix, String suffix) {

    public Wildcard {
        if (prefix == null || suffix == null) {
            throw new IllegalArgumentException("Wildcard prefix and suffix must not be null");
        }
    }

    /**
     * Splits a pattern at its first {@code *}.
     *
     * @param pattern a pattern containing at least one {@code *}
     * @throws IllegalArgumentException if the pattern has no {@code *}
     */
    public static Wildcard parse(String pattern) {
        int star = pattern.indexOf('*');
        if (star < 0) {
            throw new IllegalArgumentException("Pattern has no wildcard: '" + pattern + "'");
        }
        return new Wildcard(pattern.substring(0, star), pattern.substring(star + 1));
    }

    /**
     * Returns true if the candidate is long enough to hold both anchors and
     * starts with the prefix and ends with the suffix.
     */
    public boolean matches(String candidate) {
        return candidate.length() >= prefix.length() + suffix.length()
                && candidate.startsWith(prefix)
                && candidate.endsWith(suffix);
    }
}
