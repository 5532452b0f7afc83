package com.cors.handler.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Helpers for HTTP header names and comma-separated header-name lists.
 */
public final class HeaderLists {

    private HeaderLists() {
        // utility class
    }

    /**
     * Parses a comma-separated list of header names such as the value of
     * {@code Access-Control-Request-Headers}.
     *
     * <p>Tokens are trimmed of ASCII whitespace, empty tokens are dropped, every surviving
     * token is canonicalized with {@link #canonicalHeaderKey(String)} and duplicates are
     * removed keeping the first occurrence.</p>
     *
     * @param raw the raw header value, may be null
     * @return the canonical header names in first-seen order, never null
     */
    public static List<String> parseHeaderList(String raw) {
        if (raw == null || raw.isEmpty()) {
            return Collections.emptyList();
        }
        Set<String> headers = new LinkedHashSet<>();
        int start = 0;
        int length = raw.length();
        while (start <= length) {
            int comma = raw.indexOf(',', start);
            int end = comma < 0 ? length : comma;
            String token = trimAsciiWhitespace(raw, start, end);
            if (!token.isEmpty()) {
                headers.add(canonicalHeaderKey(token));
            }
            start = end + 1;
        }
        return headers.isEmpty() ? Collections.emptyList() : List.copyOf(headers);
    }

    /**
     * Applies a transform to every element, preserving order and length.
     *
     * @param values    the input values, may be null
     * @param transform the element transform
     * @return a new immutable list, empty when {@code values} is null
     */
    public static List<String> convert(List<String> values, UnaryOperator<String> transform) {
        if (values == null || values.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> converted = new ArrayList<>(values.size());
        for (String value : values) {
            converted.add(transform.apply(value));
        }
        return Collections.unmodifiableList(converted);
    }

    /**
     * Returns the canonical form of a header name: the first letter and any letter
     * following a hyphen are upper-cased, all other letters are lower-cased.
     * {@code "x-requested-with"} becomes {@code "X-Requested-With"}.
     *
     * <p>Names containing a character that is not a valid HTTP token character
     * (a space, for instance) are returned unchanged.</p>
     */
    public static String canonicalHeaderKey(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        for (int i = 0; i < name.length(); i++) {
            if (!isTokenChar(name.charAt(i))) {
                return name;
            }
        }
        char[] chars = name.toCharArray();
        boolean upper = true;
        for (int i = 0; i < chars.length; i++) {
            char c = chars[i];
            if (upper && c >= 'a' && c <= 'z') {
                chars[i] = (char) (c - ('a' - 'A'));
            } else if (!upper && c >= 'A' && c <= 'Z') {
                chars[i] = (char) (c + ('a' - 'A'));
            }
            upper = c == '-';
        }
        return new String(chars);
    }

    private static String trimAsciiWhitespace(String s, int start, int end) {
        while (start < end && isAsciiWhitespace(s.charAt(start))) {
            start++;
        }
        while (end > start && isAsciiWhitespace(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(start, end);
    }

    private static boolean isAsciiWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == 0x0B;
    }

    // RFC 7230 tchar
    private static boolean isTokenChar(char c) {
        if (c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z' || c >= '0' && c <= '9') {
            return true;
        }
        return "!#$%&'*+-.^_`|~".indexOf(c) >= 0;
    }
}
