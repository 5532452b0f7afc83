package com.cors.handler.policy;

import com.cors.handler.util.Wildcard;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Admits origins found in a set of lower-cased literal origins or matching one of a
 * list of single-wildcard patterns. Matching is case-insensitive on the request origin.
 */
public final class OriginListMatcher implements OriginMatcher {

    private final Set<String> exactOrigins;
    private final List<Wildcard> wildcardOrigins;

    /**
     * @param exactOrigins    lower-cased literal origins
     * @param wildcardOrigins lower-cased wildcard patterns, tried in order
     */
    public OriginListMatcher(Set<String> exactOrigins, List<Wildcard> wildcardOrigins) {
        this.exactOrigins = Set.copyOf(exactOrigins);
        this.wildcardOrigins = List.copyOf(wildcardOrigins);
    }

    @Override
    public boolean admits(String origin) {
        String lower = origin.toLowerCase(Locale.ROOT);
        if (exactOrigins.contains(lower)) {
            return true;
        }
        for (Wildcard wildcard : wildcardOrigins) {
            if (wildcard.matches(lower)) {
                return true;
            }
        }
        return false;
    }

    public Set<String> getExactOrigins() {
        return exactOrigins;
    }

    public List<Wildcard> getWildcardOrigins() {
        return wildcardOrigins;
    }

    @Override
    public String toString() {
        return "OriginListMatcher{exact=" + exactOrigins + ", wildcards=" + wildcardOrigins + '}';
    }
}
