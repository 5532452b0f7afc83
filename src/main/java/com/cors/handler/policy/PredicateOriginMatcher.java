package com.cors.handler.policy;

import java.util.function.Predicate;

/**
 * Delegates origin admission to a user-supplied predicate. The predicate receives the
 * origin exactly as sent by the client and must be safe for concurrent use.
 */
public final class PredicateOriginMatcher implements OriginMatcher {

    private final Predicate<String> predicate;

    public PredicateOriginMatcher(Predicate<String> predicate) {
        if (predicate == null) {
            throw new IllegalArgumentException("Origin predicate must not be null");
        }
        this.predicate = predicate;
    }

    @Override
    public boolean admits(String origin) {
        return predicate.test(origin);
    }

    @Override
    public String toString() {
        return "PredicateOriginMatcher";
    }
}
