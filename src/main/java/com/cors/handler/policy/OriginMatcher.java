package com.cors.handler.policy;

/**
 * Strategy deciding whether a request {@code Origin} may make cross-origin requests.
 * Implementations are immutable and safe for concurrent use.
 */
public interface OriginMatcher {

    /**
     * Returns true if the given origin is admitted.
     *
     * @param origin the {@code Origin} header value exactly as received, never empty
     */
    boolean admits(String origin);

    /**
     * Returns true if this strategy admits every origin unconditionally, in which case
     * {@code Access-Control-Allow-Origin: *} may be sent instead of the echoed origin.
     */
    default boolean admitsAll() {
        return false;
    }
}
