package com.cors.handler.policy;

import com.cors.handler.http.CorsHeaders;
import com.cors.handler.util.HeaderLists;

import java.util.List;
import java.util.Locale;

/**
 * Compiled, immutable CORS policy. Built once by {@link PolicyCompiler} and then read
 * by every request without synchronization.
 */
public final class CorsPolicy {

    private final OriginMatcher originMatcher;
    private final List<String> allowedMethods;
    private final boolean allowAllHeaders;
    private final List<String> allowedHeaders;
    private final List<String> exposedHeaders;
    private final boolean allowCredentials;
    private final int maxAge;
    private final boolean optionsPassthrough;

    CorsPolicy(OriginMatcher originMatcher,
               List<String> allowedMethods,
               boolean allowAllHeaders,
               List<String> allowedHeaders,
               List<String> exposedHeaders,
               boolean allowCredentials,
               int maxAge,
               boolean optionsPassthrough) {
        this.originMatcher = originMatcher;
        this.allowedMethods = List.copyOf(allowedMethods);
        this.allowAllHeaders = allowAllHeaders;
        this.allowedHeaders = List.copyOf(allowedHeaders);
        this.exposedHeaders = List.copyOf(exposedHeaders);
        this.allowCredentials = allowCredentials;
        this.maxAge = maxAge;
        this.optionsPassthrough = optionsPassthrough;
    }

    /**
     * Returns true if the origin is admitted by this policy's origin strategy.
     */
    public boolean isOriginAllowed(String origin) {
        return originMatcher.admits(origin);
    }

    /**
     * Returns true if the method may be used. {@code OPTIONS} is always allowed;
     * any other method must appear in the allowed list, compared upper-cased.
     */
    public boolean isMethodAllowed(String method) {
        String upper = method.toUpperCase(Locale.ROOT);
        if (CorsHeaders.METHOD_OPTIONS.equals(upper)) {
            return true;
        }
        return allowedMethods.contains(upper);
    }

    /**
     * Returns true if every requested header is allowed. A single unknown header
     * rejects the whole list.
     */
    public boolean areHeadersAllowed(List<String> requestedHeaders) {
        if (allowAllHeaders || requestedHeaders.isEmpty()) {
            return true;
        }
        for (String header : requestedHeaders) {
            if (!allowedHeaders.contains(HeaderLists.canonicalHeaderKey(header))) {
                return false;
            }
        }
        return true;
    }

    public OriginMatcher getOriginMatcher() {
        return originMatcher;
    }

    public boolean isAllowAllOrigins() {
        return originMatcher.admitsAll();
    }

    public List<String> getAllowedMethods() {
        return allowedMethods;
    }

    public boolean isAllowAllHeaders() {
        return allowAllHeaders;
    }

    public List<String> getAllowedHeaders() {
        return allowedHeaders;
    }

    public List<String> getExposedHeaders() {
        return exposedHeaders;
    }

    public boolean isAllowCredentials() {
        return allowCredentials;
    }

    public int getMaxAge() {
        return maxAge;
    }

    public boolean isOptionsPassthrough() {
        return optionsPassthrough;
    }

    @Override
    public String toString() {
        return "CorsPolicy{" +
                "origins=" + originMatcher +
                ", allowedMethods=" + allowedMethods +
                ", allowAllHeaders=" + allowAllHeaders +
                ", allowedHeaders=" + allowedHeaders +
                ", exposedHeaders=" + exposedHeaders +
                ", allowCredentials=" + allowCredentials +
                ", maxAge=" + maxAge +
                ", optionsPassthrough=" + optionsPassthrough +
                '}';
    }
}
