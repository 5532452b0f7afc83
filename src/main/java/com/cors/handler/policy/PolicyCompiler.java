package com.cors.handler.policy;

import com.cors.handler.util.HeaderLists;
import com.cors.handler.util.Wildcard;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Compiles {@link CorsOptions} into a {@link CorsPolicy}.
 *
 * <p>Compilation never fails. Contradictory settings are resolved by precedence:
 * an origin predicate beats the origin list, and a {@code "*"} entry beats every other
 * origin or header entry.</p>
 */
public final class PolicyCompiler {

    static final List<String> DEFAULT_ALLOWED_HEADERS =
            List.of("Origin", "Accept", "Content-Type", "X-Requested-With");

    static final List<String> DEFAULT_ALLOWED_METHODS = List.of("GET", "POST", "HEAD");

    private static final String ANY = "*";

    private PolicyCompiler() {
        // utility class
    }

    public static CorsPolicy compile(CorsOptions options) {
        OriginMatcher originMatcher = compileOrigins(options);

        boolean allowAllHeaders = false;
        List<String> allowedHeaders;
        List<String> configuredHeaders = options.getAllowedHeaders();
        if (configuredHeaders.isEmpty()) {
            allowedHeaders = DEFAULT_ALLOWED_HEADERS;
        } else if (configuredHeaders.contains(ANY)) {
            allowAllHeaders = true;
            allowedHeaders = Collections.emptyList();
        } else {
            List<String> withOrigin = new ArrayList<>(configuredHeaders);
            withOrigin.add("Origin");
            allowedHeaders = HeaderLists.convert(withOrigin, HeaderLists::canonicalHeaderKey);
        }

        List<String> allowedMethods = options.getAllowedMethods().isEmpty()
                ? DEFAULT_ALLOWED_METHODS
                : HeaderLists.convert(options.getAllowedMethods(), m -> m.toUpperCase(Locale.ROOT));

        return new CorsPolicy(
                originMatcher,
                allowedMethods,
                allowAllHeaders,
                allowedHeaders,
                HeaderLists.convert(options.getExposedHeaders(), HeaderLists::canonicalHeaderKey),
                options.isAllowCredentials(),
                options.getMaxAge(),
                options.isOptionsPassthrough());
    }

    static OriginMatcher compileOrigins(CorsOptions options) {
        if (options.getAllowOriginPredicate() != null) {
            return new PredicateOriginMatcher(options.getAllowOriginPredicate());
        }
        if (options.getAllowedOrigins().isEmpty()) {
            return AllOriginsMatcher.instance();
        }

        Set<String> exact = new LinkedHashSet<>();
        List<Wildcard> wildcards = new ArrayList<>();
        for (String origin : options.getAllowedOrigins()) {
            String lower = origin.toLowerCase(Locale.ROOT);
            if (ANY.equals(lower)) {
                return AllOriginsMatcher.instance();
            } else if (lower.indexOf('*') >= 0) {
                wildcards.add(Wildcard.parse(lower));
            } else {
                exact.add(lower);
            }
        }
        return new OriginListMatcher(exact, wildcards);
    }
}
