package com.cors.handler.policy;

import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * Raw CORS configuration, as supplied by the user. Every field is optional; the
 * {@link PolicyCompiler} turns an instance into an immutable {@link CorsPolicy}.
 *
 * <pre>
 * CorsOptions options = CorsOptions.builder()
 *         .allowedOrigins("https://app.example.com", "https://*.example.org")
 *         .allowedMethods("GET", "POST", "PUT")
 *         .allowedHeaders("Content-Type", "Authorization")
 *         .allowCredentials(true)
 *         .maxAge(600)
 *         .build();
 * </pre>
 */
public class CorsOptions {

    private final List<String> allowedOrigins;
    private final Predicate<String> allowOriginPredicate;
    private final List<String> allowedMethods;
    private final List<String> allowedHeaders;
    private final List<String> exposedHeaders;
    private final int maxAge;
    private final boolean allowCredentials;
    private final boolean optionsPassthrough;
    private final boolean debug;
    private final Logger logger;

    private CorsOptions(Builder builder) {
        this.allowedOrigins = Collections.unmodifiableList(new ArrayList<>(builder.allowedOrigins));
        this.allowOriginPredicate = builder.allowOriginPredicate;
        this.allowedMethods = Collections.unmodifiableList(new ArrayList<>(builder.allowedMethods));
        this.allowedHeaders = Collections.unmodifiableList(new ArrayList<>(builder.allowedHeaders));
        this.exposedHeaders = Collections.unmodifiableList(new ArrayList<>(builder.exposedHeaders));
        this.maxAge = builder.maxAge;
        this.allowCredentials = builder.allowCredentials;
        this.optionsPassthrough = builder.optionsPassthrough;
        this.debug = builder.debug;
        this.logger = builder.logger;
    }

    /**
     * Origins allowed to make cross-origin requests. {@code "*"} allows every origin and an
     * entry may hold one {@code *} wildcard, e.g. {@code "http://*.example.com"}.
     * Empty means every origin.
     */
    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    /**
     * Custom origin check. When set, {@link #getAllowedOrigins()} is ignored.
     */
    public Predicate<String> getAllowOriginPredicate() {
        return allowOriginPredicate;
    }

    /**
     * Methods clients may use. Empty means the simple methods {@code GET, POST, HEAD}.
     */
    public List<String> getAllowedMethods() {
        return allowedMethods;
    }

    /**
     * Non-simple headers clients may send. {@code "*"} allows any header.
     */
    public List<String> getAllowedHeaders() {
        return allowedHeaders;
    }

    /**
     * Response headers that are safe to expose to the client.
     */
    public List<String> getExposedHeaders() {
        return exposedHeaders;
    }

    /**
     * How long, in seconds, a preflight result may be cached. Zero or less omits the header.
     */
    public int getMaxAge() {
        return maxAge;
    }

    public boolean isAllowCredentials() {
        return allowCredentials;
    }

    /**
     * Whether preflight requests are passed on to the downstream handler.
     */
    public boolean isOptionsPassthrough() {
        return optionsPassthrough;
    }

    public boolean isDebug() {
        return debug;
    }

    /**
     * Logger receiving decision traces when {@link #isDebug()} is set; null means the default.
     */
    public Logger getLogger() {
        return logger;
    }

    /**
     * Options with every field at its default: all origins, simple methods, the default
     * header set, no credentials.
     */
    public static CorsOptions defaults() {
        return builder().build();
    }

    /**
     * Permissive options: any origin, the common methods, any header, with credentials.
     */
    public static CorsOptions allowAll() {
        return builder()
                .allowedOrigins("*")
                .allowedMethods("HEAD", "GET", "POST", "PUT", "PATCH", "DELETE")
                .allowedHeaders("*")
                .allowCredentials(true)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<String> allowedOrigins = new ArrayList<>();
        private Predicate<String> allowOriginPredicate;
        private final List<String> allowedMethods = new ArrayList<>();
        private final List<String> allowedHeaders = new ArrayList<>();
        private final List<String> exposedHeaders = new ArrayList<>();
        private int maxAge;
        private boolean allowCredentials;
        private boolean optionsPassthrough;
        private boolean debug;
        private Logger logger;

        public Builder allowedOrigins(String... origins) {
            if (origins == null) {
                return this;
            }
            return allowedOrigins(Arrays.asList(origins));
        }

        public Builder allowedOrigins(List<String> origins) {
            addAll(this.allowedOrigins, origins);
            return this;
        }

        public Builder allowOriginPredicate(Predicate<String> predicate) {
            this.allowOriginPredicate = predicate;
            return this;
        }

        public Builder allowedMethods(String... methods) {
            if (methods == null) {
                return this;
            }
            return allowedMethods(Arrays.asList(methods));
        }

        public Builder allowedMethods(List<String> methods) {
            addAll(this.allowedMethods, methods);
            return this;
        }

        public Builder allowedHeaders(String... headers) {
            if (headers == null) {
                return this;
            }
            return allowedHeaders(Arrays.asList(headers));
        }

        public Builder allowedHeaders(List<String> headers) {
            addAll(this.allowedHeaders, headers);
            return this;
        }

        public Builder exposedHeaders(String... headers) {
            if (headers == null) {
                return this;
            }
            return exposedHeaders(Arrays.asList(headers));
        }

        public Builder exposedHeaders(List<String> headers) {
            addAll(this.exposedHeaders, headers);
            return this;
        }

        public Builder maxAge(int maxAge) {
            this.maxAge = maxAge;
            return this;
        }

        public Builder allowCredentials(boolean allowCredentials) {
            this.allowCredentials = allowCredentials;
            return this;
        }

        public Builder optionsPassthrough(boolean optionsPassthrough) {
            this.optionsPassthrough = optionsPassthrough;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        /**
         * Sets the logger used for decision traces. Has no effect unless debug is enabled.
         */
        public Builder logger(Logger logger) {
            if (logger == null) {
                throw new IllegalArgumentException("Logger must not be null");
            }
            this.logger = logger;
            return this;
        }

        public CorsOptions build() {
            return new CorsOptions(this);
        }

        private static void addAll(List<String> target, List<String> values) {
            if (values == null) return;
            for (String value : values) {
                if (value != null) {
                    target.add(value);
                }
            }
        }
    }

    @Override
    public String toString() {
        return "CorsOptions{" +
                "allowedOrigins=" + allowedOrigins +
                ", allowOriginPredicate=" + (allowOriginPredicate != null) +
                ", allowedMethods=" + allowedMethods +
                ", allowedHeaders=" + allowedHeaders +
                ", exposedHeaders=" + exposedHeaders +
                ", maxAge=" + maxAge +
                ", allowCredentials=" + allowCredentials +
                ", optionsPassthrough=" + optionsPassthrough +
                ", debug=" + debug +
                '}';
    }
}
