package com.cors.handler.cdi;

import com.cors.handler.CorsHandler;
import com.cors.handler.policy.CorsOptions;
import com.cors.handler.rest.CorsFilter;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * CDI producer that wires the CORS handler from MicroProfile Config properties.
 *
 * <p>When this class is on the classpath in a CDI container (e.g., Quarkus), it reads
 * configuration from {@code application.yaml} and produces {@link CorsOptions},
 * {@link CorsHandler} and the Jakarta RS {@link CorsFilter}:</p>
 * <pre>
 * cors:
 *   allowed-origins: "https://app.example.com,https://*.example.org"
 *   allowed-methods: "GET,POST,PUT,DELETE"
 *   allowed-headers: "Content-Type,Authorization"
 *   exposed-headers: "X-Request-Id"
 *   allow-credentials: true
 *   max-age: 600
 *   options-passthrough: false
 *   debug: false
 * </pre>
 *
 * <p>Produced beans are {@code @Singleton}: none of them can be client-proxied.
 * Unset lists fall back to the compiler defaults. An origin predicate cannot be
 * configured here; build {@link CorsOptions} in code for that.</p>
 */
@ApplicationScoped
public class CorsProducer {

    private static final Logger log = LoggerFactory.getLogger(CorsProducer.class);

    @Inject
    @ConfigProperty(name = "cors.allowed-origins")
    Optional<List<String>> allowedOrigins;

    @Inject
    @ConfigProperty(name = "cors.allowed-methods")
    Optional<List<String>> allowedMethods;

    @Inject
    @ConfigProperty(name = "cors.allowed-headers")
    Optional<List<String>> allowedHeaders;

    @Inject
    @ConfigProperty(name = "cors.exposed-headers")
    Optional<List<String>> exposedHeaders;

    @Inject
    @ConfigProperty(name = "cors.allow-credentials", defaultValue = "false")
    boolean allowCredentials;

    @Inject
    @ConfigProperty(name = "cors.max-age", defaultValue = "0")
    int maxAge;

    @Inject
    @ConfigProperty(name = "cors.options-passthrough", defaultValue = "false")
    boolean optionsPassthrough;

    @Inject
    @ConfigProperty(name = "cors.debug", defaultValue = "false")
    boolean debug;

    @Produces
    @Singleton
    public CorsOptions corsOptions() {
        CorsOptions.Builder builder = CorsOptions.builder()
                .allowCredentials(allowCredentials)
                .maxAge(maxAge)
                .optionsPassthrough(optionsPassthrough)
                .debug(debug);

        allowedOrigins.ifPresent(builder::allowedOrigins);
        allowedMethods.ifPresent(builder::allowedMethods);
        allowedHeaders.ifPresent(builder::allowedHeaders);
        exposedHeaders.ifPresent(builder::exposedHeaders);

        return builder.build();
    }

    @Produces
    @Singleton
    public CorsHandler corsHandler(CorsOptions options) {
        CorsHandler handler = CorsHandler.create(options);
        log.info("CORS policy: {}", handler.getPolicy());
        return handler;
    }

    @Produces
    @Singleton
    public CorsFilter corsFilter(CorsHandler handler) {
        return new CorsFilter(handler);
    }
}
