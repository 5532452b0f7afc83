package com.cors.handler;

import com.cors.handler.http.CorsHeaders;
import com.cors.handler.http.CorsRequest;
import com.cors.handler.http.CorsResponse;
import com.cors.handler.http.RequestHandler;
import com.cors.handler.negotiation.CorsNegotiator;
import com.cors.handler.policy.CorsOptions;
import com.cors.handler.policy.CorsPolicy;
import com.cors.handler.policy.PolicyCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.NOPLogger;

/**
 * CORS request decorator. Classifies each request as preflight or actual, writes the
 * matching CORS response headers and then either ends a preflight or hands the request
 * to a downstream {@link RequestHandler}.
 *
 * <p>Three entry points share the same routing and produce identical headers:</p>
 * <ul>
 *   <li>{@link #wrap(RequestHandler)} returns a handler decorating {@code next}</li>
 *   <li>{@link #apply(CorsRequest, CorsResponse)} only writes headers</li>
 *   <li>{@link #handle(CorsRequest, CorsResponse, RequestHandler)} writes headers and continues to {@code next}</li>
 * </ul>
 *
 * <p>Instances are immutable and safe to share between concurrent requests.</p>
 */
public class CorsHandler {

    private static final Logger defaultLog = LoggerFactory.getLogger(CorsHandler.class);

    private static final int STATUS_OK = 200;

    private final CorsNegotiator negotiator;
    private final Logger log;

    private CorsHandler(CorsPolicy policy, Logger log) {
        this.negotiator = new CorsNegotiator(policy, log);
        this.log = log;
    }

    /**
     * Compiles the options into a policy and returns a handler enforcing it.
     */
    public static CorsHandler create(CorsOptions options) {
        Logger log = NOPLogger.NOP_LOGGER;
        if (options.isDebug()) {
            log = options.getLogger() != null ? options.getLogger() : defaultLog;
        }
        return new CorsHandler(PolicyCompiler.compile(options), log);
    }

    /**
     * Handler with default options.
     */
    public static CorsHandler defaults() {
        return create(CorsOptions.defaults());
    }

    /**
     * Handler allowing every origin, header and common method, with credentials.
     */
    public static CorsHandler allowAll() {
        return create(CorsOptions.allowAll());
    }

    /**
     * Returns true for an {@code OPTIONS} request carrying a non-empty
     * {@code Access-Control-Request-Method} header. Any other request, including a plain
     * {@code OPTIONS}, is an actual request.
     */
    public static boolean isPreflightRequest(CorsRequest request) {
        if (!CorsHeaders.METHOD_OPTIONS.equals(request.getMethod())) {
            return false;
        }
        String requestMethod = request.getHeader(CorsHeaders.ACCESS_CONTROL_REQUEST_METHOD);
        return requestMethod != null && !requestMethod.isEmpty();
    }

    /**
     * Decorates {@code next}. Preflight requests end with status 200 unless options
     * passthrough is enabled, in which case {@code next} runs as well.
     */
    public RequestHandler wrap(RequestHandler next) {
        return (request, response) -> handle(request, response, next);
    }

    /**
     * Writes the CORS headers for the request and nothing else: no status is set and no
     * downstream handler runs.
     */
    public void apply(CorsRequest request, CorsResponse response) {
        if (isPreflightRequest(request)) {
            log.info("cors.handler.preflight entry=apply");
            negotiator.handlePreflight(request, response);
        } else {
            log.info("cors.handler.actual entry=apply");
            negotiator.handleActualRequest(request, response);
        }
    }

    /**
     * Writes the CORS headers and continues to {@code next}, following the same rules as
     * {@link #wrap(RequestHandler)}.
     */
    public void handle(CorsRequest request, CorsResponse response, RequestHandler next) {
        if (isPreflightRequest(request)) {
            log.info("cors.handler.preflight entry=handle");
            negotiator.handlePreflight(request, response);
            if (getPolicy().isOptionsPassthrough()) {
                next.handle(request, response);
            } else {
                response.setStatus(STATUS_OK);
            }
        } else {
            log.info("cors.handler.actual entry=handle");
            negotiator.handleActualRequest(request, response);
            next.handle(request, response);
        }
    }

    public CorsPolicy getPolicy() {
        return negotiator.getPolicy();
    }

    @Override
    public String toString() {
        return "CorsHandler{" + getPolicy() + '}';
    }
}
