package com.cors.handler.negotiation;

import com.cors.handler.http.CorsHeaders;
import com.cors.handler.http.CorsRequest;
import com.cors.handler.http.CorsResponse;
import com.cors.handler.policy.CorsPolicy;
import org.slf4j.Logger;

import java.util.List;
import java.util.Locale;

/**
 * Runs the CORS decision chains against a compiled {@link CorsPolicy}.
 *
 * <p>Both chains fail silently: a rejected origin, method or header simply leaves the
 * {@code Access-Control-Allow-*} headers out. Only the {@code Vary} entries written before
 * the failing check remain.</p>
 *
 * <p>Preflight chain:</p>
 * <ol>
 *   <li>append {@code Vary: Origin, Access-Control-Request-Method, Access-Control-Request-Headers}</li>
 *   <li>require method {@code OPTIONS}</li>
 *   <li>require a non-empty {@code Origin}</li>
 *   <li>require an allowed origin</li>
 *   <li>require an allowed {@code Access-Control-Request-Method}</li>
 *   <li>require every {@code Access-Control-Request-Headers} entry to be allowed</li>
 *   <li>write the allow headers</li>
 * </ol>
 *
 * <p>Actual-request chain:</p>
 * <ol>
 *   <li>skip {@code OPTIONS} requests entirely</li>
 *   <li>append {@code Vary: Origin}</li>
 *   <li>require a non-empty {@code Origin}</li>
 *   <li>require an allowed origin</li>
 *   <li>require an allowed request method</li>
 *   <li>write the allow and expose headers</li>
 * </ol>
 */
public class CorsNegotiator {

    private final CorsPolicy policy;
    private final Logger log;
    private final NegotiationChain preflightChain;
    private final NegotiationChain actualChain;

    public CorsNegotiator(CorsPolicy policy, Logger log) {
        if (policy == null) {
            throw new IllegalArgumentException("Policy must not be null");
        }
        if (log == null) {
            throw new IllegalArgumentException("Logger must not be null");
        }
        this.policy = policy;
        this.log = log;
        this.preflightChain = new NegotiationChain("preflight", List.of(
                CorsNegotiator::varyOnPreflightInputs,
                CorsNegotiator::requireOptionsMethod,
                CorsNegotiator::requireOrigin,
                CorsNegotiator::requireAllowedOrigin,
                CorsNegotiator::requireAllowedRequestedMethod,
                CorsNegotiator::requireAllowedRequestedHeaders,
                this::writePreflightHeaders));
        this.actualChain = new NegotiationChain("actual", List.of(
                CorsNegotiator::skipOptionsMethod,
                CorsNegotiator::varyOnOrigin,
                CorsNegotiator::requireOrigin,
                CorsNegotiator::requireAllowedOrigin,
                CorsNegotiator::requireAllowedRequestMethod,
                this::writeActualHeaders));
    }

    public StepOutcome handlePreflight(CorsRequest request, CorsResponse response) {
        return preflightChain.run(new Negotiation(policy, request, response), log);
    }

    public StepOutcome handleActualRequest(CorsRequest request, CorsResponse response) {
        return actualChain.run(new Negotiation(policy, request, response), log);
    }

    public CorsPolicy getPolicy() {
        return policy;
    }

    NegotiationChain getPreflightChain() {
        return preflightChain;
    }

    NegotiationChain getActualChain() {
        return actualChain;
    }

    // ── Checks ──────────────────────────────────────────────

    static StepOutcome varyOnPreflightInputs(Negotiation n) {
        CorsResponse response = n.response();
        response.addHeader(CorsHeaders.VARY, CorsHeaders.ORIGIN);
        response.addHeader(CorsHeaders.VARY, CorsHeaders.ACCESS_CONTROL_REQUEST_METHOD);
        response.addHeader(CorsHeaders.VARY, CorsHeaders.ACCESS_CONTROL_REQUEST_HEADERS);
        return StepOutcome.proceed();
    }

    static StepOutcome requireOptionsMethod(Negotiation n) {
        String method = n.request().getMethod();
        if (!CorsHeaders.METHOD_OPTIONS.equals(method)) {
            return StepOutcome.abort("method {} != OPTIONS", method);
        }
        return StepOutcome.proceed();
    }

    static StepOutcome skipOptionsMethod(Negotiation n) {
        if (CorsHeaders.METHOD_OPTIONS.equals(n.request().getMethod())) {
            return StepOutcome.abort("method == OPTIONS");
        }
        return StepOutcome.proceed();
    }

    static StepOutcome varyOnOrigin(Negotiation n) {
        n.response().addHeader(CorsHeaders.VARY, CorsHeaders.ORIGIN);
        return StepOutcome.proceed();
    }

    static StepOutcome requireOrigin(Negotiation n) {
        if (n.origin().isEmpty()) {
            return StepOutcome.abort("missing origin");
        }
        return StepOutcome.proceed();
    }

    static StepOutcome requireAllowedOrigin(Negotiation n) {
        String origin = n.origin();
        if (!n.policy().isOriginAllowed(origin)) {
            return StepOutcome.abort("origin '{}' not allowed", origin);
        }
        return StepOutcome.proceed();
    }

    static StepOutcome requireAllowedRequestedMethod(Negotiation n) {
        String requested = n.requestedMethod();
        if (!n.policy().isMethodAllowed(requested)) {
            return StepOutcome.abort("method '{}' not allowed", requested);
        }
        return StepOutcome.proceed();
    }

    static StepOutcome requireAllowedRequestMethod(Negotiation n) {
        String method = n.request().getMethod();
        if (!n.policy().isMethodAllowed(method)) {
            return StepOutcome.abort("method '{}' not allowed", method);
        }
        return StepOutcome.proceed();
    }

    static StepOutcome requireAllowedRequestedHeaders(Negotiation n) {
        List<String> requested = n.requestedHeaders();
        if (!n.policy().areHeadersAllowed(requested)) {
            return StepOutcome.abort("headers {} not allowed", requested);
        }
        return StepOutcome.proceed();
    }

    // ── Writers ─────────────────────────────────────────────

    private StepOutcome writePreflightHeaders(Negotiation n) {
        CorsResponse response = n.response();
        String allowOrigin = n.allowOriginValue();
        String allowMethod = n.requestedMethod().toUpperCase(Locale.ROOT);
        List<String> requestedHeaders = n.requestedHeaders();

        response.setHeader(CorsHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, allowOrigin);
        response.setHeader(CorsHeaders.ACCESS_CONTROL_ALLOW_METHODS, allowMethod);
        if (!requestedHeaders.isEmpty()) {
            response.setHeader(CorsHeaders.ACCESS_CONTROL_ALLOW_HEADERS, String.join(", ", requestedHeaders));
        }
        if (policy.isAllowCredentials()) {
            response.setHeader(CorsHeaders.ACCESS_CONTROL_ALLOW_CREDENTIALS, "true");
        }
        if (policy.getMaxAge() > 0) {
            response.setHeader(CorsHeaders.ACCESS_CONTROL_MAX_AGE, Integer.toString(policy.getMaxAge()));
        }
        log.info("cors.preflight.allowed origin={} method={} headers={} credentials={} maxAge={}",
                allowOrigin, allowMethod, requestedHeaders, policy.isAllowCredentials(), policy.getMaxAge());
        return StepOutcome.proceed();
    }

    private StepOutcome writeActualHeaders(Negotiation n) {
        CorsResponse response = n.response();
        String allowOrigin = n.allowOriginValue();

        response.setHeader(CorsHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, allowOrigin);
        if (!policy.getExposedHeaders().isEmpty()) {
            response.setHeader(CorsHeaders.ACCESS_CONTROL_EXPOSE_HEADERS,
                    String.join(", ", policy.getExposedHeaders()));
        }
        if (policy.isAllowCredentials()) {
            response.setHeader(CorsHeaders.ACCESS_CONTROL_ALLOW_CREDENTIALS, "true");
        }
        log.info("cors.actual.allowed origin={} exposed={} credentials={}",
                allowOrigin, policy.getExposedHeaders(), policy.isAllowCredentials());
        return StepOutcome.proceed();
    }
}
