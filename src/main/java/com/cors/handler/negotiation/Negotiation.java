package com.cors.handler.negotiation;

import com.cors.handler.http.CorsHeaders;
import com.cors.handler.http.CorsRequest;
import com.cors.handler.http.CorsResponse;
import com.cors.handler.policy.CorsPolicy;
import com.cors.handler.util.HeaderLists;

import java.util.List;

/**
 * State of a single CORS negotiation: the policy, the request being answered and the
 * response receiving headers. One instance per request, never shared.
 */
public final class Negotiation {

    private final CorsPolicy policy;
    private final CorsRequest request;
    private final CorsResponse response;
    private List<String> requestedHeaders;

    public Negotiation(CorsPolicy policy, CorsRequest request, CorsResponse response) {
        this.policy = policy;
        this.request = request;
        this.response = response;
    }

    public CorsPolicy policy() {
        return policy;
    }

    public CorsRequest request() {
        return request;
    }

    public CorsResponse response() {
        return response;
    }

    /**
     * Returns the {@code Origin} request header, or an empty string when absent.
     */
    public String origin() {
        return headerOrEmpty(CorsHeaders.ORIGIN);
    }

    /**
     * Returns the {@code Access-Control-Request-Method} header, or an empty string when absent.
     */
    public String requestedMethod() {
        return headerOrEmpty(CorsHeaders.ACCESS_CONTROL_REQUEST_METHOD);
    }

    /**
     * Returns the parsed {@code Access-Control-Request-Headers} list. Parsed on first use.
     */
    public List<String> requestedHeaders() {
        if (requestedHeaders == null) {
            requestedHeaders = HeaderLists.parseHeaderList(
                    request.getHeader(CorsHeaders.ACCESS_CONTROL_REQUEST_HEADERS));
        }
        return requestedHeaders;
    }

    /**
     * Value for {@code Access-Control-Allow-Origin}: {@code *} when every origin is allowed
     * and credentials are not, otherwise the request origin echoed verbatim.
     */
    public String allowOriginValue() {
        if (policy.isAllowAllOrigins() && !policy.isAllowCredentials()) {
            return "*";
        }
        return origin();
    }

    private String headerOrEmpty(String name) {
        String value = request.getHeader(name);
        return value == null ? "" : value;
    }
}
