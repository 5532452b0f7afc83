package com.cors.handler.http;

/**
 * Read-only view of an inbound HTTP request, as much of it as CORS negotiation needs.
 */
public interface CorsRequest {

    /**
     * Returns the request method exactly as received, e.g. {@code "GET"}.
     */
    String getMethod();

    /**
     * Returns the value of the named request header.
     *
     * @param name header name, matched case-insensitively
     * @return the header value, or null if the header is absent
     */
    String getHeader(String name);
}
