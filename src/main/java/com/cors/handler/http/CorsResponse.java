package com.cors.handler.http;

/**
 * Per-request response sink written by CORS negotiation.
 *
 * <p>Implementations are owned by a single request and need not be thread-safe.</p>
 */
public interface CorsResponse {

    /**
     * Appends a value to the named header, keeping any values already present.
     */
    void addHeader(String name, String value);

    /**
     * Sets the named header to a single value, replacing any values already present.
     */
    void setHeader(String name, String value);

    /**
     * Sets the response status code.
     */
    void setStatus(int status);
}
