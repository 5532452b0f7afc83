package com.cors.handler.http;

/**
 * A downstream request handler, invoked after CORS headers have been written.
 */
@FunctionalInterface
public interface RequestHandler {

    void handle(CorsRequest request, CorsResponse response);
}
