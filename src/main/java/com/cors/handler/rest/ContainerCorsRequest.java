package com.cors.handler.rest;

import com.cors.handler.http.CorsRequest;
import jakarta.ws.rs.container.ContainerRequestContext;

/**
 * {@link CorsRequest} view over a Jakarta RS {@link ContainerRequestContext}.
 */
class ContainerCorsRequest implements CorsRequest {

    private final ContainerRequestContext context;

    ContainerCorsRequest(ContainerRequestContext context) {
        this.context = context;
    }

    @Override
    public String getMethod() {
        return context.getMethod();
    }

    @Override
    public String getHeader(String name) {
        return context.getHeaderString(name);
    }
}
