package com.cors.handler.rest;

import com.cors.handler.http.CorsResponse;
import jakarta.ws.rs.container.ContainerResponseContext;

/**
 * {@link CorsResponse} writing straight into a Jakarta RS {@link ContainerResponseContext}.
 */
class ContainerCorsResponse implements CorsResponse {

    private final ContainerResponseContext context;

    ContainerCorsResponse(ContainerResponseContext context) {
        this.context = context;
    }

    @Override
    public void addHeader(String name, String value) {
        context.getHeaders().add(name, value);
    }

    @Override
    public void setHeader(String name, String value) {
        context.getHeaders().putSingle(name, value);
    }

    @Override
    public void setStatus(int status) {
        context.setStatus(status);
    }
}
