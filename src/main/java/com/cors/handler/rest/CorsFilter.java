package com.cors.handler.rest;

import com.cors.handler.CorsHandler;
import com.cors.handler.http.BufferedCorsResponse;
import com.cors.handler.http.CorsRequest;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;

/**
 * Jakarta RS filter applying a {@link CorsHandler} to every request.
 *
 * <p>Implements both {@link ContainerRequestFilter} (preflight handling) and
 * {@link ContainerResponseFilter} (headers on actual responses).</p>
 *
 * <p>A preflight is answered in the request phase with {@code 200 OK} and the negotiated
 * headers, unless options passthrough is enabled: then the resource still runs and the
 * negotiated headers are added to its response.</p>
 */
@Provider
@Priority(Priorities.HEADER_DECORATOR)
public class CorsFilter implements ContainerRequestFilter, ContainerResponseFilter {

    static final String PREFLIGHT_HEADERS_PROPERTY = CorsFilter.class.getName() + ".preflightHeaders";

    private final CorsHandler corsHandler;

    public CorsFilter(CorsHandler corsHandler) {
        this.corsHandler = corsHandler;
    }

    @Override
    public void filter(ContainerRequestContext requestContext) {
        CorsRequest request = new ContainerCorsRequest(requestContext);
        if (!CorsHandler.isPreflightRequest(request)) {
            return;
        }

        BufferedCorsResponse buffer = new BufferedCorsResponse();
        corsHandler.apply(request, buffer);

        if (corsHandler.getPolicy().isOptionsPassthrough()) {
            requestContext.setProperty(PREFLIGHT_HEADERS_PROPERTY, buffer);
            return;
        }

        Response.ResponseBuilder builder = Response.ok();
        buffer.forEachHeader(builder::header);
        requestContext.abortWith(builder.build());
    }

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        Object preflightHeaders = requestContext.getProperty(PREFLIGHT_HEADERS_PROPERTY);
        if (preflightHeaders instanceof BufferedCorsResponse) {
            ((BufferedCorsResponse) preflightHeaders).replayTo(new ContainerCorsResponse(responseContext));
            return;
        }

        CorsRequest request = new ContainerCorsRequest(requestContext);
        // Aborted preflights already carry their headers
        if (CorsHandler.isPreflightRequest(request)) {
            return;
        }
        corsHandler.apply(request, new ContainerCorsResponse(responseContext));
    }
}
