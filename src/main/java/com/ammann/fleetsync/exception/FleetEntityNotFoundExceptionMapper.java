/* (C)2026 */
package com.ammann.fleetsync.exception;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Map;

/**
 * JAX-RS exception mapper that converts {@link FleetEntityNotFoundException} into an HTTP 404
 * Not Found response with a JSON error body containing the error label, message, and the
 * unresolved entity key.
 */
@Provider
public class FleetEntityNotFoundExceptionMapper
        implements ExceptionMapper<FleetEntityNotFoundException> {

    @Override
    public Response toResponse(FleetEntityNotFoundException exception) {
        return Response.status(Response.Status.NOT_FOUND)
                .entity(
                        Map.of(
                                "error", "Not Found",
                                "message", exception.getMessage(),
                                "entity", exception.getEntity()))
                .build();
    }
}
