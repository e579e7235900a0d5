package com.resource.naming.rest;

import com.resource.naming.api.ResultStatus;
import com.resource.naming.rest.dto.ErrorResponse;
import jakarta.ws.rs.core.Response;

/**
 * Maps service result statuses to HTTP responses.
 */
final class ResultResponses {

    static final String INTERNAL_ERROR_MESSAGE = "An internal error occurred. Check server logs for details.";

    private ResultResponses() {
    }

    static Response failure(ResultStatus status, String message, String path) {
        ErrorResponse body = switch (status) {
            case INVALID -> ErrorResponse.badRequest(message, path);
            case FORBIDDEN -> ErrorResponse.forbidden(message, path);
            case NOT_FOUND -> ErrorResponse.notFound(message, path);
            case CONFLICT -> ErrorResponse.conflict(message, path);
            case UPSTREAM_ERROR -> ErrorResponse.badGateway(message, path);
            case SUCCESS -> throw new IllegalArgumentException("SUCCESS is not a failure status");
        };
        return Response.status(status.httpStatus()).entity(body).build();
    }

    static Response badRequest(String message, String path) {
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(ErrorResponse.badRequest(message, path))
                .build();
    }

    static Response unauthorized(String path) {
        return Response.status(Response.Status.UNAUTHORIZED)
                .entity(new ErrorResponse(401, "Unauthorized", "Authentication required.", path))
                .build();
    }

    static Response internalError(String path) {
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(ErrorResponse.internalError(INTERNAL_ERROR_MESSAGE, path))
                .build();
    }
}
