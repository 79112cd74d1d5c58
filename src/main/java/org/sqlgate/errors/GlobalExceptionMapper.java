package org.sqlgate.errors;

import org.sqlgate.dto.ApiError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.ws.rs.WebApplicationException;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import javax.ws.rs.ext.ExceptionMapper;
import javax.ws.rs.ext.Provider;
import java.sql.SQLException;

// Turns transport-level failures into ApiError bodies; guard outcomes never reach here
@Provider
public class GlobalExceptionMapper implements ExceptionMapper<Throwable> {
    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionMapper.class);

    @Override
    public Response toResponse(Throwable e) {
        if (e instanceof WebApplicationException) {
            Response r = ((WebApplicationException) e).getResponse();
            if (r != null && r.hasEntity()) return r;
            int status = (r != null) ? r.getStatus() : 500;
            if (status >= 500) LOG.error("Request failed status={}", status, e);
            return json(status, errorCode(status), e.getMessage());
        }
        if (e instanceof IllegalArgumentException) {
            return json(400, errorCode(400), e.getMessage());
        }
        // Metadata lookups (GET /tables) surface driver failures here
        if (e instanceof SQLException) {
            LOG.warn("Database unavailable: {}", e.getMessage());
            return json(503, errorCode(503), "database unavailable");
        }
        LOG.error("Unhandled exception", e);
        return json(500, errorCode(500), "unexpected error");
    }

    private static Response json(int status, String error, String detail) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ApiError(status, error, detail))
                .build();
    }

    static String errorCode(int status) {
        switch (status) {
            case 400: return "bad_request";
            case 404: return "not_found";
            case 405: return "method_not_allowed";
            case 415: return "unsupported_media_type";
            case 503: return "database_unavailable";
            default: return (status >= 400 && status < 500) ? "bad_request" : "internal_error";
        }
    }
}
