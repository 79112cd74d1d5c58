package org.sqlgate.resources;

import org.sqlgate.dto.CancelResponse;
import org.sqlgate.dto.QueryEnvelope;
import org.sqlgate.dto.QueryRequest;
import org.sqlgate.service.GuardedQueryService;

import javax.ws.rs.Consumes;
import javax.ws.rs.POST;
import javax.ws.rs.Path;
import javax.ws.rs.PathParam;
import javax.ws.rs.Produces;
import javax.ws.rs.WebApplicationException;
import javax.ws.rs.core.MediaType;
import java.time.Duration;

@Path("/queries")
@Produces(MediaType.APPLICATION_JSON)
public class QueryResource {
    private final GuardedQueryService service;

    public QueryResource(GuardedQueryService service) {
        this.service = service;
    }

    // Rejections and execution failures are part of the envelope, not HTTP errors
    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public QueryEnvelope run(QueryRequest req) {
        String sql = requireSql(req);
        Duration timeout = (req.timeoutMs == null || req.timeoutMs <= 0) ? null : Duration.ofMillis(req.timeoutMs);
        return service.run(req.requestId, sql, timeout);
    }

    @POST
    @Path("/check")
    @Consumes(MediaType.APPLICATION_JSON)
    public QueryEnvelope check(QueryRequest req) {
        return service.check(requireSql(req));
    }

    @POST
    @Path("/{requestId}/cancel")
    public CancelResponse cancel(@PathParam("requestId") String requestId) {
        return new CancelResponse(requestId, service.cancel(requestId));
    }

    private static String requireSql(QueryRequest req) {
        String sql = (req == null) ? null : req.sql;
        if (sql == null || sql.trim().isEmpty()) {
            throw new WebApplicationException("sql required", 400);
        }
        return sql;
    }
}
