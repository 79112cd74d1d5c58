package org.sqlgate.resources;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import io.dropwizard.testing.junit5.ResourceExtension;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import javax.ws.rs.client.Entity;
import javax.ws.rs.core.GenericType;
import javax.ws.rs.core.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.sqlgate.dto.ApiError;
import org.sqlgate.dto.CancelResponse;
import org.sqlgate.dto.QueryEnvelope;
import org.sqlgate.dto.QueryRequest;
import org.sqlgate.errors.GlobalExceptionMapper;
import org.sqlgate.service.GuardedQueryService;

@ExtendWith(DropwizardExtensionsSupport.class)
class QueryResourceTest {

    private static final GuardedQueryService SERVICE = mock(GuardedQueryService.class);

    private static final ResourceExtension RESOURCES = ResourceExtension.builder()
            .setRegisterDefaultExceptionMappers(false)
            .addProvider(new GlobalExceptionMapper())
            .addResource(new QueryResource(SERVICE))
            .build();

    @AfterEach
    void tearDown() {
        reset(SERVICE);
    }

    private static QueryEnvelope envelope(boolean accepted, String reason) {
        QueryEnvelope env = new QueryEnvelope();
        env.requestId = "q_1";
        env.accepted = accepted;
        env.reason = reason;
        return env;
    }

    @Test
    @DisplayName("rows come back in the envelope with snake_case fields")
    void runsQuery() {
        QueryEnvelope env = envelope(true, "ok");
        env.normalizedSql = "SELECT id FROM orders LIMIT 100";
        env.rows = List.of(Map.of("id", 1));
        env.rowCount = 1;
        when(SERVICE.run(isNull(), eq("SELECT id FROM orders"), isNull())).thenReturn(env);

        Response response = RESOURCES.target("/queries").request()
                .post(Entity.json(new QueryRequest("SELECT id FROM orders")));

        assertThat(response.getStatus()).isEqualTo(200);
        Map<String, Object> body = response.readEntity(new GenericType<Map<String, Object>>() {});
        assertThat(body.get("normalized_sql")).isEqualTo("SELECT id FROM orders LIMIT 100");
        assertThat(body.get("row_count")).isEqualTo(1);
        assertThat(body).containsKeys("error", "error_kind", "matched_rule");
    }

    @Test
    @DisplayName("a rejected query is still a 200 with the reason")
    void rejectionIsNotAnHttpError() {
        QueryEnvelope env = envelope(false, "non_select");
        env.message = "query rejected: only SELECT statements are allowed (found DELETE)";
        when(SERVICE.run(any(), any(), any())).thenReturn(env);

        QueryEnvelope out = RESOURCES.target("/queries").request()
                .post(Entity.json(new QueryRequest("DELETE FROM customers")), QueryEnvelope.class);

        assertThat(out.accepted).isFalse();
        assertThat(out.reason).isEqualTo("non_select");
        assertThat(out.message).contains("found DELETE");
    }

    @Test
    void passesRequestIdAndTimeout() {
        when(SERVICE.run(any(), any(), any())).thenReturn(envelope(true, "ok"));
        QueryRequest req = new QueryRequest("SELECT 1");
        req.requestId = "agent-42";
        req.timeoutMs = 1500L;

        RESOURCES.target("/queries").request().post(Entity.json(req)).close();

        verify(SERVICE).run("agent-42", "SELECT 1", Duration.ofMillis(1500));
    }

    @Test
    void missingSqlIsBadRequest() {
        Response response = RESOURCES.target("/queries").request()
                .post(Entity.json(new QueryRequest("  ")));

        assertThat(response.getStatus()).isEqualTo(400);
        ApiError error = response.readEntity(ApiError.class);
        assertThat(error.status).isEqualTo(400);
        assertThat(error.error).isEqualTo("bad_request");
        assertThat(error.detail).isEqualTo("sql required");
        verifyNoInteractions(SERVICE);
    }

    @Test
    void checkUsesDryRun() {
        QueryEnvelope env = envelope(true, "ok");
        env.normalizedSql = "SELECT 1 LIMIT 100";
        when(SERVICE.check("SELECT 1")).thenReturn(env);

        QueryEnvelope out = RESOURCES.target("/queries/check").request()
                .post(Entity.json(new QueryRequest("SELECT 1")), QueryEnvelope.class);

        assertThat(out.normalizedSql).isEqualTo("SELECT 1 LIMIT 100");
    }

    @Test
    void cancel() {
        when(SERVICE.cancel("agent-42")).thenReturn(true);

        CancelResponse out = RESOURCES.target("/queries/agent-42/cancel").request()
                .post(Entity.json(""), CancelResponse.class);

        assertThat(out.requestId).isEqualTo("agent-42");
        assertThat(out.cancelled).isTrue();
    }
}
