package org.sqlgate.service;

import org.sqlgate.dto.QueryEnvelope;
import org.sqlgate.guard.CandidateStatement;
import org.sqlgate.guard.GuardPolicy;
import org.sqlgate.guard.NormalizedStatement;
import org.sqlgate.guard.ParseAmbiguousException;
import org.sqlgate.guard.QueryNormalizer;
import org.sqlgate.guard.SqlGuard;
import org.sqlgate.guard.StatementParser;
import org.sqlgate.guard.ValidationVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.UUID;

// Parse, validate, normalize, execute; every outcome comes back as a QueryEnvelope
public class GuardedQueryService {
    private static final Logger LOG = LoggerFactory.getLogger(GuardedQueryService.class);

    private final StatementParser parser;
    private final SqlGuard guard;
    private final QueryNormalizer normalizer;
    private final QueryExecutor executor;

    public GuardedQueryService(GuardPolicy policy, QueryExecutor executor) {
        this(new StatementParser(policy.maxSqlChars()), new SqlGuard(policy),
                new QueryNormalizer(policy.rowLimitCeiling()), executor);
    }

    public GuardedQueryService(StatementParser parser, SqlGuard guard, QueryNormalizer normalizer, QueryExecutor executor) {
        this.parser = parser;
        // Guard SQL safety
        this.guard = guard;
        this.normalizer = normalizer;
        this.executor = executor;
    }

    public QueryEnvelope run(String sql) {
        return run(null, sql, null);
    }

    public QueryEnvelope run(String requestId, String sql, Duration timeout) {
        String id = requestIdOrNew(requestId);
        try {
            Prepared prepared = prepare(id, sql);
            if (prepared.normalized == null) return rejected(id, prepared.verdict);

            if (executor == null) {
                throw new IllegalStateException("no database configured");
            }
            ExecutionResult result = executor.execute(id, prepared.normalized, timeout);
            LOG.debug("requestId={} Executed rows={} truncated={} elapsedMs={}",
                    id, result.rowCount(), result.truncated(), result.elapsedMillis());
            return executed(id, prepared, result);
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure requestId={}", id, e);
            // Fail closed
            QueryEnvelope env = base(id, ValidationVerdict.ambiguous("internal error"));
            env.error = "internal error";
            env.errorKind = ExecutionErrorKind.EXECUTION.code();
            return env;
        }
    }

    // Parse, validate and normalize without touching the database
    public QueryEnvelope check(String sql) {
        String id = requestIdOrNew(null);
        Prepared prepared = prepare(id, sql);
        if (prepared.normalized == null) return rejected(id, prepared.verdict);

        QueryEnvelope env = base(id, prepared.verdict);
        env.normalizedSql = prepared.normalized.sql();
        return env;
    }

    public boolean cancel(String requestId) {
        return executor != null && requestId != null && executor.cancel(requestId);
    }

    private Prepared prepare(String id, String sql) {
        LOG.debug("requestId={} Received sql={}", id, abbreviate(sql));

        CandidateStatement candidate;
        try {
            candidate = parser.parse(sql);
        } catch (ParseAmbiguousException e) {
            return reject(id, ValidationVerdict.ambiguous(e.getMessage()));
        }
        LOG.debug("requestId={} Parsed kind={} statements={}", id, candidate.kind(), candidate.statementCount());

        ValidationVerdict verdict = guard.validate(candidate);
        if (!verdict.accepted()) return reject(id, verdict);

        try {
            NormalizedStatement normalized = normalizer.normalize(candidate);
            LOG.debug("requestId={} Normalized sql={}", id, abbreviate(normalized.sql()));
            return new Prepared(verdict, normalized);
        } catch (ParseAmbiguousException e) {
            return reject(id, ValidationVerdict.ambiguous(e.getMessage()));
        }
    }

    private static Prepared reject(String id, ValidationVerdict verdict) {
        LOG.info("requestId={} Rejected reason={} rule={} detail={}",
                id, verdict.reason().code(), verdict.matchedRule(), verdict.detail());
        return new Prepared(verdict, null);
    }

    private static QueryEnvelope rejected(String id, ValidationVerdict verdict) {
        return base(id, verdict);
    }

    private static QueryEnvelope executed(String id, Prepared prepared, ExecutionResult result) {
        QueryEnvelope env = base(id, prepared.verdict);
        env.normalizedSql = prepared.normalized.sql();
        env.elapsedMs = result.elapsedMillis();
        if (result.failed()) {
            env.error = result.error();
            env.errorKind = result.errorKind().code();
            return env;
        }
        env.rows = result.rows();
        env.rowCount = result.rowCount();
        env.truncated = result.truncated();
        return env;
    }

    // Maps a verdict to the response envelope
    private static QueryEnvelope base(String id, ValidationVerdict verdict) {
        QueryEnvelope env = new QueryEnvelope();
        env.requestId = id;
        env.accepted = verdict.accepted();
        env.reason = verdict.reason().code();
        env.matchedRule = verdict.matchedRule();
        env.message = verdict.message();
        return env;
    }

    private static String requestIdOrNew(String requestId) {
        if (requestId != null && !requestId.trim().isEmpty()) return requestId.trim();
        return "q_" + UUID.randomUUID().toString().replace("-", "");
    }

    private static String abbreviate(String sql) {
        if (sql == null) return null;
        return sql.length() > 200 ? sql.substring(0, 200) + "..." : sql;
    }

    private static final class Prepared {
        final ValidationVerdict verdict;
        final NormalizedStatement normalized;

        Prepared(ValidationVerdict verdict, NormalizedStatement normalized) {
            this.verdict = verdict;
            this.normalized = normalized;
        }
    }
}
