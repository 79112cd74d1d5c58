package org.sqlgate.service;

import org.sqlgate.guard.NormalizedStatement;
import org.sqlgate.repo.ConnectionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Blob;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

// Runs normalized statements read-only, one scoped connection per execution
public class QueryExecutor implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(QueryExecutor.class);

    private static final String QUERY_CANCELED_STATE = "57014";

    private final ConnectionSource connections;
    private final int rowLimitCeiling;
    private final int statementTimeoutMs;
    private final int fetchSize;

    // Tracks currently executing JDBC statements; cancel and timeout marks belong to the statement, not the id
    private final ConcurrentHashMap<String, Statement> liveStatements = new ConcurrentHashMap<>();
    private final Set<Statement> cancelled = ConcurrentHashMap.newKeySet();
    private final Set<Statement> expired = ConcurrentHashMap.newKeySet();
    private final ScheduledExecutorService watchdog;

    public QueryExecutor(ConnectionSource connections, int rowLimitCeiling, int statementTimeoutMs, int fetchSize) {
        this.connections = connections;
        this.rowLimitCeiling = rowLimitCeiling;
        this.statementTimeoutMs = statementTimeoutMs;
        this.fetchSize = fetchSize;
        this.watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sqlgate-watchdog");
            t.setDaemon(true);
            return t;
        });
    }

    public ExecutionResult execute(String requestId, NormalizedStatement statement) {
        return execute(requestId, statement, null);
    }

    // timeout may be null; a caller timeout can only shorten the configured one
    public ExecutionResult execute(String requestId, NormalizedStatement statement, Duration timeout) {
        long timeoutMs = effectiveTimeoutMs(timeout);
        long started = System.nanoTime();

        Connection c = null;
        PreparedStatement registered = null;
        ScheduledFuture<?> deadline = null;
        boolean discard = false;
        try {
            c = connections.acquire();
            prepare(c, timeoutMs);

            List<Map<String, Object>> rows = new ArrayList<>();
            boolean truncated = false;
            // Executes the query with fetch size, row limit and timeout
            try (PreparedStatement ps = c.prepareStatement(statement.sql(), ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY)) {
                ps.setFetchSize(fetchSize);
                ps.setMaxRows(rowLimitCeiling + 1);
                ps.setQueryTimeout(timeoutSeconds(timeoutMs));

                if (liveStatements.putIfAbsent(requestId, ps) != null) {
                    LOG.warn("requestId={} is already running; refusing a second execution", requestId);
                    c.rollback();
                    return ExecutionResult.failure(ExecutionErrorKind.EXECUTION,
                            "request id " + requestId + " is already running", elapsedMillis(started));
                }
                registered = ps;
                deadline = watchdog.schedule(() -> expire(requestId, ps), timeoutMs, TimeUnit.MILLISECONDS);

                try (ResultSet rs = ps.executeQuery()) {
                    ResultSetMetaData md = rs.getMetaData();
                    List<String> labels = labels(md);
                    while (rs.next()) {
                        if (rows.size() >= rowLimitCeiling) {
                            truncated = true;
                            break;
                        }
                        rows.add(readRow(rs, labels));
                    }
                } finally {
                    liveStatements.remove(requestId, ps);
                }
            }
            c.rollback();

            if (truncated) {
                LOG.warn("requestId={} returned more than {} rows; result truncated", requestId, rowLimitCeiling);
            }
            return ExecutionResult.success(rows, truncated, elapsedMillis(started));
        } catch (Exception e) {
            discard = true;
            ExecutionErrorKind kind = classify(registered, e);
            LOG.warn("Execution failed requestId={} kind={}: {}", requestId, kind.code(), e.getMessage());
            return ExecutionResult.failure(kind, safeMessage(kind, e), elapsedMillis(started));
        } finally {
            if (deadline != null) deadline.cancel(false);
            if (registered != null) {
                liveStatements.remove(requestId, registered);
                cancelled.remove(registered);
                expired.remove(registered);
            }
            release(c, discard);
        }
    }

    // Cancels an in-flight execution; false when nothing is running under that id
    public boolean cancel(String requestId) {
        Statement st = liveStatements.get(requestId);
        if (st == null) return false;

        cancelled.add(st);
        try {
            st.cancel();
            return true;
        } catch (Exception e) {
            LOG.warn("Cancel failed requestId={}", requestId, e);
            return false;
        }
    }

    public int rowLimitCeiling() {
        return rowLimitCeiling;
    }

    @Override
    public void close() {
        watchdog.shutdownNow();
    }

    private void expire(String requestId, Statement st) {
        if (liveStatements.get(requestId) != st) return;

        expired.add(st);
        try {
            st.cancel();
        } catch (Exception e) {
            LOG.warn("Timeout cancel failed requestId={}", requestId, e);
        }
    }

    private static void prepare(Connection c, long timeoutMs) throws SQLException {
        try {
            c.setReadOnly(true);
        } catch (SQLFeatureNotSupportedException e) {
            LOG.debug("Driver does not support read-only connections", e);
        }
        c.setAutoCommit(false);

        if (isPostgres(c)) {
            try (Statement st = c.createStatement()) {
                st.execute("set local statement_timeout = " + timeoutMs);
            }
        }
    }

    private static boolean isPostgres(Connection c) {
        try {
            DatabaseMetaData md = c.getMetaData();
            String product = (md == null) ? null : md.getDatabaseProductName();
            return product != null && product.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (SQLException e) {
            LOG.debug("Could not read database product name", e);
            return false;
        }
    }

    private ExecutionErrorKind classify(Statement st, Exception e) {
        if (st != null && cancelled.contains(st)) return ExecutionErrorKind.CANCELLED;
        if ((st != null && expired.contains(st)) || e instanceof SQLTimeoutException) return ExecutionErrorKind.TIMEOUT;
        if (e instanceof SQLException && QUERY_CANCELED_STATE.equals(((SQLException) e).getSQLState())) {
            return ExecutionErrorKind.TIMEOUT;
        }
        return ExecutionErrorKind.EXECUTION;
    }

    private void release(Connection c, boolean discard) {
        if (c == null) return;
        if (discard) {
            connections.discard(c);
            return;
        }
        try {
            c.close();
        } catch (SQLException e) {
            LOG.warn("Releasing connection failed", e);
        }
    }

    // Duplicate column labels get a positional suffix so no value is lost
    private static List<String> labels(ResultSetMetaData md) throws SQLException {
        int cols = md.getColumnCount();
        List<String> labels = new ArrayList<>(cols);
        for (int i = 1; i <= cols; i++) {
            String label = md.getColumnLabel(i);
            if (label == null || label.isEmpty()) label = "column" + i;
            labels.add(labels.contains(label) ? label + "_" + i : label);
        }
        return labels;
    }

    private static Map<String, Object> readRow(ResultSet rs, List<String> labels) throws SQLException {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < labels.size(); i++) {
            row.put(labels.get(i), asValue(rs.getObject(i + 1)));
        }
        return row;
    }

    // Numbers, booleans and nulls pass through; everything else becomes text
    private static Object asValue(Object v) throws SQLException {
        if (v == null) return null;
        if (v instanceof Number || v instanceof Boolean) return v;
        if (v instanceof byte[]) return Base64.getEncoder().encodeToString((byte[]) v);
        if (v instanceof Clob) {
            Clob clob = (Clob) v;
            return clob.getSubString(1, (int) clob.length());
        }
        if (v instanceof Blob) {
            Blob blob = (Blob) v;
            return Base64.getEncoder().encodeToString(blob.getBytes(1, (int) blob.length()));
        }
        return String.valueOf(v);
    }

    private long effectiveTimeoutMs(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) return statementTimeoutMs;
        long callerMs;
        try {
            callerMs = timeout.toMillis();
        } catch (ArithmeticException e) {
            return statementTimeoutMs;
        }
        return Math.max(1, Math.min(callerMs, statementTimeoutMs));
    }

    // Rounded up to whole seconds and clamped to the int range the driver takes
    static int timeoutSeconds(long timeoutMs) {
        long seconds = timeoutMs / 1000 + (timeoutMs % 1000 == 0 ? 0 : 1);
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, seconds));
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static String safeMessage(ExecutionErrorKind kind, Exception e) {
        String m = e.getMessage();
        if (m == null || m.trim().isEmpty()) {
            return kind == ExecutionErrorKind.EXECUTION ? "failed" : kind.code();
        }
        m = m.trim();
        return (m.length() > 300) ? m.substring(0, 300) : m;
    }
}
