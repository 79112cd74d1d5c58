package org.sqlgate.service;

import java.util.Collections;
import java.util.List;
import java.util.Map;

// Rows, or the error, of one execution. Handed to the caller and then dropped
public final class ExecutionResult {

    private final List<Map<String, Object>> rows;
    private final boolean truncated;
    private final String error;
    private final ExecutionErrorKind errorKind;
    private final long elapsedMillis;

    private ExecutionResult(List<Map<String, Object>> rows, boolean truncated, String error,
                            ExecutionErrorKind errorKind, long elapsedMillis) {
        this.rows = rows;
        this.truncated = truncated;
        this.error = error;
        this.errorKind = errorKind;
        this.elapsedMillis = elapsedMillis;
    }

    public static ExecutionResult success(List<Map<String, Object>> rows, boolean truncated, long elapsedMillis) {
        return new ExecutionResult(Collections.unmodifiableList(rows), truncated, null, null, elapsedMillis);
    }

    public static ExecutionResult failure(ExecutionErrorKind kind, String error, long elapsedMillis) {
        return new ExecutionResult(List.of(), false, error, kind, elapsedMillis);
    }

    public List<Map<String, Object>> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean truncated() {
        return truncated;
    }

    public String error() {
        return error;
    }

    public ExecutionErrorKind errorKind() {
        return errorKind;
    }

    public boolean failed() {
        return errorKind != null;
    }

    public long elapsedMillis() {
        return elapsedMillis;
    }
}
