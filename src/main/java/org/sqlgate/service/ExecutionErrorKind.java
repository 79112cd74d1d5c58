package org.sqlgate.service;

// Why an execution failed; TIMEOUT is kept apart so callers can retry with a narrower query
public enum ExecutionErrorKind {
    EXECUTION("execution_error"),
    TIMEOUT("timeout"),
    CANCELLED("cancelled");

    private final String code;

    ExecutionErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
