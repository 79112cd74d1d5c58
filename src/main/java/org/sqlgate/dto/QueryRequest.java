package org.sqlgate.dto;

// Body of POST /queries and POST /queries/check
public class QueryRequest {
    public String sql;
    // Optional caller id, used to cancel an in-flight execution
    public String requestId;
    // Optional per-request timeout; the configured statement timeout applies when absent
    public Long timeoutMs;

    public QueryRequest() {}

    public QueryRequest(String sql) {
        this.sql = sql;
    }
}
