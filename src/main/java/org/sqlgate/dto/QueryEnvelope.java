package org.sqlgate.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

// Uniform outcome of one guarded query: a refusal, a failure or rows
@JsonInclude(JsonInclude.Include.ALWAYS)
public class QueryEnvelope {
    @JsonProperty("request_id")
    public String requestId;
    public boolean accepted;
    public String reason;
    @JsonProperty("matched_rule")
    public String matchedRule;
    public String message;
    @JsonProperty("normalized_sql")
    public String normalizedSql;
    public List<Map<String, Object>> rows;
    @JsonProperty("row_count")
    public int rowCount;
    public boolean truncated;
    public String error;
    @JsonProperty("error_kind")
    public String errorKind;
    @JsonProperty("elapsed_ms")
    public long elapsedMs;
}
