package org.sqlgate.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

// Result of POST /queries/{requestId}/cancel
public class CancelResponse {
    @JsonProperty("request_id")
    public String requestId;
    public boolean cancelled;

    public CancelResponse() {}

    public CancelResponse(String requestId, boolean cancelled) {
        this.requestId = requestId;
        this.cancelled = cancelled;
    }
}
