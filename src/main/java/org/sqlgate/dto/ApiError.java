package org.sqlgate.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

// Body of every non-200 response. Guard rejections never use it; they travel in QueryEnvelope
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    public int status;
    // Short machine code, e.g. "bad_request" or "database_unavailable"
    public String error;
    public String detail;

    public ApiError() {}

    public ApiError(int status, String error, String detail) {
        this.status = status;
        this.error = error;
        this.detail = detail;
    }
}
