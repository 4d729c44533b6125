package com.mediguard.ledger.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Standard error response format for API errors
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /**
     * Error code for programmatic error handling
     */
    private String errorCode;

    private String message;

    private int status;

    @Builder.Default
    private Instant timestamp = Instant.now();

    private String path;

    /**
     * Validation errors (for 400 Bad Request)
     */
    private List<FieldError> fieldErrors;

    /**
     * Additional error metadata, e.g. the failing verification report
     */
    private Map<String, Object> metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FieldError {
        private String field;
        private String rejectedValue;
        private String message;
    }
}
