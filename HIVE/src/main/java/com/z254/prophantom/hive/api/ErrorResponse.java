package com.z254.prophantom.hive.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by every endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    private String error;
    private int code;
    private String message;
    private Map<String, Object> details;
    private Instant timestamp;
}
