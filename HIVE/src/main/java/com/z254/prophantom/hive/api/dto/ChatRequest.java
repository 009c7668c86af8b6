package com.z254.prophantom.hive.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for the chat endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    @NotBlank(message = "userId is required")
    private String userId;

    @NotBlank(message = "agentType is required")
    private String agentType;

    @NotBlank(message = "Message is required")
    @Size(max = 50000, message = "Message must be less than 50000 characters")
    private String message;

    private Map<String, Object> context;
}
