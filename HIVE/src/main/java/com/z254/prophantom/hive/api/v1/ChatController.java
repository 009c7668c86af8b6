package com.z254.prophantom.hive.api.v1;

import com.z254.prophantom.hive.api.dto.ChatRequest;
import com.z254.prophantom.hive.api.dto.ChatResponse;
import com.z254.prophantom.hive.dispatch.SessionDispatcher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * REST controller for single request/response chat turns.
 */
@RestController
@RequestMapping("/api/v1/chat")
@Tag(name = "Chat", description = "Chat with an agent")
@Slf4j
public class ChatController {

    private final SessionDispatcher dispatcher;

    public ChatController(SessionDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping
    @Operation(summary = "Send message", description = "Send a message to an agent and wait for the reply")
    @ApiResponse(responseCode = "200", description = "Reply generated")
    @ApiResponse(responseCode = "400", description = "Invalid request")
    @ApiResponse(responseCode = "404", description = "Unknown agent type")
    @ApiResponse(responseCode = "429", description = "Capacity exceeded, see Retry-After")
    @ApiResponse(responseCode = "503", description = "Agent backend unavailable")
    @ApiResponse(responseCode = "504", description = "Agent backend timed out")
    public Mono<ResponseEntity<ChatResponse>> sendMessage(@Valid @RequestBody ChatRequest request) {
        log.info("Chat message from user {} to agent {}", request.getUserId(), request.getAgentType());

        return dispatcher.exchange(request.getUserId(), request.getAgentType(), request.getMessage(),
                        request.getContext())
                .map(ChatResponse::fromReply)
                .map(ResponseEntity::ok);
    }
}
