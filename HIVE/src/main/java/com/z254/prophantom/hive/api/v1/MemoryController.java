package com.z254.prophantom.hive.api.v1;

import com.z254.prophantom.hive.config.HiveProperties;
import com.z254.prophantom.hive.domain.model.ScoredMemory;
import com.z254.prophantom.hive.memory.ConsolidationReport;
import com.z254.prophantom.hive.memory.MemoryMaintenanceScheduler;
import com.z254.prophantom.hive.memory.MemoryStats;
import com.z254.prophantom.hive.memory.MemoryStore;
import com.z254.prophantom.hive.memory.UserMemoryAnalyzer;
import com.z254.prophantom.hive.memory.UserMemoryProfile;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * REST controller for memory queries, analytics and consolidation.
 */
@RestController
@RequestMapping("/api/v1/memory")
@Tag(name = "Memory", description = "Agent memory")
@Slf4j
public class MemoryController {

    private final MemoryStore memoryStore;
    private final UserMemoryAnalyzer memoryAnalyzer;
    private final MemoryMaintenanceScheduler maintenanceScheduler;
    private final HiveProperties properties;

    public MemoryController(MemoryStore memoryStore, UserMemoryAnalyzer memoryAnalyzer,
                            MemoryMaintenanceScheduler maintenanceScheduler, HiveProperties properties) {
        this.memoryStore = memoryStore;
        this.memoryAnalyzer = memoryAnalyzer;
        this.maintenanceScheduler = maintenanceScheduler;
        this.properties = properties;
    }

    @GetMapping("/{userId}/{agentType}")
    @Operation(summary = "Query memory", description = "Top-k memories ranked by relevance to the query text")
    @ApiResponse(responseCode = "200", description = "Memories retrieved")
    public Flux<ScoredMemory> query(
            @Parameter(description = "User ID") @PathVariable String userId,
            @Parameter(description = "Agent type") @PathVariable String agentType,
            @Parameter(description = "Query text") @RequestParam(name = "q", defaultValue = "") String query,
            @Parameter(description = "Maximum results") @RequestParam(name = "k", required = false) Integer k) {
        int limit = k != null ? k : properties.getMemory().getDefaultQueryLimit();
        return Flux.defer(() -> Flux.fromIterable(memoryStore.rank(userId, agentType, query, limit)));
    }

    @GetMapping("/{userId}/analytics")
    @Operation(summary = "Memory analytics", description = "Counts by kind, average importance and age distribution")
    @ApiResponse(responseCode = "200", description = "Analytics computed")
    public Mono<UserMemoryProfile> analytics(@Parameter(description = "User ID") @PathVariable String userId) {
        return Mono.fromCallable(() -> memoryAnalyzer.analyze(userId));
    }

    @GetMapping("/stats")
    @Operation(summary = "Store statistics", description = "Item and association counts across all users")
    @ApiResponse(responseCode = "200", description = "Statistics retrieved")
    public Mono<MemoryStats> stats() {
        return Mono.fromCallable(memoryStore::stats);
    }

    @PostMapping("/consolidate")
    @Operation(summary = "Consolidate", description = "Run one consolidation pass now")
    @ApiResponse(responseCode = "200", description = "Pass completed or skipped if one is already running")
    public Mono<ConsolidationReport> consolidate() {
        log.info("Consolidation requested via API");
        return Mono.fromCallable(maintenanceScheduler::consolidate)
                .subscribeOn(Schedulers.boundedElastic());
    }
}
