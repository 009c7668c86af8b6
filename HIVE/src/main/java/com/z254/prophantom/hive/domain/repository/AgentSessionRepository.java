package com.z254.prophantom.hive.domain.repository;

import com.z254.prophantom.hive.domain.model.AgentSession;
import com.z254.prophantom.hive.domain.model.SessionTier;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Repository for agent sessions. Sessions are never deleted, only archived.
 */
public interface AgentSessionRepository {

    /**
     * Find the session of (userId, agentType), creating it with the given initial tier if absent.
     */
    AgentSession getOrCreate(String userId, String agentType, SessionTier initialTier, Instant now);

    Optional<AgentSession> findById(String id);

    Optional<AgentSession> findByUserAndAgent(String userId, String agentType);

    List<AgentSession> findByUser(String userId);

    /**
     * Atomically increment the interaction count and recompute the tier.
     *
     * @param tierFunction maps (new interaction count, current tier) to the new tier
     */
    AgentSession recordInteraction(String sessionId, Instant at,
                                   BiFunction<Long, SessionTier, SessionTier> tierFunction);

    /**
     * Archive sessions whose last activity is before the cutoff.
     *
     * @return number of sessions archived
     */
    int archiveInactiveSince(Instant cutoff);

    long count();
}
