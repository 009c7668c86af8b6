package com.z254.prophantom.hive.domain.repository.impl;

import com.z254.prophantom.hive.common.exception.NotFoundException;
import com.z254.prophantom.hive.domain.model.AgentSession;
import com.z254.prophantom.hive.domain.model.SessionTier;
import com.z254.prophantom.hive.domain.repository.AgentSessionRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

/**
 * In-memory implementation of AgentSessionRepository.
 * Stored sessions are replaced, never mutated in place, so readers always see a consistent copy.
 */
@Repository
public class InMemoryAgentSessionRepository implements AgentSessionRepository {

    private final Map<String, AgentSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, String> idsByKey = new ConcurrentHashMap<>();

    @Override
    public AgentSession getOrCreate(String userId, String agentType, SessionTier initialTier, Instant now) {
        String id = idsByKey.computeIfAbsent(key(userId, agentType), key -> {
            AgentSession session = AgentSession.builder()
                    .id(UUID.randomUUID().toString())
                    .userId(userId)
                    .agentType(agentType)
                    .interactionCount(0)
                    .tier(initialTier)
                    .createdAt(now)
                    .lastActivityAt(now)
                    .build();
            sessions.put(session.getId(), session);
            return session.getId();
        });
        return copy(sessions.get(id));
    }

    @Override
    public Optional<AgentSession> findById(String id) {
        return Optional.ofNullable(sessions.get(id)).map(this::copy);
    }

    @Override
    public Optional<AgentSession> findByUserAndAgent(String userId, String agentType) {
        return Optional.ofNullable(idsByKey.get(key(userId, agentType))).flatMap(this::findById);
    }

    @Override
    public List<AgentSession> findByUser(String userId) {
        return sessions.values().stream()
                .filter(session -> session.getUserId().equals(userId))
                .sorted(Comparator.comparing(AgentSession::getAgentType))
                .map(this::copy)
                .collect(Collectors.toList());
    }

    @Override
    public AgentSession recordInteraction(String sessionId, Instant at,
                                          BiFunction<Long, SessionTier, SessionTier> tierFunction) {
        AgentSession updated = sessions.computeIfPresent(sessionId, (id, current) -> {
            long count = current.getInteractionCount() + 1;
            return current.toBuilder()
                    .interactionCount(count)
                    .tier(tierFunction.apply(count, current.getTier()))
                    .lastActivityAt(at)
                    .archived(false)
                    .build();
        });
        if (updated == null) {
            throw new NotFoundException("Session not found: " + sessionId);
        }
        return copy(updated);
    }

    @Override
    public int archiveInactiveSince(Instant cutoff) {
        AtomicInteger archived = new AtomicInteger();
        sessions.replaceAll((id, session) -> {
            if (!session.isArchived() && session.getLastActivityAt().isBefore(cutoff)) {
                archived.incrementAndGet();
                return session.toBuilder().archived(true).build();
            }
            return session;
        });
        return archived.get();
    }

    @Override
    public long count() {
        return sessions.size();
    }

    private AgentSession copy(AgentSession session) {
        return session.toBuilder().build();
    }

    private static String key(String userId, String agentType) {
        return userId + "\u0000" + agentType;
    }
}
