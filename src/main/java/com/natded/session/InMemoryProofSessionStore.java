package com.natded.session;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryProofSessionStore implements ProofSessionStore {

    private final ConcurrentHashMap<String, ProofSession> sessions = new ConcurrentHashMap<>();
    private final int maxSessions;

    public InMemoryProofSessionStore(int maxSessions) {
        if (maxSessions < 1) {
            throw new IllegalArgumentException("maxSessions must be >= 1");
        }
        this.maxSessions = maxSessions;
    }

    @Override
    public synchronized ProofSession save(ProofSession session) {
        if (!sessions.containsKey(session.id()) && sessions.size() >= maxSessions) {
            throw new SessionLimitExceededException(maxSessions);
        }
        sessions.put(session.id(), session);
        return session;
    }

    @Override
    public Optional<ProofSession> findById(String id) {
        return Optional.ofNullable(sessions.get(id));
    }

    @Override
    public boolean delete(String id) {
        return sessions.remove(id) != null;
    }

    @Override
    public int count() {
        return sessions.size();
    }
}
