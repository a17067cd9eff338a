package com.natded.session;

import java.util.Optional;

public interface ProofSessionStore {
    ProofSession save(ProofSession session);

    Optional<ProofSession> findById(String id);

    boolean delete(String id);

    int count();
}
