package com.natded.session;

import com.natded.ledger.Block;
import com.natded.ledger.Line;
import com.natded.proof.ProofController;
import com.natded.proof.ProofReplayer;
import com.natded.proposition.Proposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;

/**
 * Owns the live proofs. Sessions are independent of each other; steps on
 * the same session run one at a time.
 */
@Service
public class ProofSessionService {

    private static final Logger log = LoggerFactory.getLogger(ProofSessionService.class);

    private final ProofSessionStore store;
    private final ProofReplayer replayer;

    public ProofSessionService(ProofSessionStore store, ProofReplayer replayer) {
        this.store = store;
        this.replayer = replayer;
    }

    public ProofSession create(Proposition goal, List<Proposition> premises, String name) {
        if (goal == null) {
            throw new IllegalArgumentException("goal is required");
        }
        ProofController proof = new ProofController(goal, premises == null ? List.of() : premises, name);
        ProofSession session = store.save(new ProofSession(UUID.randomUUID().toString(), Instant.now(), proof));
        log.info("Created proof session={} goal={} premises={}", session.id(), goal, proof.getPremises().size());
        return session;
    }

    /** Rebuilds a recorded proof and keeps it as a new session. */
    public ProofSession replay(Proposition goal, String name, List<Line> lines, List<Block> blocks) {
        if (goal == null || lines == null) {
            throw new IllegalArgumentException("goal and lines are required");
        }
        ProofController proof = replayer.replay(goal, name, lines, blocks == null ? List.of() : blocks);
        ProofSession session = store.save(new ProofSession(UUID.randomUUID().toString(), Instant.now(), proof));
        log.info("Replayed proof into session={} complete={}", session.id(), proof.isComplete());
        return session;
    }

    public ProofSession get(String sessionId) {
        return store.findById(sessionId)
            .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public void delete(String sessionId) {
        if (!store.delete(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        log.info("Deleted proof session={}", sessionId);
    }

    /**
     * Runs one step against a session's proof while holding the session's monitor.
     */
    public <T> T execute(String sessionId, Function<ProofController, T> step) {
        ProofSession session = get(sessionId);
        synchronized (session.proof()) {
            T result = step.apply(session.proof());
            log.debug("Step applied to session={}, lines={}", sessionId, session.proof().getLines().size() - 1);
            return result;
        }
    }
}
