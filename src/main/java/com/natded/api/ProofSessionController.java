package com.natded.api;

import com.natded.proof.ProofController;
import com.natded.proof.ProofSummary;
import com.natded.session.ProofSession;
import com.natded.session.ProofSessionService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST surface over proof sessions.
 *
 * POST   /v1/proofs                 open a proof
 * GET    /v1/proofs/{id}            full listing
 * GET    /v1/proofs/{id}/summary    metadata only
 * POST   /v1/proofs/{id}/steps      apply one rule
 * DELETE /v1/proofs/{id}            drop the session
 * POST   /v1/proofs/replay          re-check a recorded listing
 */
@RestController
@RequestMapping("/v1/proofs")
public class ProofSessionController {

    private final ProofSessionService sessions;

    public ProofSessionController(ProofSessionService sessions) {
        this.sessions = sessions;
    }

    @PostMapping
    public Map<String, Object> create(@RequestBody CreateProofRequest request) {
        if (request.goal() == null) {
            throw new IllegalArgumentException("goal is required");
        }
        ProofSession session = sessions.create(request.goal(), request.premises(), request.name());
        return Map.of(
            "status", "created",
            "proof_id", session.id(),
            "complete", session.proof().isComplete()
        );
    }

    @PostMapping("/replay")
    public ProofView replay(@RequestBody ReplayRequest request) {
        ProofSession session = sessions.replay(request.goal(), request.name(), request.lines(), request.blocks());
        return sessions.execute(session.id(), proof -> ProofView.of(session.id(), proof));
    }

    @GetMapping("/{proofId}")
    public ProofView get(@PathVariable String proofId) {
        return sessions.execute(proofId, proof -> ProofView.of(proofId, proof));
    }

    @GetMapping("/{proofId}/summary")
    public ProofSummary summary(@PathVariable String proofId) {
        return sessions.execute(proofId, ProofController::summary);
    }

    @PostMapping("/{proofId}/steps")
    public Map<String, Object> step(@PathVariable String proofId, @RequestBody StepRequest request) {
        if (request.action() == null) {
            throw new IllegalArgumentException("action is required");
        }
        return sessions.execute(proofId, proof -> {
            List<Integer> appended = apply(proof, request);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "accepted");
            body.put("line_indices", appended);
            body.put("complete", proof.isComplete());
            body.put("current_level", proof.currentLevel());
            return body;
        });
    }

    @DeleteMapping("/{proofId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String proofId) {
        sessions.delete(proofId);
    }

    private List<Integer> apply(ProofController proof, StepRequest request) {
        String comment = request.comment() == null ? "" : request.comment();
        return switch (request.action()) {
            case ADD_PREMISE -> List.of(proof.addPremise(require(request.statement(), "statement"), comment));
            case OPEN_BLOCK -> List.of(proof.openBlock(require(request.statement(), "statement"), comment));
            case CLOSE_BLOCK -> {
                proof.closeBlock();
                yield List.of();
            }
            case REITERATE -> List.of(proof.reiterate(require(request.line(), "line"), comment));
            case AND_INTRO -> List.of(proof.andIntro(
                require(request.first(), "first"), require(request.second(), "second"), comment));
            case AND_ELIM -> proof.andElim(require(request.line(), "line"), comment);
            case OR_INTRO -> List.of(proof.orIntro(
                require(request.statement(), "statement"), require(request.line(), "line"), comment));
            case OR_ELIM -> List.of(proof.orElim(
                require(request.line(), "line"), require(request.blockIds(), "block_ids"), comment));
            case IMPLIES_INTRO -> List.of(proof.impliesIntro(require(request.blockId(), "block_id"), comment));
            case IMPLIES_ELIM -> List.of(proof.impliesElim(
                require(request.first(), "first"), require(request.second(), "second"), comment));
            case NOT_INTRO -> List.of(proof.notIntro(require(request.blockId(), "block_id"), comment));
            case NOT_ELIM -> List.of(proof.notElim(
                require(request.first(), "first"), require(request.second(), "second"), comment));
            case EXPLOSION -> List.of(proof.explosion(require(request.statement(), "statement"), comment));
        };
    }

    private static <T> T require(T value, String field) {
        if (value == null) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }
}
