package com.natded.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.natded.ledger.Block;
import com.natded.ledger.Line;
import com.natded.proof.ProofController;
import com.natded.proposition.Proposition;

import java.util.List;

/**
 * Read-only listing of a proof session, enough for a renderer to reproduce
 * the full proof without re-validating anything.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProofView(
    @JsonProperty("proof_id") String proofId,
    @JsonProperty("name") String name,
    @JsonProperty("goal") Proposition goal,
    @JsonProperty("premises") List<Proposition> premises,
    @JsonProperty("complete") boolean complete,
    @JsonProperty("current_level") int currentLevel,
    @JsonProperty("current_block_id") int currentBlockId,
    @JsonProperty("lines") List<Line> lines,
    @JsonProperty("blocks") List<Block> blocks
) {

    static ProofView of(String proofId, ProofController proof) {
        return new ProofView(
            proofId,
            proof.getName(),
            proof.getGoal(),
            proof.getPremises(),
            proof.isComplete(),
            proof.currentLevel(),
            proof.currentBlockId(),
            proof.getLines(),
            proof.getBlocks()
        );
    }
}
