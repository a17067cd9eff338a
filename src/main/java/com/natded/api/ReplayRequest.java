package com.natded.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.natded.ledger.Block;
import com.natded.ledger.Line;
import com.natded.proposition.Proposition;

import java.util.List;

/**
 * A recorded proof listing, as returned in {@link ProofView}, to be checked
 * step by step.
 */
public record ReplayRequest(
    @JsonProperty("name") String name,
    @JsonProperty("goal") Proposition goal,
    @JsonProperty("lines") List<Line> lines,
    @JsonProperty("blocks") List<Block> blocks
) {}
