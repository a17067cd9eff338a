package com.natded.proof;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.natded.proposition.Proposition;

import java.util.List;

/**
 * Metadata of a proof at a point in time.
 *
 * {@code lineCount} excludes the goal declaration on line 0 and
 * {@code blockCount} excludes the root block.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProofSummary(
    @JsonProperty("name") String name,
    @JsonProperty("goal") Proposition goal,
    @JsonProperty("premises") List<Proposition> premises,
    @JsonProperty("complete") boolean complete,
    @JsonProperty("line_count") int lineCount,
    @JsonProperty("block_count") int blockCount,
    @JsonProperty("current_level") int currentLevel
) {}
