package com.natded.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.natded.proposition.Proposition;

import java.util.List;
import java.util.Objects;

/**
 * One immutable entry of the proof ledger. Line 0 is the goal declaration.
 *
 * @param level       nesting depth of the block the line was written in
 * @param blockId     id of that block, 0 for the root
 * @param citedLines  up to two line numbers the rule consumed
 * @param citedBlocks block ids the rule discharged (several for or-elimination)
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Line(
    @JsonProperty("statement") Proposition statement,
    @JsonProperty("level") int level,
    @JsonProperty("block_id") int blockId,
    @JsonProperty("rule") RuleTag rule,
    @JsonProperty("cited_lines") List<Integer> citedLines,
    @JsonProperty("cited_blocks") List<Integer> citedBlocks,
    @JsonProperty("comment") String comment
) {

    public Line {
        Objects.requireNonNull(statement, "statement");
        Objects.requireNonNull(rule, "rule");
        citedLines = citedLines == null ? List.of() : List.copyOf(citedLines);
        citedBlocks = citedBlocks == null ? List.of() : List.copyOf(citedBlocks);
        comment = comment == null ? "" : comment;
    }
}
