package com.natded.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.natded.proposition.Proposition;

import java.util.List;

/**
 * One proof step. Which fields are required depends on {@code action}:
 * <ul>
 *   <li>add_premise, open_block, explosion: statement</li>
 *   <li>reiterate, and_elim: line</li>
 *   <li>or_intro: statement (the new disjunct) and line</li>
 *   <li>and_intro, implies_elim, not_elim: first and second</li>
 *   <li>implies_intro, not_intro: block_id</li>
 *   <li>or_elim: line and block_ids</li>
 *   <li>close_block: nothing</li>
 * </ul>
 */
public record StepRequest(
    @JsonProperty("action") StepAction action,
    @JsonProperty("statement") Proposition statement,
    @JsonProperty("line") Integer line,
    @JsonProperty("first") Integer first,
    @JsonProperty("second") Integer second,
    @JsonProperty("block_id") Integer blockId,
    @JsonProperty("block_ids") List<Integer> blockIds,
    @JsonProperty("comment") String comment
) {}
