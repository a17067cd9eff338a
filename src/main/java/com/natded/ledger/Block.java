package com.natded.ledger;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Scope descriptor. {@code startIndex} is the line of the opening assumption
 * (0 for the root block); {@code endIndex} is null while the block is open.
 * The root block has id 0, level 0 and parent -1 and is never closed.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Block(
    @JsonProperty("id") int id,
    @JsonProperty("level") int level,
    @JsonProperty("parent_id") int parentId,
    @JsonProperty("start_index") int startIndex,
    @JsonProperty("end_index") Integer endIndex
) {

    public static final int ROOT_ID = 0;

    static Block root() {
        return new Block(ROOT_ID, 0, -1, 0, null);
    }

    @JsonIgnore
    public boolean isClosed() {
        return endIndex != null;
    }

    @JsonIgnore
    public boolean isRoot() {
        return id == ROOT_ID;
    }

    Block close(int end) {
        return new Block(id, level, parentId, startIndex, end);
    }
}
