package com.natded.error;

/**
 * Closed set of failure kinds a proof step can raise.
 * {@link #code()} is the machine-readable form used in API error responses.
 */
public enum ErrorKind {
    NO_SUCH_LINE,
    BLOCK_NOT_FOUND,
    BLOCK_NOT_CLOSED,
    CANNOT_CLOSE_ROOT_BLOCK,
    SCOPE_ERROR,
    NOT_ASSUMPTION,
    NOT_CONJUNCTION,
    NOT_DISJUNCTION,
    NOT_ANTECEDENT,
    NOT_CONTRADICTION,
    NOT_FALSE,
    DISJUNCT_NOT_FOUND,
    ASSUMPTION_NOT_FOUND,
    CONCLUSIONS_NOT_THE_SAME,
    PREMISE_NOT_AT_START,
    BLOCK_CLOSED,
    PROOF_ALREADY_COMPLETE,
    REPLAY_MISMATCH;

    public String code() {
        return name();
    }
}
