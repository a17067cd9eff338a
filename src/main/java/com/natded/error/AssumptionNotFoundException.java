package com.natded.error;

import com.natded.proposition.Proposition;

/**
 * A cited block is opened by an assumption that is not a disjunct of the
 * eliminated disjunction.
 */
public class AssumptionNotFoundException extends ProofException {

    private final Proposition assumption;
    private final Proposition disjunction;
    private final int blockId;

    public AssumptionNotFoundException(Proposition assumption, Proposition disjunction, int blockId) {
        super(ErrorKind.ASSUMPTION_NOT_FOUND, "the assumption " + assumption + " of block " + blockId
            + " does not match a disjunct in " + disjunction);
        this.assumption = assumption;
        this.disjunction = disjunction;
        this.blockId = blockId;
    }

    public Proposition assumption() {
        return assumption;
    }

    public Proposition disjunction() {
        return disjunction;
    }

    public int blockId() {
        return blockId;
    }
}
