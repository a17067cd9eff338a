package com.natded.error;

import com.natded.proposition.Proposition;

public class ConclusionsNotTheSameException extends ProofException {

    private final Proposition conclusion;
    private final Proposition nonMatching;
    private final int blockId;

    public ConclusionsNotTheSameException(Proposition conclusion, Proposition nonMatching, int blockId) {
        super(ErrorKind.CONCLUSIONS_NOT_THE_SAME, "the conclusion " + nonMatching + " of block " + blockId
            + " does not match " + conclusion);
        this.conclusion = conclusion;
        this.nonMatching = nonMatching;
        this.blockId = blockId;
    }

    public Proposition conclusion() {
        return conclusion;
    }

    public Proposition nonMatching() {
        return nonMatching;
    }

    public int blockId() {
        return blockId;
    }
}
