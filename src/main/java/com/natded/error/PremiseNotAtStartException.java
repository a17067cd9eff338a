package com.natded.error;

import com.natded.proposition.Proposition;

/**
 * Premises may only be added at level 0 before anything has been derived.
 */
public class PremiseNotAtStartException extends ProofException {

    private final Proposition premise;

    public PremiseNotAtStartException(Proposition premise) {
        super(ErrorKind.PREMISE_NOT_AT_START, "the premise " + premise
            + " must be added before any other line of the proof");
        this.premise = premise;
    }

    public Proposition premise() {
        return premise;
    }
}
