package com.natded.error;

import com.natded.proposition.Proposition;

public class ProofAlreadyCompleteException extends ProofException {

    private final Proposition goal;

    public ProofAlreadyCompleteException(Proposition goal) {
        super(ErrorKind.PROOF_ALREADY_COMPLETE, "the proof of " + goal + " is already complete");
        this.goal = goal;
    }

    public Proposition goal() {
        return goal;
    }
}
