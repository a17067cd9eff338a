package com.natded.error;

import com.natded.proposition.Proposition;

/**
 * A disjunct of the eliminated disjunction opens none of the cited blocks.
 */
public class DisjunctNotFoundException extends ProofException {

    private final Proposition disjunct;
    private final Proposition disjunction;
    private final int line;

    public DisjunctNotFoundException(Proposition disjunct, Proposition disjunction, int line) {
        super(ErrorKind.DISJUNCT_NOT_FOUND, "the disjunct " + disjunct + " of " + disjunction + " on line " + line
            + " is not the assumption of any referenced block");
        this.disjunct = disjunct;
        this.disjunction = disjunction;
        this.line = line;
    }

    public Proposition disjunct() {
        return disjunct;
    }

    public Proposition disjunction() {
        return disjunction;
    }

    public int line() {
        return line;
    }
}
