package com.natded.error;

import com.natded.proposition.Proposition;

public class NotDisjunctionException extends ProofException {

    private final int line;
    private final Proposition statement;

    public NotDisjunctionException(int line, Proposition statement) {
        super(ErrorKind.NOT_DISJUNCTION, "the statement " + statement + " on line " + line + " is not a disjunction");
        this.line = line;
        this.statement = statement;
    }

    public int line() {
        return line;
    }

    public Proposition statement() {
        return statement;
    }
}
