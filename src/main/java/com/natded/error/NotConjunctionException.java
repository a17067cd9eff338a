package com.natded.error;

import com.natded.proposition.Proposition;

public class NotConjunctionException extends ProofException {

    private final int line;
    private final Proposition statement;

    public NotConjunctionException(int line, Proposition statement) {
        super(ErrorKind.NOT_CONJUNCTION, "the statement " + statement + " on line " + line + " is not a conjunction");
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
