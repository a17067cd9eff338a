package com.natded.error;

import com.natded.proposition.Proposition;

public class NotFalseException extends ProofException {

    private final int line;
    private final Proposition statement;

    public NotFalseException(int line, Proposition statement) {
        super(ErrorKind.NOT_FALSE, "line " + line + " contains " + statement + " not False");
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
