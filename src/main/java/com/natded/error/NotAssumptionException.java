package com.natded.error;

public class NotAssumptionException extends ProofException {

    private final int line;

    public NotAssumptionException(int line) {
        super(ErrorKind.NOT_ASSUMPTION, "line " + line + " is not an assumption");
        this.line = line;
    }

    public int line() {
        return line;
    }
}
