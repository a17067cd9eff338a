package com.natded.error;

/**
 * Base type of every rejected proof step. A step that throws leaves the
 * ledger exactly as it was before the call.
 */
public abstract class ProofException extends RuntimeException {

    private final ErrorKind kind;

    protected ProofException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
