package com.natded.error;

import com.natded.proposition.Proposition;

/**
 * A replayed step produced a statement other than the recorded one.
 */
public class ReplayMismatchException extends ProofException {

    private final int line;
    private final Proposition expected;
    private final Proposition actual;

    public ReplayMismatchException(int line, Proposition expected, Proposition actual) {
        super(ErrorKind.REPLAY_MISMATCH, "line " + line + " was recorded as " + expected
            + " but replays as " + actual);
        this.line = line;
        this.expected = expected;
        this.actual = actual;
    }

    public int line() {
        return line;
    }

    public Proposition expected() {
        return expected;
    }

    public Proposition actual() {
        return actual;
    }
}
