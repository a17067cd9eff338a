package com.natded.error;

/**
 * Thrown when a cited line number does not exist in the proof.
 */
public class NoSuchLineException extends ProofException {

    private final int line;

    public NoSuchLineException(int line) {
        super(ErrorKind.NO_SUCH_LINE, "the referenced line " + line + " does not exist in the proof");
        this.line = line;
    }

    public int line() {
        return line;
    }
}
