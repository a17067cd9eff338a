package com.natded.error;

public class NotContradictionException extends ProofException {

    private final int first;
    private final int second;

    public NotContradictionException(int first, int second) {
        super(ErrorKind.NOT_CONTRADICTION, "the statements at lines " + first + " and " + second
            + " do not contradict each other");
        this.first = first;
        this.second = second;
    }

    public int first() {
        return first;
    }

    public int second() {
        return second;
    }
}
