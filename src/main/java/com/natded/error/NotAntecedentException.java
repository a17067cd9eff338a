package com.natded.error;

import com.natded.proposition.Proposition;

/**
 * Neither cited statement is an implication whose antecedent is the other one.
 */
public class NotAntecedentException extends ProofException {

    private final int first;
    private final int second;
    private final Proposition firstStatement;
    private final Proposition secondStatement;

    public NotAntecedentException(int first, Proposition firstStatement, int second, Proposition secondStatement) {
        super(ErrorKind.NOT_ANTECEDENT, "neither " + firstStatement + " (line " + first + ") nor "
            + secondStatement + " (line " + second + ") is the antecedent of the other");
        this.first = first;
        this.second = second;
        this.firstStatement = firstStatement;
        this.secondStatement = secondStatement;
    }

    public int first() {
        return first;
    }

    public int second() {
        return second;
    }

    public Proposition firstStatement() {
        return firstStatement;
    }

    public Proposition secondStatement() {
        return secondStatement;
    }
}
