package com.natded.rule;

import com.natded.ledger.RuleTag;
import com.natded.proposition.Proposition;

import java.util.List;

/**
 * Outcome of a validated rule application: the statements to append, in
 * order, and the citations each of them carries. Nothing has been written
 * to the ledger yet when an Inference exists.
 */
public record Inference(
    RuleTag rule,
    List<Proposition> conclusions,
    List<Integer> citedLines,
    List<Integer> citedBlocks
) {

    public Inference {
        conclusions = List.copyOf(conclusions);
        citedLines = List.copyOf(citedLines);
        citedBlocks = List.copyOf(citedBlocks);
    }

    static Inference of(RuleTag rule, Proposition conclusion, List<Integer> citedLines, List<Integer> citedBlocks) {
        return new Inference(rule, List.of(conclusion), citedLines, citedBlocks);
    }
}
