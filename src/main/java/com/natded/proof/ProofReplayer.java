package com.natded.proof;

import com.natded.error.ReplayMismatchException;
import com.natded.ledger.Block;
import com.natded.ledger.Line;
import com.natded.ledger.ScopeLedger;
import com.natded.proposition.Proposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds a proof from a recorded listing by re-issuing every step through
 * a fresh {@link ProofController}.
 *
 * The listing is the one {@link ProofController#getLines()} and
 * {@link ProofController#getBlocks()} expose: line 0 declares the goal, and
 * block close points are taken from the recorded block end indices since
 * closing a block writes no line. Any rule violation surfaces as the usual
 * {@link com.natded.error.ProofException}; a step that replays to a different
 * statement raises {@link ReplayMismatchException}.
 */
public class ProofReplayer {

    private static final Logger log = LoggerFactory.getLogger(ProofReplayer.class);

    public ProofController replay(Proposition goal, String name, List<Line> lines, List<Block> blocks) {
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("a recorded proof needs at least its goal line");
        }
        if (!goal.equals(lines.get(0).statement())) {
            throw new ReplayMismatchException(0, lines.get(0).statement(), goal);
        }

        Map<Integer, Integer> recordedEnds = new HashMap<>();
        for (Block block : blocks) {
            if (!block.isRoot() && block.endIndex() != null) {
                recordedEnds.put(block.id(), block.endIndex());
            }
        }

        ProofController proof = new ProofController(goal, name);
        int index = 1;
        while (index < lines.size()) {
            closeFinishedBlocks(proof, recordedEnds, index);
            Line recorded = lines.get(index);
            List<Integer> produced = step(proof, index, recorded);
            for (int j = 0; j < produced.size(); j++) {
                verify(proof, lines, produced.get(j), index + j);
            }
            index += produced.size();
        }
        closeFinishedBlocks(proof, recordedEnds, lines.size());

        log.info("Replayed proof '{}' of {}: {} lines, complete={}",
            name, goal, lines.size() - 1, proof.isComplete());
        return proof;
    }

    private void closeFinishedBlocks(ProofController proof, Map<Integer, Integer> recordedEnds, int nextIndex) {
        while (proof.currentBlockId() != Block.ROOT_ID) {
            Integer end = recordedEnds.get(proof.currentBlockId());
            if (end == null || end >= nextIndex) {
                return;
            }
            proof.closeBlock();
        }
    }

    private List<Integer> step(ProofController proof, int index, Line recorded) {
        String comment = untagged(recorded.comment());
        Proposition statement = recorded.statement();
        return switch (recorded.rule()) {
            case GOAL -> throw new ReplayMismatchException(index, statement, null);
            case PREMISE -> List.of(proof.addPremise(statement, comment));
            case ASSUMPTION -> List.of(proof.openBlock(statement, comment));
            case REIT -> List.of(proof.reiterate(citedLine(recorded, index, 0), comment));
            case AND_INTRO -> List.of(proof.andIntro(
                citedLine(recorded, index, 0), citedLine(recorded, index, 1), comment));
            case AND_ELIM -> proof.andElim(citedLine(recorded, index, 0), comment);
            case OR_INTRO -> {
                if (!(statement instanceof Proposition.Or disjunction)) {
                    throw new ReplayMismatchException(index, statement, null);
                }
                yield List.of(proof.orIntro(disjunction.right(), citedLine(recorded, index, 0), comment));
            }
            case OR_ELIM -> List.of(proof.orElim(citedLine(recorded, index, 0), recorded.citedBlocks(), comment));
            case IMPLIES_INTRO -> List.of(proof.impliesIntro(citedBlock(recorded, index), comment));
            case IMPLIES_ELIM -> List.of(proof.impliesElim(
                citedLine(recorded, index, 0), citedLine(recorded, index, 1), comment));
            case NOT_INTRO -> List.of(proof.notIntro(citedBlock(recorded, index), comment));
            case NOT_ELIM -> List.of(proof.notElim(
                citedLine(recorded, index, 0), citedLine(recorded, index, 1), comment));
            case EXPLOSION -> List.of(proof.explosion(statement, comment));
        };
    }

    private void verify(ProofController proof, List<Line> lines, int producedIndex, int expectedIndex) {
        Proposition actual = proof.getLine(producedIndex).statement();
        if (producedIndex != expectedIndex || expectedIndex >= lines.size()) {
            throw new ReplayMismatchException(expectedIndex, null, actual);
        }
        Proposition expected = lines.get(expectedIndex).statement();
        if (!expected.equals(actual)) {
            throw new ReplayMismatchException(expectedIndex, expected, actual);
        }
    }

    private static int citedLine(Line recorded, int index, int position) {
        if (recorded.citedLines().size() <= position) {
            throw new IllegalArgumentException("line " + index + " by " + recorded.rule()
                + " cites " + recorded.citedLines().size() + " lines, expected more");
        }
        return recorded.citedLines().get(position);
    }

    private static int citedBlock(Line recorded, int index) {
        if (recorded.citedBlocks().isEmpty()) {
            throw new IllegalArgumentException("line " + index + " by " + recorded.rule() + " cites no block");
        }
        return recorded.citedBlocks().get(0);
    }

    private static String untagged(String comment) {
        String suffix = " (" + ScopeLedger.COMPLETE_TAG + ")";
        if (ScopeLedger.COMPLETE_TAG.equals(comment)) {
            return "";
        }
        if (comment.endsWith(suffix)) {
            return comment.substring(0, comment.length() - suffix.length());
        }
        return comment;
    }
}
