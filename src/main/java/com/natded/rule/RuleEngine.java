package com.natded.rule;

import com.natded.error.AssumptionNotFoundException;
import com.natded.error.BlockClosedException;
import com.natded.error.ConclusionsNotTheSameException;
import com.natded.error.DisjunctNotFoundException;
import com.natded.error.NoSuchLineException;
import com.natded.error.NotAntecedentException;
import com.natded.error.NotAssumptionException;
import com.natded.error.NotConjunctionException;
import com.natded.error.NotContradictionException;
import com.natded.error.NotDisjunctionException;
import com.natded.error.NotFalseException;
import com.natded.error.PremiseNotAtStartException;
import com.natded.error.ScopeException;
import com.natded.ledger.Block;
import com.natded.ledger.Line;
import com.natded.ledger.RuleTag;
import com.natded.ledger.ScopeLedger;
import com.natded.proposition.Proposition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.natded.proposition.Proposition.and;
import static com.natded.proposition.Proposition.implies;
import static com.natded.proposition.Proposition.not;
import static com.natded.proposition.Proposition.or;

/**
 * Validates inference rule applications against a ledger.
 *
 * Every method only reads the ledger. It either throws the matching
 * {@link com.natded.error.ProofException} or returns the {@link Inference}
 * to append, so a rejected step can never leave a partial write behind.
 */
public class RuleEngine {

    private final ScopeLedger ledger;

    public RuleEngine(ScopeLedger ledger) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
    }

    public Inference premise(Proposition premise) {
        Objects.requireNonNull(premise, "premise");
        if (ledger.currentLevel() != 0 || ledger.hasDerivedLines()) {
            throw new PremiseNotAtStartException(premise);
        }
        return Inference.of(RuleTag.PREMISE, premise, List.of(), List.of());
    }

    public Inference reiterate(int line) {
        Proposition statement = ledger.citable(line).statement();
        return Inference.of(RuleTag.REIT, statement, List.of(line), List.of());
    }

    public Inference andIntro(int first, int second) {
        Proposition left = ledger.citable(first).statement();
        Proposition right = ledger.citable(second).statement();
        return Inference.of(RuleTag.AND_INTRO, and(left, right), List.of(first, second), List.of());
    }

    /** Both conjuncts, left first, each citing the conjunction. */
    public Inference andElim(int line) {
        Proposition statement = ledger.citable(line).statement();
        if (!(statement instanceof Proposition.And conjunction)) {
            throw new NotConjunctionException(line, statement);
        }
        return new Inference(RuleTag.AND_ELIM,
            List.of(conjunction.left(), conjunction.right()), List.of(line), List.of());
    }

    /** The cited statement becomes the left disjunct. */
    public Inference orIntro(Proposition newDisjunct, int line) {
        Objects.requireNonNull(newDisjunct, "newDisjunct");
        Proposition statement = ledger.citable(line).statement();
        return Inference.of(RuleTag.OR_INTRO, or(statement, newDisjunct), List.of(line), List.of());
    }

    /**
     * Case analysis: each disjunct must open one of the cited blocks, each
     * block must be opened by a disjunct, and all blocks must end in the
     * same conclusion. Case blocks sit exactly one level below the
     * disjunction and hang off a block that is still open.
     */
    public Inference orElim(int line, List<Integer> blockIds) {
        Objects.requireNonNull(blockIds, "blockIds");
        Line cited = ledger.citable(line);
        Proposition statement = cited.statement();
        if (!(statement instanceof Proposition.Or disjunction)) {
            throw new NotDisjunctionException(line, statement);
        }

        if (blockIds.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("block ids must not contain null");
        }

        List<Block> cases = new ArrayList<>();
        for (Integer blockId : blockIds) {
            cases.add(ledger.closedBlock(blockId));
        }

        int requiredLevel = cited.level() + 1;
        for (Block block : cases) {
            if (block.level() != requiredLevel || !ledger.isOpen(block.parentId())) {
                throw ScopeException.forBlock(block.id(), block.level(), requiredLevel);
            }
        }

        List<Proposition> assumptions = cases.stream()
            .map(block -> ledger.line(block.startIndex()).statement())
            .toList();

        for (Proposition disjunct : List.of(disjunction.left(), disjunction.right())) {
            if (!assumptions.contains(disjunct)) {
                throw new DisjunctNotFoundException(disjunct, disjunction, line);
            }
        }

        for (int i = 0; i < cases.size(); i++) {
            Proposition assumption = assumptions.get(i);
            if (!assumption.equals(disjunction.left()) && !assumption.equals(disjunction.right())) {
                throw new AssumptionNotFoundException(assumption, disjunction, cases.get(i).id());
            }
        }

        Proposition conclusion = conclusionOf(cases.get(0));
        for (Block block : cases) {
            Proposition other = conclusionOf(block);
            if (!other.equals(conclusion)) {
                throw new ConclusionsNotTheSameException(conclusion, other, block.id());
            }
        }

        return Inference.of(RuleTag.OR_ELIM, conclusion, List.of(line), blockIds);
    }

    public Inference impliesIntro(int blockId) {
        Block block = dischargeable(blockId);
        Line assumption = ledger.line(block.startIndex());
        if (assumption.rule() != RuleTag.ASSUMPTION) {
            throw new NotAssumptionException(block.startIndex());
        }
        return Inference.of(RuleTag.IMPLIES_INTRO,
            implies(assumption.statement(), conclusionOf(block)), List.of(), List.of(blockId));
    }

    /** Modus ponens; the two lines may be given in either order. */
    public Inference impliesElim(int first, int second) {
        Proposition a = ledger.citable(first).statement();
        Proposition b = ledger.citable(second).statement();

        Proposition consequent;
        if (b instanceof Proposition.Implies implication && implication.antecedent().equals(a)) {
            consequent = implication.consequent();
        } else if (a instanceof Proposition.Implies implication && implication.antecedent().equals(b)) {
            consequent = implication.consequent();
        } else {
            throw new NotAntecedentException(first, a, second, b);
        }
        return Inference.of(RuleTag.IMPLIES_ELIM, consequent, List.of(first, second), List.of());
    }

    public Inference notIntro(int blockId) {
        Block block = dischargeable(blockId);
        Proposition conclusion = conclusionOf(block);
        if (!(conclusion instanceof Proposition.False)) {
            throw new NotFalseException(block.endIndex(), conclusion);
        }
        Proposition assumption = ledger.line(block.startIndex()).statement();
        return Inference.of(RuleTag.NOT_INTRO, not(assumption), List.of(), List.of(blockId));
    }

    public Inference notElim(int first, int second) {
        Proposition a = ledger.citable(first).statement();
        Proposition b = ledger.citable(second).statement();
        if (!not(a).equals(b) && !not(b).equals(a)) {
            throw new NotContradictionException(first, second);
        }
        return Inference.of(RuleTag.NOT_ELIM, Proposition.FALSE, List.of(first, second), List.of());
    }

    /** Anything follows from False written on the immediately preceding line. */
    public Inference explosion(Proposition statement) {
        Objects.requireNonNull(statement, "statement");
        int previous = ledger.lastIndex();
        if (previous == 0) {
            throw new NoSuchLineException(0);
        }
        Line line = ledger.line(previous);
        if (!(line.statement() instanceof Proposition.False)) {
            throw new NotFalseException(previous, line.statement());
        }
        if (!ledger.isOpen(line.blockId())) {
            throw new BlockClosedException(line.blockId());
        }
        return Inference.of(RuleTag.EXPLOSION, statement, List.of(previous), List.of());
    }

    /** A closed block opened directly from the current block. */
    private Block dischargeable(int blockId) {
        Block block = ledger.closedBlock(blockId);
        int requiredLevel = ledger.currentLevel() + 1;
        if (block.level() != requiredLevel || block.parentId() != ledger.currentBlockId()) {
            throw ScopeException.forBlock(blockId, block.level(), requiredLevel);
        }
        return block;
    }

    /** The last line of a closed block, which must be written in the block itself. */
    private Proposition conclusionOf(Block block) {
        Line last = ledger.line(block.endIndex());
        if (last.blockId() != block.id()) {
            throw ScopeException.forConclusion(block.id(), block.level(), block.endIndex(), last.level());
        }
        return last.statement();
    }
}
