package com.natded.proof;

import com.natded.ledger.Block;
import com.natded.ledger.Line;
import com.natded.ledger.ScopeLedger;
import com.natded.proposition.Proposition;
import com.natded.rule.Inference;
import com.natded.rule.RuleEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Entry point for building one natural-deduction proof.
 *
 * Each operation checks that the proof is still open, lets the
 * {@link RuleEngine} validate the step, then appends the resulting lines.
 * A rejected step throws a {@link com.natded.error.ProofException} and leaves
 * lines and blocks untouched. Once a line equal to the goal is written at
 * level 0 the proof is complete and every further mutating call fails with
 * {@link com.natded.error.ProofAlreadyCompleteException}.
 *
 * Instances are not thread-safe. Callers sharing a proof must serialize access
 * themselves (see {@code ProofSessionService}).
 */
public class ProofController {

    private static final Logger log = LoggerFactory.getLogger(ProofController.class);

    private final String name;
    private final ScopeLedger ledger;
    private final RuleEngine rules;
    private final List<Proposition> premises = new ArrayList<>();
    private final ConcurrentHashMap<String, Consumer<Line>> listeners = new ConcurrentHashMap<>();

    public ProofController(Proposition goal) {
        this(goal, List.of(), "");
    }

    public ProofController(Proposition goal, String name) {
        this(goal, List.of(), name);
    }

    /**
     * Opens a proof with its premises already written. Premises after one that
     * equals the goal are dropped, since that premise completes the proof.
     */
    public ProofController(Proposition goal, List<Proposition> premises, String name) {
        this.name = name == null ? "" : name;
        this.ledger = new ScopeLedger(goal);
        this.rules = new RuleEngine(ledger);
        for (Proposition premise : premises) {
            if (ledger.isComplete()) {
                log.info("Proof '{}' completed by a premise; ignoring remaining premises", this.name);
                break;
            }
            addPremise(premise);
        }
    }

    // ---- rule operations ----

    public int addPremise(Proposition premise) {
        return addPremise(premise, "");
    }

    public int addPremise(Proposition premise, String comment) {
        int index = single(() -> rules.premise(premise), comment);
        premises.add(premise);
        return index;
    }

    public int openBlock(Proposition assumption) {
        return openBlock(assumption, "");
    }

    public int openBlock(Proposition assumption, String comment) {
        int index = ledger.openBlock(assumption, comment);
        log.debug("Opened block {} at level {} with assumption {} on line {}",
            ledger.currentBlockId(), ledger.currentLevel(), assumption, index);
        notifyListeners(ledger.line(index));
        return index;
    }

    /** Closes the current block and returns its id, ready to be cited by a discharging rule. */
    public int closeBlock() {
        int closed = ledger.closeBlock();
        log.debug("Closed block {}, back at level {}", closed, ledger.currentLevel());
        return closed;
    }

    public int reiterate(int line) {
        return reiterate(line, "");
    }

    public int reiterate(int line, String comment) {
        return single(() -> rules.reiterate(line), comment);
    }

    public int andIntro(int first, int second) {
        return andIntro(first, second, "");
    }

    public int andIntro(int first, int second, String comment) {
        return single(() -> rules.andIntro(first, second), comment);
    }

    public List<Integer> andElim(int line) {
        return andElim(line, "");
    }

    /**
     * Writes both conjuncts, left first. If the left conjunct completes the
     * proof the right one is not written; the returned list holds only the
     * indices actually appended.
     */
    public List<Integer> andElim(int line, String comment) {
        return commit(checked(() -> rules.andElim(line)), comment);
    }

    public int orIntro(Proposition newDisjunct, int line) {
        return orIntro(newDisjunct, line, "");
    }

    public int orIntro(Proposition newDisjunct, int line, String comment) {
        return single(() -> rules.orIntro(newDisjunct, line), comment);
    }

    public int orElim(int line, List<Integer> blockIds) {
        return orElim(line, blockIds, "");
    }

    public int orElim(int line, List<Integer> blockIds, String comment) {
        return single(() -> rules.orElim(line, blockIds), comment);
    }

    public int impliesIntro(int blockId) {
        return impliesIntro(blockId, "");
    }

    public int impliesIntro(int blockId, String comment) {
        return single(() -> rules.impliesIntro(blockId), comment);
    }

    public int impliesElim(int first, int second) {
        return impliesElim(first, second, "");
    }

    public int impliesElim(int first, int second, String comment) {
        return single(() -> rules.impliesElim(first, second), comment);
    }

    public int notIntro(int blockId) {
        return notIntro(blockId, "");
    }

    public int notIntro(int blockId, String comment) {
        return single(() -> rules.notIntro(blockId), comment);
    }

    public int notElim(int first, int second) {
        return notElim(first, second, "");
    }

    public int notElim(int first, int second, String comment) {
        return single(() -> rules.notElim(first, second), comment);
    }

    public int explosion(Proposition statement) {
        return explosion(statement, "");
    }

    public int explosion(Proposition statement, String comment) {
        return single(() -> rules.explosion(statement), comment);
    }

    // ---- read side ----

    public String getName() {
        return name;
    }

    public Proposition getGoal() {
        return ledger.goal();
    }

    public List<Proposition> getPremises() {
        return List.copyOf(premises);
    }

    /** Immutable snapshot; index 0 is the goal declaration. */
    public List<Line> getLines() {
        return ledger.lines();
    }

    public Line getLine(int index) {
        return ledger.line(index);
    }

    /** Immutable snapshot; the root block comes first. */
    public List<Block> getBlocks() {
        return ledger.blocks();
    }

    public boolean isComplete() {
        return ledger.isComplete();
    }

    public int currentLevel() {
        return ledger.currentLevel();
    }

    public int currentBlockId() {
        return ledger.currentBlockId();
    }

    public ProofSummary summary() {
        return new ProofSummary(
            name,
            ledger.goal(),
            getPremises(),
            ledger.isComplete(),
            ledger.lastIndex(),
            ledger.blocks().size() - 1,
            ledger.currentLevel()
        );
    }

    // ---- listeners ----

    /** Registers a callback that receives every appended line, in order. */
    public String subscribe(Consumer<Line> listener) {
        String id = UUID.randomUUID().toString();
        listeners.put(id, Objects.requireNonNull(listener, "listener"));
        return id;
    }

    public void unsubscribe(String id) {
        listeners.remove(id);
    }

    // ---- internals ----

    private Inference checked(Supplier<Inference> rule) {
        ledger.requireNotComplete();
        return rule.get();
    }

    private int single(Supplier<Inference> rule, String comment) {
        return commit(checked(rule), comment).get(0);
    }

    private List<Integer> commit(Inference inference, String comment) {
        List<Integer> appended = new ArrayList<>();
        for (Proposition conclusion : inference.conclusions()) {
            if (ledger.isComplete()) {
                break;
            }
            int index = ledger.append(conclusion, inference.rule(),
                inference.citedLines(), inference.citedBlocks(), comment);
            appended.add(index);
            log.debug("Line {}: {} by {} at level {}", index, conclusion, inference.rule(), ledger.currentLevel());
            notifyListeners(ledger.line(index));
        }
        if (ledger.isComplete()) {
            log.info("Proof '{}' of {} is complete after {} lines", name, ledger.goal(), ledger.lastIndex());
        }
        return appended;
    }

    private void notifyListeners(Line line) {
        listeners.values().forEach(listener -> {
            try {
                listener.accept(line);
            } catch (Exception ex) {
                log.warn("Line listener failed for statement={}: {}", line.statement(), ex.getMessage());
            }
        });
    }
}
