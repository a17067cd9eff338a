package com.natded.ledger;

import com.natded.error.BlockNotClosedException;
import com.natded.error.BlockNotFoundException;
import com.natded.error.CannotCloseRootBlockException;
import com.natded.error.NoSuchLineException;
import com.natded.error.ProofAlreadyCompleteException;
import com.natded.error.ScopeException;
import com.natded.proposition.Proposition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Append-only line store plus the stack of open blocks.
 *
 * Accessibility follows the ancestor chain: a line may be cited by number
 * only while the block it was written in is still open, i.e. is the current
 * block or one of its ancestors. Lines of closed blocks stay reachable only
 * through rules that cite the whole block.
 *
 * Not thread-safe; one caller drives a ledger at a time.
 */
public class ScopeLedger {

    public static final String COMPLETE_TAG = "Complete";

    private final Proposition goal;
    private final List<Line> lines = new ArrayList<>();
    private final List<Block> blocks = new ArrayList<>();
    // top is the current block, bottom is the root
    private final Deque<Integer> openBlocks = new ArrayDeque<>();
    private ProofStatus status = ProofStatus.OPEN;

    public ScopeLedger(Proposition goal) {
        this.goal = Objects.requireNonNull(goal, "goal");
        blocks.add(Block.root());
        openBlocks.push(Block.ROOT_ID);
        lines.add(new Line(goal, 0, Block.ROOT_ID, RuleTag.GOAL, List.of(), List.of(), ""));
    }

    public Proposition goal() {
        return goal;
    }

    public ProofStatus status() {
        return status;
    }

    public boolean isComplete() {
        return status == ProofStatus.COMPLETE;
    }

    public void requireNotComplete() {
        if (isComplete()) {
            throw new ProofAlreadyCompleteException(goal);
        }
    }

    /**
     * Appends a line in the current block and runs the completion check.
     *
     * @return the index of the new line
     */
    public int append(Proposition statement,
                      RuleTag rule,
                      List<Integer> citedLines,
                      List<Integer> citedBlocks,
                      String comment) {
        requireNotComplete();
        int level = currentLevel();
        boolean completes = level == 0 && goal.equals(statement);
        lines.add(new Line(statement, level, currentBlockId(), rule, citedLines, citedBlocks,
            completes ? tagComplete(comment) : comment));
        if (completes) {
            status = ProofStatus.COMPLETE;
        }
        return lines.size() - 1;
    }

    /**
     * Opens a block nested in the current one and writes its assumption.
     *
     * @return the index of the assumption line
     */
    public int openBlock(Proposition assumption, String comment) {
        Objects.requireNonNull(assumption, "assumption");
        requireNotComplete();
        int id = blocks.size();
        blocks.add(new Block(id, currentLevel() + 1, currentBlockId(), lines.size(), null));
        openBlocks.push(id);
        return append(assumption, RuleTag.ASSUMPTION, List.of(), List.of(), comment);
    }

    /**
     * Closes the current block at the last appended line and returns to its parent.
     *
     * @return the id of the block just closed
     */
    public int closeBlock() {
        requireNotComplete();
        int current = currentBlockId();
        if (current == Block.ROOT_ID) {
            throw new CannotCloseRootBlockException();
        }
        blocks.set(current, blocks.get(current).close(lines.size() - 1));
        openBlocks.pop();
        return current;
    }

    /** Any line, including the goal declaration at index 0. */
    public Line line(int index) {
        if (index < 0 || index >= lines.size()) {
            throw new NoSuchLineException(index);
        }
        return lines.get(index);
    }

    /**
     * A line a rule may cite by number: it exists, is not the goal declaration
     * and is accessible from the current scope.
     */
    public Line citable(int index) {
        if (index < 1 || index >= lines.size()) {
            throw new NoSuchLineException(index);
        }
        Line line = lines.get(index);
        if (!openBlocks.contains(line.blockId())) {
            throw ScopeException.forLine(index, line.level(), currentLevel());
        }
        return line;
    }

    public boolean accessible(int index) {
        return index >= 1 && index < lines.size() && openBlocks.contains(lines.get(index).blockId());
    }

    public Block block(int blockId) {
        if (blockId < 0 || blockId >= blocks.size()) {
            throw new BlockNotFoundException(blockId);
        }
        return blocks.get(blockId);
    }

    /**
     * A block that exists and has been closed, so both ends of its span are
     * known: {@code startIndex()} is the assumption line and {@code endIndex()}
     * the last line written before the close. This is the block-span lookup
     * the discharging rules use.
     */
    public Block closedBlock(int blockId) {
        Block block = block(blockId);
        if (!block.isClosed()) {
            throw new BlockNotClosedException(blockId);
        }
        return block;
    }

    public boolean isOpen(int blockId) {
        return openBlocks.contains(blockId);
    }

    public int currentLevel() {
        return openBlocks.size() - 1;
    }

    public int currentBlockId() {
        return openBlocks.peek();
    }

    public int lastIndex() {
        return lines.size() - 1;
    }

    /** Whether anything other than premises has been written after the goal line. */
    public boolean hasDerivedLines() {
        return lines.stream().skip(1).anyMatch(l -> l.rule() != RuleTag.PREMISE);
    }

    public List<Line> lines() {
        return List.copyOf(lines);
    }

    public List<Block> blocks() {
        return List.copyOf(blocks);
    }

    private static String tagComplete(String comment) {
        if (comment == null || comment.isBlank()) {
            return COMPLETE_TAG;
        }
        return comment + " (" + COMPLETE_TAG + ")";
    }
}
