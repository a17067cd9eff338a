package com.natded.ledger;

import com.natded.error.BlockNotClosedException;
import com.natded.error.BlockNotFoundException;
import com.natded.error.CannotCloseRootBlockException;
import com.natded.error.NoSuchLineException;
import com.natded.error.ProofAlreadyCompleteException;
import com.natded.error.ScopeException;
import com.natded.proposition.Proposition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.natded.proposition.Proposition.atom;
import static com.natded.proposition.Proposition.implies;
import static org.junit.jupiter.api.Assertions.*;

class ScopeLedgerTest {

    private static final Proposition A = atom("A");
    private static final Proposition B = atom("B");
    private static final Proposition C = atom("C");

    private ScopeLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new ScopeLedger(implies(C, A));
    }

    @Test
    void newLedger_holdsOnlyGoalLineInRootBlock() {
        assertEquals(1, ledger.lines().size());
        Line goal = ledger.line(0);
        assertEquals(RuleTag.GOAL, goal.rule());
        assertEquals(implies(C, A), goal.statement());
        assertEquals(0, ledger.currentLevel());
        assertEquals(Block.ROOT_ID, ledger.currentBlockId());
        assertEquals(ProofStatus.OPEN, ledger.status());
    }

    @Nested
    @DisplayName("Block nesting")
    class Nesting {

        @Test
        void openBlock_nestsAndWritesAssumption() {
            int index = ledger.openBlock(C, "case C");
            assertEquals(1, index);
            assertEquals(1, ledger.currentLevel());
            assertEquals(1, ledger.currentBlockId());

            Line assumption = ledger.line(index);
            assertEquals(RuleTag.ASSUMPTION, assumption.rule());
            assertEquals(1, assumption.level());
            assertEquals(1, assumption.blockId());
            assertEquals("case C", assumption.comment());

            Block block = ledger.block(1);
            assertEquals(1, block.startIndex());
            assertEquals(Block.ROOT_ID, block.parentId());
            assertFalse(block.isClosed());
        }

        @Test
        void closeBlock_restoresLevelAndRecordsEnd() {
            ledger.openBlock(A, "");
            ledger.openBlock(B, "");
            ledger.append(B, RuleTag.REIT, List.of(2), List.of(), "");
            assertEquals(2, ledger.currentLevel());

            assertEquals(2, ledger.closeBlock());
            assertEquals(1, ledger.currentLevel());
            assertEquals(1, ledger.currentBlockId());
            assertEquals(3, ledger.block(2).endIndex());

            assertEquals(1, ledger.closeBlock());
            assertEquals(0, ledger.currentLevel());
            assertEquals(3, ledger.block(1).endIndex());
        }

        @Test
        void siblingBlocks_getDistinctIds() {
            ledger.openBlock(A, "");
            ledger.closeBlock();
            ledger.openBlock(B, "");
            assertEquals(2, ledger.currentBlockId());
            assertEquals(1, ledger.currentLevel());
            assertTrue(ledger.block(1).isClosed());
            assertFalse(ledger.block(2).isClosed());
        }

        @Test
        void closingRoot_fails() {
            assertThrows(CannotCloseRootBlockException.class, () -> ledger.closeBlock());
        }
    }

    @Nested
    @DisplayName("Accessibility")
    class Accessibility {

        @Test
        void ancestorLines_areCitable() {
            ledger.append(A, RuleTag.PREMISE, List.of(), List.of(), "");
            ledger.openBlock(B, "");
            ledger.openBlock(C, "");
            assertTrue(ledger.accessible(1));
            assertTrue(ledger.accessible(2));
            assertTrue(ledger.accessible(3));
            assertEquals(A, ledger.citable(1).statement());
        }

        @Test
        void closedBlockLines_areNotCitable() {
            ledger.openBlock(B, "");
            ledger.closeBlock();
            ledger.openBlock(C, "");

            assertFalse(ledger.accessible(1));
            ScopeException ex = assertThrows(ScopeException.class, () -> ledger.citable(1));
            assertEquals(1, ex.line());
            assertEquals(1, ex.citedLevel());
        }

        @Test
        void goalLine_isReadableButNotCitable() {
            assertEquals(RuleTag.GOAL, ledger.line(0).rule());
            NoSuchLineException ex = assertThrows(NoSuchLineException.class, () -> ledger.citable(0));
            assertEquals(0, ex.line());
        }

        @Test
        void outOfRangeLine_fails() {
            assertThrows(NoSuchLineException.class, () -> ledger.line(5));
            assertThrows(NoSuchLineException.class, () -> ledger.citable(-1));
        }
    }

    @Nested
    @DisplayName("Block lookup")
    class BlockLookup {

        @Test
        void unknownBlock_fails() {
            BlockNotFoundException ex = assertThrows(BlockNotFoundException.class, () -> ledger.closedBlock(3));
            assertEquals(3, ex.blockId());
        }

        @Test
        void openBlock_isNotClosed() {
            ledger.openBlock(A, "");
            assertThrows(BlockNotClosedException.class, () -> ledger.closedBlock(1));
            assertThrows(BlockNotClosedException.class, () -> ledger.closedBlock(Block.ROOT_ID));
        }

        @Test
        void closedBlock_exposesSpan() {
            ledger.openBlock(A, "");
            ledger.append(A, RuleTag.REIT, List.of(1), List.of(), "");
            ledger.closeBlock();
            Block block = ledger.closedBlock(1);
            assertEquals(1, block.startIndex());
            assertEquals(2, block.endIndex());
        }
    }

    @Nested
    @DisplayName("Completion")
    class Completion {

        @Test
        void goalAtRootLevel_completesAndTagsLine() {
            ledger.append(implies(C, A), RuleTag.PREMISE, List.of(), List.of(), "");
            assertTrue(ledger.isComplete());
            assertEquals(ScopeLedger.COMPLETE_TAG, ledger.line(1).comment());
        }

        @Test
        void goalInsideBlock_doesNotComplete() {
            ledger.openBlock(implies(C, A), "");
            assertFalse(ledger.isComplete());
        }

        @Test
        void completingLine_keepsCallerComment() {
            ledger.append(implies(C, A), RuleTag.PREMISE, List.of(), List.of(), "given");
            assertEquals("given (Complete)", ledger.line(1).comment());
        }

        @Test
        void appendAfterCompletion_fails() {
            ledger.append(implies(C, A), RuleTag.PREMISE, List.of(), List.of(), "");
            assertThrows(ProofAlreadyCompleteException.class,
                () -> ledger.append(A, RuleTag.PREMISE, List.of(), List.of(), ""));
            assertThrows(ProofAlreadyCompleteException.class, () -> ledger.openBlock(A, ""));
            assertEquals(2, ledger.lines().size());
        }
    }

    @Test
    void snapshots_areImmutable() {
        List<Line> lines = ledger.lines();
        assertThrows(UnsupportedOperationException.class, () -> lines.add(lines.get(0)));
        assertThrows(UnsupportedOperationException.class, () -> ledger.blocks().clear());
    }
}
