package com.natded.ledger;

/**
 * Justification recorded on each proof line.
 */
public enum RuleTag {
    GOAL,
    PREMISE,
    ASSUMPTION,
    REIT,
    AND_INTRO,
    AND_ELIM,
    OR_INTRO,
    OR_ELIM,
    IMPLIES_INTRO,
    IMPLIES_ELIM,
    NOT_INTRO,
    NOT_ELIM,
    EXPLOSION
}
