package com.natded.ledger;

public enum ProofStatus {
    OPEN,
    COMPLETE
}
