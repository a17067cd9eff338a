package com.natded.error;

public class BlockNotClosedException extends ProofException {

    private final int blockId;

    public BlockNotClosedException(int blockId) {
        super(ErrorKind.BLOCK_NOT_CLOSED, "block " + blockId + " is still open");
        this.blockId = blockId;
    }

    public int blockId() {
        return blockId;
    }
}
