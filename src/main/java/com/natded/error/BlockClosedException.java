package com.natded.error;

public class BlockClosedException extends ProofException {

    private final int blockId;

    public BlockClosedException(int blockId) {
        super(ErrorKind.BLOCK_CLOSED, "block " + blockId + " has already been closed");
        this.blockId = blockId;
    }

    public int blockId() {
        return blockId;
    }
}
