package com.natded.error;

public class BlockNotFoundException extends ProofException {

    private final int blockId;

    public BlockNotFoundException(int blockId) {
        super(ErrorKind.BLOCK_NOT_FOUND, "block " + blockId + " does not exist");
        this.blockId = blockId;
    }

    public int blockId() {
        return blockId;
    }
}
