package com.natded.error;

public class CannotCloseRootBlockException extends ProofException {

    public CannotCloseRootBlockException() {
        super(ErrorKind.CANNOT_CLOSE_ROOT_BLOCK, "the root block of a proof cannot be closed");
    }
}
