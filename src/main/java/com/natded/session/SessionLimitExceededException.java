package com.natded.session;

public class SessionLimitExceededException extends RuntimeException {

    public SessionLimitExceededException(int maxSessions) {
        super("session limit reached: at most " + maxSessions + " proofs may be open at once");
    }
}
