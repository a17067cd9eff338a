package com.natded.session;

/**
 * Thrown when a request names a proof session that does not exist
 * (never created, or already deleted).
 */
public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("proof session not found: " + sessionId);
    }
}
