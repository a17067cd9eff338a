package com.natded.session;

import com.natded.proof.ProofController;

import java.time.Instant;

/**
 * One live proof. The controller is also the monitor that serializes steps
 * issued against the session.
 */
public record ProofSession(String id, Instant createdAt, ProofController proof) {}
