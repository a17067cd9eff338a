package com.natded.session;

import com.natded.proof.ProofReplayer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SessionConfiguration {

    @Bean
    public ProofSessionStore proofSessionStore(
            @Value("${natded.sessions.max-sessions:1000}") int maxSessions) {
        return new InMemoryProofSessionStore(maxSessions);
    }

    @Bean
    public ProofReplayer proofReplayer() {
        return new ProofReplayer();
    }
}
