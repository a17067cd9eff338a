package com.natded.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.natded.proposition.Proposition;

import java.util.List;

public record CreateProofRequest(
    @JsonProperty("name") String name,
    @JsonProperty("goal") Proposition goal,
    @JsonProperty("premises") List<Proposition> premises
) {}
