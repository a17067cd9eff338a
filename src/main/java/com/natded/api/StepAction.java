package com.natded.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum StepAction {
    ADD_PREMISE("add_premise"),
    OPEN_BLOCK("open_block"),
    CLOSE_BLOCK("close_block"),
    REITERATE("reiterate"),
    AND_INTRO("and_intro"),
    AND_ELIM("and_elim"),
    OR_INTRO("or_intro"),
    OR_ELIM("or_elim"),
    IMPLIES_INTRO("implies_intro"),
    IMPLIES_ELIM("implies_elim"),
    NOT_INTRO("not_intro"),
    NOT_ELIM("not_elim"),
    EXPLOSION("explosion");

    private final String value;

    StepAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static StepAction fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown step action: " + raw));
    }
}
