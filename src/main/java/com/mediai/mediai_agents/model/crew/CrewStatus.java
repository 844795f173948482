package com.mediai.mediai_agents.model.crew;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CrewStatus {
    SUCCESS,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
