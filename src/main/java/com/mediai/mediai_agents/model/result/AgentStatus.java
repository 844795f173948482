package com.mediai.mediai_agents.model.result;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AgentStatus {
    IDLE,
    RUNNING,
    SUCCESS,
    FAILED,
    PAUSED;  // reserved for suspension support, never entered today

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
