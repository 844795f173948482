package com.mediai.mediai_agents.model.crew;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * PARTIAL_SUCCESS means a decision gate stopped the workflow; nothing actually failed.
 */
public enum WorkflowStatus {
    SUCCESS,
    PARTIAL_SUCCESS,
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
