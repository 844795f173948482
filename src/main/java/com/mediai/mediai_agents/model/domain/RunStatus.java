package com.mediai.mediai_agents.model.domain;

import com.mediai.mediai_agents.model.crew.CrewStatus;
import com.mediai.mediai_agents.model.crew.WorkflowStatus;

public enum RunStatus {
    RUNNING,
    SUCCESS,
    PARTIAL_SUCCESS,
    FAILED;

    public static RunStatus of(WorkflowStatus status) {
        return switch (status) {
            case SUCCESS         -> SUCCESS;
            case PARTIAL_SUCCESS -> PARTIAL_SUCCESS;
            case FAILED          -> FAILED;
        };
    }

    public static RunStatus of(CrewStatus status) {
        return status == CrewStatus.SUCCESS ? SUCCESS : FAILED;
    }
}
