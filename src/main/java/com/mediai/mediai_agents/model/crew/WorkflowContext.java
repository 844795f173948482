package com.mediai.mediai_agents.model.crew;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Crew name -> context of that crew. A crew without an entry runs with an empty context.
 *
 * <pre>
 * {
 *   "data_pipeline":     { "ingestion": {...}, "quality": {...} },
 *   "model_development": { "training": {...}, "evaluation": {...} },
 *   "deployment":        { "deployment": {...} }
 * }
 * </pre>
 */
public final class WorkflowContext {

    private final Map<String, CrewContext> crews;

    private WorkflowContext(Map<String, CrewContext> crews) {
        this.crews = crews;
    }

    @SuppressWarnings("unchecked")
    public static WorkflowContext from(Map<String, ?> raw) {
        Map<String, CrewContext> crews = new LinkedHashMap<>();
        if (raw != null) {
            raw.forEach((crew, value) -> {
                if (value == null) {
                    crews.put(crew, CrewContext.empty());
                } else if (value instanceof Map<?, ?> map) {
                    crews.put(crew, CrewContext.from((Map<String, ?>) map));
                } else {
                    throw new IllegalArgumentException("Context of crew '" + crew + "' must be an object");
                }
            });
        }
        return new WorkflowContext(Collections.unmodifiableMap(crews));
    }

    public static WorkflowContext of(String crew, CrewContext context) {
        return new WorkflowContext(Map.of(crew, context));
    }

    public CrewContext forCrew(String crewName) {
        return crews.getOrDefault(crewName, CrewContext.empty());
    }

    public Map<String, CrewContext> asMap() {
        return crews;
    }
}
