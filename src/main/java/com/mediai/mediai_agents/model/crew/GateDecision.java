package com.mediai.mediai_agents.model.crew;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param field    {@code task.output_key} that was inspected
 * @param observed value read from the crew output, 0 when missing or not numeric
 */
public record GateDecision(String crewName, String field, double threshold, double observed, boolean passed) {

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("crew_name", crewName);
        map.put("field",     field);
        map.put("threshold", threshold);
        map.put("observed",  observed);
        map.put("passed",    passed);
        return map;
    }
}
