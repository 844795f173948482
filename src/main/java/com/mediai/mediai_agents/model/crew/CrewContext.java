package com.mediai.mediai_agents.model.crew;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Task name -> input of that task. Read-only once built; a crew skips tasks it has no entry for.
 */
public final class CrewContext {

    private static final CrewContext EMPTY = new CrewContext(Map.of());

    private final Map<String, Map<String, Object>> tasks;

    private CrewContext(Map<String, Map<String, Object>> tasks) {
        this.tasks = tasks;
    }

    public static CrewContext empty() {
        return EMPTY;
    }

    /**
     * Builds a context from a decoded JSON object. Every value must itself be an object;
     * a null value counts as an empty task input.
     */
    @SuppressWarnings("unchecked")
    public static CrewContext from(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) return EMPTY;
        Map<String, Map<String, Object>> tasks = new LinkedHashMap<>();
        raw.forEach((task, input) -> {
            if (input == null) {
                tasks.put(task, Map.of());
            } else if (input instanceof Map<?, ?> map) {
                tasks.put(task, Collections.unmodifiableMap(new LinkedHashMap<>((Map<String, Object>) map)));
            } else {
                throw new IllegalArgumentException("Input of task '" + task + "' must be an object");
            }
        });
        return new CrewContext(Collections.unmodifiableMap(tasks));
    }

    public static CrewContext of(String task, Map<String, Object> input) {
        return from(Map.of(task, input));
    }

    public boolean has(String task) {
        return tasks.containsKey(task);
    }

    public Optional<Map<String, Object>> task(String task) {
        return Optional.ofNullable(tasks.get(task));
    }

    public Map<String, Map<String, Object>> asMap() {
        return tasks;
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    @Override
    public String toString() {
        return "CrewContext" + tasks.keySet();
    }
}
