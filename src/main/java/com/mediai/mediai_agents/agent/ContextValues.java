package com.mediai.mediai_agents.agent;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed reads from an untyped task context. Contexts arrive from JSON request bodies,
 * CLI arguments and Java callers, so numbers may be strings and lists may hold mixed values.
 */
public final class ContextValues {

    private ContextValues() {}

    /** Non-blank string value, or null. */
    public static String string(Map<String, Object> context, String key) {
        Object raw = context.get(key);
        if (raw == null) return null;
        String value = raw.toString().trim();
        return value.isEmpty() ? null : value;
    }

    public static String string(Map<String, Object> context, String key, String fallback) {
        String value = string(context, key);
        return value != null ? value : fallback;
    }

    /** Empty when absent; throws when present but not a whole number. */
    public static Optional<Long> wholeNumber(Map<String, Object> context, String key) {
        Object raw = context.get(key);
        if (raw == null) return Optional.empty();
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
            return Optional.of(((Number) raw).longValue());
        }
        try {
            return Optional.of(Long.parseLong(raw.toString().trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a whole number, got: " + raw);
        }
    }

    /** Empty when absent or not numeric. */
    public static Optional<Double> number(Map<String, Object> context, String key) {
        return context == null ? Optional.empty() : toNumber(context.get(key));
    }

    /** Numbers and numeric strings; empty for anything else. */
    public static Optional<Double> toNumber(Object raw) {
        if (raw instanceof Number n) return Optional.of(n.doubleValue());
        if (raw instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public static boolean isListOrAbsent(Map<String, Object> context, String key) {
        Object raw = context.get(key);
        return raw == null || raw instanceof List<?>;
    }

    public static boolean isMapOrAbsent(Map<String, Object> context, String key) {
        Object raw = context.get(key);
        return raw == null || raw instanceof Map<?, ?>;
    }

    /** Elements rendered as strings; null elements dropped. Empty list when absent. */
    public static List<String> stringList(Map<String, Object> context, String key) {
        Object raw = context.get(key);
        if (!(raw instanceof List<?> list)) return List.of();
        List<String> values = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item != null) values.add(item.toString());
        }
        return values;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> map(Map<String, Object> context, String key) {
        Object raw = context.get(key);
        return raw instanceof Map<?, ?> ? (Map<String, Object>) raw : Map.of();
    }
}
