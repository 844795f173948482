package com.mediai.mediai_agents.model.ingest;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Two-part destination name, e.g. {@code raw.icustays}.
 * Both parts are plain SQL identifiers so they can be inlined into statements.
 */
public record TableRef(String schema, String table) {

    public static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public TableRef {
        if (!isIdentifier(schema) || !isIdentifier(table)) {
            throw new IllegalArgumentException("Invalid table reference: " + schema + "." + table);
        }
    }

    public static Optional<TableRef> tryParse(String qualifiedName) {
        if (qualifiedName == null) return Optional.empty();
        String[] parts = qualifiedName.trim().split("\\.", -1);
        if (parts.length != 2 || !isIdentifier(parts[0]) || !isIdentifier(parts[1])) {
            return Optional.empty();
        }
        return Optional.of(new TableRef(parts[0], parts[1]));
    }

    public static TableRef parse(String qualifiedName) {
        return tryParse(qualifiedName)
                .orElseThrow(() -> new IllegalArgumentException(
                        "target table must be schema.table (e.g. raw.icustays), got: " + qualifiedName));
    }

    public static boolean isIdentifier(String value) {
        return value != null && IDENTIFIER.matcher(value).matches();
    }

    public String qualifiedName() {
        return schema + "." + table;
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
