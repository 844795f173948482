package com.mediai.mediai_agents.model.ingest;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TableRefTest {

    @Test
    void shouldParseSchemaAndTable() {
        TableRef ref = TableRef.parse("raw.icustays");

        assertEquals("raw", ref.schema());
        assertEquals("icustays", ref.table());
        assertEquals("raw.icustays", ref.qualifiedName());
    }

    @Test
    void shouldRejectMalformedNames() {
        assertTrue(TableRef.tryParse("icustays").isEmpty());
        assertTrue(TableRef.tryParse("a.b.c").isEmpty());
        assertTrue(TableRef.tryParse("raw.").isEmpty());
        assertTrue(TableRef.tryParse("raw.ic-ustays").isEmpty());
        assertTrue(TableRef.tryParse("raw.x; DROP TABLE y").isEmpty());
        assertTrue(TableRef.tryParse(null).isEmpty());

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> TableRef.parse("icustays"));
        assertTrue(ex.getMessage().contains("schema.table"));
    }
}
