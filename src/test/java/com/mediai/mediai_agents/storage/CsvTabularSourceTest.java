package com.mediai.mediai_agents.storage;

import com.mediai.mediai_agents.model.ingest.RowBatch;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvTabularSourceTest {

    @TempDir
    Path tempDir;

    private final CsvTabularSource source = new CsvTabularSource();

    @Test
    void shouldCountDataRowsWithoutHeaderOrBlankLines() throws IOException {
        Path file = write("a,b\n1,2\n\n3,4\n5,6\n");

        assertEquals(3, source.countDataRows(file));
    }

    @Test
    void shouldCountZeroForEmptyFile() throws IOException {
        assertEquals(0, source.countDataRows(write("")));
        assertEquals(0, source.countDataRows(write("a,b\n")));
    }

    @Test
    void shouldReadQuotedFieldsAsSingleValues() throws IOException {
        Path file = write("note,id\n\"sedated, intubated\",1\n\"line\nbreak\",2\n");

        try (BatchReader reader = source.openBatches(file, 0, 10)) {
            RowBatch batch = reader.next();
            assertEquals(2, batch.size());
            assertEquals("sedated, intubated", batch.rows().get(0)[0]);
            assertEquals("line\nbreak", batch.rows().get(1)[0]);
            assertFalse(reader.hasNext());
        }
    }

    @Test
    void shouldSkipRowsAndNumberBatchesFromOffset() throws IOException {
        Path file = write("stay_id , subject_id\n1,10\n2,20\n3,30\n4,40\n5,50\n");

        try (BatchReader reader = source.openBatches(file, 2, 2)) {
            assertEquals(List.of("stay_id", "subject_id"), reader.columns());

            RowBatch first = reader.next();
            assertEquals(2, first.firstRow());
            assertEquals("3", first.rows().get(0)[0]);
            assertEquals(2, first.size());

            RowBatch second = reader.next();
            assertEquals(4, second.firstRow());
            assertEquals(1, second.size());
            assertFalse(reader.hasNext());
        }
    }

    @Test
    void shouldYieldNothingWhenOffsetPassesEnd() throws IOException {
        Path file = write("a\n1\n2\n");

        try (BatchReader reader = source.openBatches(file, 10, 5)) {
            assertFalse(reader.hasNext());
        }
    }

    @Test
    void shouldRejectNonPositiveBatchSize() throws IOException {
        Path file = write("a\n1\n");

        assertThrows(IllegalArgumentException.class, () -> source.openBatches(file, 0, 0));
    }

    private Path write(String content) throws IOException {
        Path file = Files.createTempFile(tempDir, "source", ".csv");
        Files.writeString(file, content);
        return file;
    }
}
