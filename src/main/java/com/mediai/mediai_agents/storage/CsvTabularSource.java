package com.mediai.mediai_agents.storage;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.mediai.mediai_agents.model.ingest.RowBatch;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Streams CSV files with Jackson's CSV parser. The first record is the header;
 * blank lines are ignored and quoted fields may contain delimiters or line breaks.
 */
@Component
public class CsvTabularSource implements TabularSource {

    private final CsvMapper csvMapper;

    public CsvTabularSource() {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    @Override
    public long countDataRows(Path source) throws IOException {
        long records = 0;
        try (MappingIterator<String[]> it = open(source)) {
            while (it.hasNextValue()) {
                it.nextValue();
                records++;
            }
        }
        return Math.max(0, records - 1);
    }

    @Override
    public BatchReader openBatches(Path source, long skipRows, int batchSize) throws IOException {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        MappingIterator<String[]> it = open(source);
        try {
            List<String> columns = it.hasNextValue()
                    ? Arrays.stream(it.nextValue()).map(String::trim).toList()
                    : List.of();
            long skipped = 0;
            while (skipped < skipRows && it.hasNextValue()) {
                it.nextValue();
                skipped++;
            }
            return new CsvBatchReader(it, columns, skipped, batchSize);
        } catch (IOException | RuntimeException e) {
            it.close();
            throw e;
        }
    }

    private MappingIterator<String[]> open(Path source) throws IOException {
        return csvMapper.readerFor(String[].class).readValues(source.toFile());
    }

    private static final class CsvBatchReader implements BatchReader {

        private final MappingIterator<String[]> iterator;
        private final List<String> columns;
        private final int batchSize;
        private long nextRow;

        private CsvBatchReader(MappingIterator<String[]> iterator, List<String> columns,
                               long nextRow, int batchSize) {
            this.iterator = iterator;
            this.columns = columns;
            this.nextRow = nextRow;
            this.batchSize = batchSize;
        }

        @Override
        public List<String> columns() {
            return columns;
        }

        @Override
        public boolean hasNext() throws IOException {
            return iterator.hasNextValue();
        }

        @Override
        public RowBatch next() throws IOException {
            if (!iterator.hasNextValue()) {
                throw new NoSuchElementException("No more rows");
            }
            List<String[]> rows = new ArrayList<>(batchSize);
            while (rows.size() < batchSize && iterator.hasNextValue()) {
                rows.add(iterator.nextValue());
            }
            RowBatch batch = new RowBatch(nextRow, columns, rows);
            nextRow += rows.size();
            return batch;
        }

        @Override
        public void close() throws IOException {
            iterator.close();
        }
    }
}
