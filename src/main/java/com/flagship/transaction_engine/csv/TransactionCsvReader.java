package com.flagship.transaction_engine.csv;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.transaction_engine.processor.TransactionRecord;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazily reads transaction records from CSV with a {@code type,client,tx,amount} header.
 *
 * Rows are parsed one at a time as the iterator advances, so arbitrarily
 * large inputs are never held in memory. The sequence can be iterated once.
 *
 * Failure handling:
 * - A row that is well-formed CSV but not a valid record makes {@code next()}
 *   throw {@link RecordParseException}; iteration can continue past it.
 * - I/O failures and broken CSV structure surface as {@link UncheckedIOException}
 *   and end the read.
 */
public class TransactionCsvReader implements Iterable<TransactionRecord>, Closeable {

    private final MappingIterator<TransactionCsvRow> rows;
    private boolean iterated;

    public TransactionCsvReader(CsvMapper csvMapper, Reader source) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        this.rows = csvMapper.readerFor(TransactionCsvRow.class)
            .with(schema)
            .readValues(source);
    }

    @Override
    public Iterator<TransactionRecord> iterator() {
        if (iterated) {
            throw new IllegalStateException("Transaction input can only be iterated once");
        }
        iterated = true;
        return new RecordIterator();
    }

    @Override
    public void close() throws IOException {
        rows.close();
    }

    private class RecordIterator implements Iterator<TransactionRecord> {

        private long rowNumber;

        @Override
        public boolean hasNext() {
            try {
                return rows.hasNextValue();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read transaction input after row " + rowNumber, e);
            }
        }

        @Override
        public TransactionRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            TransactionCsvRow row;
            try {
                row = rows.nextValue();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read transaction input at row " + (rowNumber + 1), e);
            }
            rowNumber++;
            return TransactionRecordMapper.toRecord(row, rowNumber);
        }
    }
}
