package com.flagship.transaction_engine.csv;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.flagship.transaction_engine.amount.Amount;
import com.flagship.transaction_engine.config.CsvConfig;
import com.flagship.transaction_engine.processor.TransactionRecord;
import com.flagship.transaction_engine.processor.TransactionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransactionCsvReaderTest {

    private final CsvMapper csvMapper = new CsvConfig().csvMapper();

    private TransactionCsvReader reader(String csv) throws IOException {
        return new TransactionCsvReader(csvMapper, new StringReader(csv));
    }

    @Test
    @DisplayName("Rows are typed, trimmed and yielded in input order")
    void testReadsRecords() throws IOException {
        String csv = "type, client, tx, amount\n"
            + "deposit, 1, 1, 1.0\n"
            + "withdrawal,2,2,0.12345\n"
            + "dispute, 1, 1,\n"
            + "resolve,1,1\n"
            + "\n"
            + "chargeback,  1 ,1 , \n";

        List<TransactionRecord> records = new ArrayList<>();
        try (TransactionCsvReader reader = reader(csv)) {
            reader.forEach(records::add);
        }

        assertEquals(List.of(
            TransactionRecord.deposit(1, 1, Amount.fromDecimalText("1.0")),
            TransactionRecord.withdrawal(2, 2, Amount.fromDecimalText("0.1235")),
            TransactionRecord.dispute(1, 1),
            TransactionRecord.resolve(1, 1),
            TransactionRecord.chargeback(1, 1)
        ), records);
    }

    @Test
    @DisplayName("Header-only input yields no records")
    void testHeaderOnly() throws IOException {
        try (TransactionCsvReader reader = reader("type,client,tx,amount\n")) {
            assertFalse(reader.iterator().hasNext());
        }
    }

    @Test
    @DisplayName("Bad rows throw RecordParseException and reading continues")
    void testBadRowsAreSkippable() throws IOException {
        String csv = "type,client,tx,amount\n"
            + "refund,1,1,1.0\n"
            + "deposit,x,2,1.0\n"
            + "deposit,-1,3,1.0\n"
            + "deposit,1,4,\n"
            + "dispute,1,5,2.0\n"
            + "deposit,1,6,1e5\n"
            + "deposit,1,7,2.5\n";

        List<Long> failedRows = new ArrayList<>();
        List<TransactionRecord> records = new ArrayList<>();
        try (TransactionCsvReader reader = reader(csv)) {
            Iterator<TransactionRecord> it = reader.iterator();
            while (it.hasNext()) {
                try {
                    records.add(it.next());
                } catch (RecordParseException e) {
                    failedRows.add(e.getRow());
                }
            }
        }

        assertEquals(List.of(1L, 2L, 3L, 4L, 5L, 6L), failedRows);
        assertEquals(List.of(TransactionRecord.deposit(1, 7, Amount.fromDecimalText("2.5"))), records);
    }

    @Test
    @DisplayName("Negative amounts parse; the processor decides whether they are valid")
    void testNegativeAmountParses() throws IOException {
        try (TransactionCsvReader reader = reader("type,client,tx,amount\ndeposit,1,1,-3\n")) {
            TransactionRecord record = reader.iterator().next();

            assertEquals(TransactionType.DEPOSIT, record.getType());
            assertTrue(record.getAmount().isNegative());
        }
    }

    @Test
    @DisplayName("Broken CSV structure is fatal")
    void testBrokenStructure() throws IOException {
        try (TransactionCsvReader reader = reader("type,client,tx,amount\ndeposit,1,1,1.0,extra\n")) {
            Iterator<TransactionRecord> it = reader.iterator();
            assertThrows(UncheckedIOException.class, () -> {
                while (it.hasNext()) {
                    it.next();
                }
            });
        }
    }

    @Test
    @DisplayName("Input can be iterated only once")
    void testSinglePass() throws IOException {
        try (TransactionCsvReader reader = reader("type,client,tx,amount\ndeposit,1,1,1.0\n")) {
            reader.iterator();
            assertThrows(IllegalStateException.class, reader::iterator);
        }
    }
}
