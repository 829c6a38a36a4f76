package com.flagship.transaction_engine.csv;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.transaction_engine.account.Account;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders the final accounts as {@code client,available,held,total,locked} CSV.
 *
 * The header is always written, even when there are no accounts.
 * The target writer is flushed but left open.
 */
public class AccountSnapshotCsvWriter {

    private final CsvMapper csvMapper;
    private final CsvSchema schema;

    public AccountSnapshotCsvWriter(CsvMapper csvMapper) {
        this.csvMapper = csvMapper;
        this.schema = csvMapper.schemaFor(AccountCsvRow.class).withHeader();
    }

    public void write(List<Account> accounts, Writer out) throws IOException {
        if (accounts.isEmpty()) {
            // Jackson only emits the header together with the first row
            out.write(headerLine());
            out.flush();
            return;
        }
        try (SequenceWriter rows = csvMapper.writerFor(AccountCsvRow.class).with(schema).writeValues(out)) {
            for (Account account : accounts) {
                rows.write(AccountCsvRow.from(account));
            }
        }
        out.flush();
    }

    private String headerLine() {
        List<String> names = new ArrayList<>();
        for (CsvSchema.Column column : schema) {
            names.add(column.getName());
        }
        return String.join(String.valueOf(schema.getColumnSeparator()), names)
            + new String(schema.getLineSeparator());
    }
}
