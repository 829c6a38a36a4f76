package com.flagship.transaction_engine.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.flagship.transaction_engine.csv.AccountSnapshotCsvWriter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Jackson configuration for the CSV input and output.
 *
 * Key features:
 * - Whitespace around unquoted fields is ignored
 * - Blank lines are skipped
 * - Output values are quoted only when they contain CSV syntax
 * - Writing never closes the target stream (stdout stays usable)
 */
@Configuration
public class CsvConfig {

    @Bean
    public CsvMapper csvMapper() {
        CsvMapper mapper = new CsvMapper();

        mapper.enable(CsvParser.Feature.TRIM_SPACES);
        mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);

        mapper.enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING);
        mapper.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

        return mapper;
    }

    @Bean
    public AccountSnapshotCsvWriter accountSnapshotCsvWriter(CsvMapper csvMapper) {
        return new AccountSnapshotCsvWriter(csvMapper);
    }
}
