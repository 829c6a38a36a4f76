package com.flagship.transaction_engine.csv;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw input row, exactly as read from the file. Typed by {@link TransactionRecordMapper}.
 */
@Data
@NoArgsConstructor
@JsonPropertyOrder({"type", "client", "tx", "amount"})
public class TransactionCsvRow {
    private String type;
    private String client;
    private String tx;
    private String amount;
}
