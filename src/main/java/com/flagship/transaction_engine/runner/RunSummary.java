package com.flagship.transaction_engine.runner;

import lombok.Value;

/**
 * Counts for one processed input file.
 */
@Value
public class RunSummary {
    long rowsRead;
    long applied;
    long rejected;
    long unparseable;
    int accounts;
}
