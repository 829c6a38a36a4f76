package com.flagship.transaction_engine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under the {@code transaction-engine} prefix.
 */
@Data
@ConfigurationProperties(prefix = "transaction-engine")
public class TransactionEngineProperties {

    /**
     * Log every rejected or unparseable record at INFO. When false they are logged at DEBUG.
     */
    private boolean logRejections = true;

    private Runner runner = new Runner();

    @Data
    public static class Runner {
        /**
         * Process the file given on the command line at startup.
         */
        private boolean enabled = true;
    }
}
